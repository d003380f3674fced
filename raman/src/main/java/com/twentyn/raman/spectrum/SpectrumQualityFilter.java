/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.raman.spectrum;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Screens a raw spectrum before it enters the pipeline.  Spectra that are mostly missing or mostly zero are rejected
 * outright; otherwise any missing points are dropped so downstream stages only ever see finite intensities.
 */
public class SpectrumQualityFilter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumQualityFilter.class);

  public static final double MAX_MISSING_FRACTION = 0.5;
  public static final double MAX_ZERO_FRACTION = 0.5;
  // Fewer points than this cannot be smoothed or fit in any meaningful way.
  public static final int MIN_POINTS = 5;

  private SpectrumQualityFilter() {
  }

  public static Optional<Spectrum> screen(Spectrum spectrum) {
    int n = spectrum.size();
    if (n < MIN_POINTS) {
      LOGGER.warn("Skipping spectrum %s: only %d points", spectrum.getLabel(), n);
      return Optional.empty();
    }

    int missing = 0;
    int zeros = 0;
    for (int i = 0; i < n; i++) {
      double v = spectrum.getIntensity(i);
      if (!Double.isFinite(v)) {
        missing++;
      } else if (v == 0.0) {
        zeros++;
      }
    }

    if ((double) missing / n > MAX_MISSING_FRACTION) {
      LOGGER.warn("Skipping spectrum %s: %d of %d intensities are missing", spectrum.getLabel(), missing, n);
      return Optional.empty();
    }
    if ((double) zeros / n > MAX_ZERO_FRACTION) {
      LOGGER.warn("Skipping spectrum %s: %d of %d intensities are zero", spectrum.getLabel(), zeros, n);
      return Optional.empty();
    }
    if (missing == 0) {
      return Optional.of(spectrum);
    }

    int kept = n - missing;
    if (kept < MIN_POINTS) {
      LOGGER.warn("Skipping spectrum %s: only %d finite points", spectrum.getLabel(), kept);
      return Optional.empty();
    }
    double[] x = new double[kept];
    double[] y = new double[kept];
    int j = 0;
    for (int i = 0; i < n; i++) {
      double v = spectrum.getIntensity(i);
      if (Double.isFinite(v)) {
        x[j] = spectrum.getWavenumber(i);
        y[j] = v;
        j++;
      }
    }
    LOGGER.debug("Dropped %d missing points from spectrum %s", missing, spectrum.getLabel());
    return Optional.of(new Spectrum(spectrum.getSampleId(), spectrum.getSpectrumId(), spectrum.getGrain(),
        spectrum.getLocation(), x, y));
  }
}
