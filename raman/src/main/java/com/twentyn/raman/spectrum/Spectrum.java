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

import java.util.Arrays;

/**
 * One Raman spectrum: parallel wavenumber/intensity arrays plus the identifiers it was read under.
 * Instances are never modified; every processing stage returns a new spectrum via {@link #withIntensities}.
 */
public class Spectrum {
  private final String sampleId;
  private final String spectrumId;
  private final String grain;
  private final String location;
  private final double[] wavenumbers;
  private final double[] intensities;

  public Spectrum(String sampleId, String spectrumId, String grain, String location,
                  double[] wavenumbers, double[] intensities) {
    if (wavenumbers.length != intensities.length) {
      throw new IllegalArgumentException(String.format(
          "Wavenumber and intensity arrays differ in length: %d vs. %d", wavenumbers.length, intensities.length));
    }
    for (int i = 1; i < wavenumbers.length; i++) {
      if (!(wavenumbers[i] > wavenumbers[i - 1])) {
        throw new IllegalArgumentException(String.format(
            "Wavenumbers must be strictly increasing, but %f follows %f at index %d",
            wavenumbers[i], wavenumbers[i - 1], i));
      }
    }
    this.sampleId = sampleId;
    this.spectrumId = spectrumId;
    this.grain = grain;
    this.location = location;
    this.wavenumbers = wavenumbers.clone();
    this.intensities = intensities.clone();
  }

  public Spectrum(double[] wavenumbers, double[] intensities) {
    this("", "", "", "", wavenumbers, intensities);
  }

  /**
   * Splits a spectrum column name of the form grain_location into its two parts.  Names with no underscore are
   * treated as a grain with an empty location.
   */
  public static Spectrum fromColumn(String sampleId, String columnName, double[] wavenumbers, double[] intensities) {
    int split = columnName.indexOf('_');
    String grain = split < 0 ? columnName : columnName.substring(0, split);
    String location = split < 0 ? "" : columnName.substring(split + 1);
    return new Spectrum(sampleId, columnName, grain, location, wavenumbers, intensities);
  }

  public Spectrum withIntensities(double[] newIntensities) {
    return new Spectrum(sampleId, spectrumId, grain, location, wavenumbers, newIntensities);
  }

  public String getSampleId() {
    return sampleId;
  }

  public String getSpectrumId() {
    return spectrumId;
  }

  public String getGrain() {
    return grain;
  }

  public String getLocation() {
    return location;
  }

  public int size() {
    return wavenumbers.length;
  }

  public double[] getWavenumbers() {
    return wavenumbers.clone();
  }

  public double[] getIntensities() {
    return intensities.clone();
  }

  public double getWavenumber(int i) {
    return wavenumbers[i];
  }

  public double getIntensity(int i) {
    return intensities[i];
  }

  public double getMaxIntensity() {
    return Arrays.stream(intensities).max().orElse(0.0);
  }

  public double getMinIntensity() {
    return Arrays.stream(intensities).min().orElse(0.0);
  }

  /**
   * The mean distance between adjacent wavenumbers, used to convert widths in samples into cm^-1.
   */
  public double getAverageSpacing() {
    if (wavenumbers.length < 2) {
      return 1.0;
    }
    return (wavenumbers[wavenumbers.length - 1] - wavenumbers[0]) / (wavenumbers.length - 1);
  }

  /**
   * Maps a fractional sample position onto the wavenumber axis by linear interpolation, clamping to the ends.
   */
  public double wavenumberAt(double position) {
    if (position <= 0) {
      return wavenumbers[0];
    }
    int last = wavenumbers.length - 1;
    if (position >= last) {
      return wavenumbers[last];
    }
    int lo = (int) Math.floor(position);
    double frac = position - lo;
    return wavenumbers[lo] + frac * (wavenumbers[lo + 1] - wavenumbers[lo]);
  }

  public String getLabel() {
    return String.format("%s/%s", sampleId, spectrumId);
  }
}
