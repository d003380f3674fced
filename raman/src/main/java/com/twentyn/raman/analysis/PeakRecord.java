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

package com.twentyn.raman.analysis;

import com.twentyn.raman.classification.DamageCategory;
import com.twentyn.raman.classification.SpectralRegion;
import com.twentyn.raman.fitting.FittedPeak;

import java.util.Optional;

/**
 * One row of a result table: a fitted peak together with where it came from and how it was classified.
 */
public class PeakRecord {
  private final String sampleId;
  private final String spectrumId;
  private final String grain;
  private final String location;
  // 1-based, in order of successful fits within the spectrum.
  private final int peakIndex;
  private final FittedPeak peak;
  private final SpectralRegion region;
  private final DamageCategory damageCategory;
  private final double estimatedDose;

  public PeakRecord(String sampleId, String spectrumId, String grain, String location, int peakIndex,
                    FittedPeak peak, SpectralRegion region, DamageCategory damageCategory, double estimatedDose) {
    this.sampleId = sampleId;
    this.spectrumId = spectrumId;
    this.grain = grain;
    this.location = location;
    this.peakIndex = peakIndex;
    this.peak = peak;
    this.region = region;
    this.damageCategory = damageCategory;
    this.estimatedDose = estimatedDose;
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

  public int getPeakIndex() {
    return peakIndex;
  }

  public FittedPeak getPeak() {
    return peak;
  }

  public Optional<SpectralRegion> getRegion() {
    return Optional.ofNullable(region);
  }

  public String getRegionLabel() {
    return region == null ? SpectralRegion.UNCLASSIFIED_LABEL : region.getLabel();
  }

  public DamageCategory getDamageCategory() {
    return damageCategory;
  }

  public double getEstimatedDose() {
    return estimatedDose;
  }

  public double getFwhm() {
    return peak.getFwhm();
  }

  public double getRSquared() {
    return peak.getRSquared();
  }

  public double getCenter() {
    return peak.getCenter();
  }
}
