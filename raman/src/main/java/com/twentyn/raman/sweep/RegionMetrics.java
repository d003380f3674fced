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

package com.twentyn.raman.sweep;

import com.twentyn.raman.analysis.DescriptiveStats;
import com.twentyn.raman.analysis.PeakRecord;
import com.twentyn.raman.analysis.ResultTable;
import com.twentyn.raman.classification.SpectralRegion;

import java.util.List;

/**
 * Peak statistics for one region under one preprocessing combination, summarized by a composite score that rewards
 * consistent widths, good fits and stable positions.
 */
public class RegionMetrics {
  public static final double FWHM_CONSISTENCY_WEIGHT = 0.4;
  public static final double FIT_QUALITY_WEIGHT = 0.3;
  public static final double POSITION_STABILITY_WEIGHT = 0.3;

  private final SpectralRegion region;
  private final DescriptiveStats rSquared;
  private final DescriptiveStats fwhm;
  private final DescriptiveStats center;
  private final DescriptiveStats area;
  private final double compositeScore;

  public RegionMetrics(SpectralRegion region, DescriptiveStats rSquared, DescriptiveStats fwhm,
                       DescriptiveStats center, DescriptiveStats area) {
    this.region = region;
    this.rSquared = rSquared;
    this.fwhm = fwhm;
    this.center = center;
    this.area = area;
    this.compositeScore = compositeScore(fwhm.getCoefficientOfVariation(), rSquared.getMean(),
        center.getCoefficientOfVariation());
  }

  public static RegionMetrics compute(SpectralRegion region, List<PeakRecord> records) {
    return new RegionMetrics(region,
        DescriptiveStats.of(ResultTable.column(records, PeakRecord::getRSquared)),
        DescriptiveStats.of(ResultTable.column(records, PeakRecord::getFwhm)),
        DescriptiveStats.of(ResultTable.column(records, PeakRecord::getCenter)),
        DescriptiveStats.of(ResultTable.column(records, r -> r.getPeak().getAnalyticalArea())));
  }

  /**
   * NaN whenever an input is NaN, which is the case for an empty region.
   */
  public static double compositeScore(double fwhmCv, double meanRSquared, double centerCv) {
    return FWHM_CONSISTENCY_WEIGHT * (1.0 - fwhmCv / 100.0)
        + FIT_QUALITY_WEIGHT * meanRSquared
        + POSITION_STABILITY_WEIGHT * (1.0 - centerCv / 100.0);
  }

  public SpectralRegion getRegion() {
    return region;
  }

  public int getCount() {
    return fwhm.getCount();
  }

  public DescriptiveStats getRSquared() {
    return rSquared;
  }

  public DescriptiveStats getFwhm() {
    return fwhm;
  }

  public DescriptiveStats getCenter() {
    return center;
  }

  public DescriptiveStats getArea() {
    return area;
  }

  public double getCompositeScore() {
    return compositeScore;
  }
}
