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

/**
 * Thresholds used by {@link OutlierDetector}.  Peaks in a known region get the full battery of tests; unclassified
 * peaks only the fit-quality and width limits, which are stricter.
 */
public class OutlierCriteria {
  public static final double DEFAULT_MIN_R_SQUARED = 0.3;
  public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
  public static final int DEFAULT_MIN_IQR_COUNT = 4;
  public static final double DEFAULT_Z_THRESHOLD = 3.0;
  public static final int DEFAULT_MIN_Z_COUNT = 3;
  public static final double DEFAULT_MAX_FWHM = 60.0;
  public static final double DEFAULT_UNCLASSIFIED_MIN_R_SQUARED = 0.5;
  public static final double DEFAULT_UNCLASSIFIED_MAX_FWHM = 50.0;

  private static final OutlierCriteria DEFAULTS = new OutlierCriteria(
      DEFAULT_MIN_R_SQUARED, DEFAULT_IQR_MULTIPLIER, DEFAULT_MIN_IQR_COUNT, DEFAULT_Z_THRESHOLD, DEFAULT_MIN_Z_COUNT,
      DEFAULT_MAX_FWHM, DEFAULT_UNCLASSIFIED_MIN_R_SQUARED, DEFAULT_UNCLASSIFIED_MAX_FWHM);

  private final double minRSquared;
  private final double iqrMultiplier;
  private final int minIqrCount;
  private final double zThreshold;
  private final int minZCount;
  private final double maxFwhm;
  private final double unclassifiedMinRSquared;
  private final double unclassifiedMaxFwhm;

  public OutlierCriteria(double minRSquared, double iqrMultiplier, int minIqrCount, double zThreshold, int minZCount,
                         double maxFwhm, double unclassifiedMinRSquared, double unclassifiedMaxFwhm) {
    this.minRSquared = minRSquared;
    this.iqrMultiplier = iqrMultiplier;
    this.minIqrCount = minIqrCount;
    this.zThreshold = zThreshold;
    this.minZCount = minZCount;
    this.maxFwhm = maxFwhm;
    this.unclassifiedMinRSquared = unclassifiedMinRSquared;
    this.unclassifiedMaxFwhm = unclassifiedMaxFwhm;
  }

  public static OutlierCriteria defaults() {
    return DEFAULTS;
  }

  public double getMinRSquared() {
    return minRSquared;
  }

  public double getIqrMultiplier() {
    return iqrMultiplier;
  }

  public int getMinIqrCount() {
    return minIqrCount;
  }

  public double getZThreshold() {
    return zThreshold;
  }

  public int getMinZCount() {
    return minZCount;
  }

  public double getMaxFwhm() {
    return maxFwhm;
  }

  public double getUnclassifiedMinRSquared() {
    return unclassifiedMinRSquared;
  }

  public double getUnclassifiedMaxFwhm() {
    return unclassifiedMaxFwhm;
  }
}
