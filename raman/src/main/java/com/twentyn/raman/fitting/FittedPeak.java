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

package com.twentyn.raman.fitting;

/**
 * Parameters and diagnostics of one Gaussian-plus-offset fit.
 */
public class FittedPeak {
  public static final double FWHM_PER_SIGMA = 2.355;
  private static final double SQRT_TWO_PI = Math.sqrt(2.0 * Math.PI);

  private final double amplitude;
  private final double center;
  private final double sigma;
  private final double offset;
  private final double numericalArea;
  private final double rSquared;
  private final double reducedChiSquare;
  private final double windowStart;
  private final double windowEnd;
  private final int pointCount;
  private final boolean widthCorrected;

  public FittedPeak(double amplitude, double center, double sigma, double offset, double numericalArea,
                    double rSquared, double reducedChiSquare, double windowStart, double windowEnd,
                    int pointCount, boolean widthCorrected) {
    if (amplitude < 0) {
      throw new IllegalArgumentException(String.format("Amplitude must be non-negative, got %f", amplitude));
    }
    if (!(sigma > 0)) {
      throw new IllegalArgumentException(String.format("Sigma must be positive, got %f", sigma));
    }
    this.amplitude = amplitude;
    this.center = center;
    this.sigma = sigma;
    this.offset = offset;
    this.numericalArea = numericalArea;
    this.rSquared = rSquared;
    this.reducedChiSquare = reducedChiSquare;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
    this.pointCount = pointCount;
    this.widthCorrected = widthCorrected;
  }

  public double getAmplitude() {
    return amplitude;
  }

  public double getCenter() {
    return center;
  }

  public double getSigma() {
    return sigma;
  }

  public double getOffset() {
    return offset;
  }

  public double getFwhm() {
    return FWHM_PER_SIGMA * sigma;
  }

  public double getAnalyticalArea() {
    return amplitude * sigma * SQRT_TWO_PI;
  }

  public double getNumericalArea() {
    return numericalArea;
  }

  public double getRSquared() {
    return rSquared;
  }

  public double getReducedChiSquare() {
    return reducedChiSquare;
  }

  public double getWindowStart() {
    return windowStart;
  }

  public double getWindowEnd() {
    return windowEnd;
  }

  public int getPointCount() {
    return pointCount;
  }

  public boolean isWidthCorrected() {
    return widthCorrected;
  }

  public double valueAt(double x) {
    double z = (x - center) / sigma;
    return amplitude * Math.exp(-0.5 * z * z) + offset;
  }
}
