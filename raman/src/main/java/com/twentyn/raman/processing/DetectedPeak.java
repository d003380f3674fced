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

package com.twentyn.raman.processing;

/**
 * A local maximum that passed the locator's thresholds, with its half-maximum bounds.  Positions are fractional sample
 * indices; the half-max bounds and FWHM are also given in wavenumbers.
 */
public class DetectedPeak {
  private final int index;
  private final double wavenumber;
  private final double intensity;
  private final double prominence;
  private final double leftPosition;
  private final double rightPosition;
  private final double leftHalfMax;
  private final double rightHalfMax;
  private final double fwhm;
  private final boolean widthCorrected;

  public DetectedPeak(int index, double wavenumber, double intensity, double prominence,
                      double leftPosition, double rightPosition, double leftHalfMax, double rightHalfMax,
                      double fwhm, boolean widthCorrected) {
    this.index = index;
    this.wavenumber = wavenumber;
    this.intensity = intensity;
    this.prominence = prominence;
    this.leftPosition = leftPosition;
    this.rightPosition = rightPosition;
    this.leftHalfMax = leftHalfMax;
    this.rightHalfMax = rightHalfMax;
    this.fwhm = fwhm;
    this.widthCorrected = widthCorrected;
  }

  public int getIndex() {
    return index;
  }

  public double getWavenumber() {
    return wavenumber;
  }

  public double getIntensity() {
    return intensity;
  }

  public double getProminence() {
    return prominence;
  }

  public double getLeftPosition() {
    return leftPosition;
  }

  public double getRightPosition() {
    return rightPosition;
  }

  public double getWidthInSamples() {
    return rightPosition - leftPosition;
  }

  public double getLeftHalfMax() {
    return leftHalfMax;
  }

  public double getRightHalfMax() {
    return rightHalfMax;
  }

  public double getFwhm() {
    return fwhm;
  }

  /**
   * True when the raw half-max bounds were inverted or did not bracket the peak and had to be repaired.
   */
  public boolean isWidthCorrected() {
    return widthCorrected;
  }
}
