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

package com.twentyn.raman.classification;

/**
 * Metamictization classes by FWHM of the fitted band, with the inclusive upper FWHM bound of each class.
 */
public enum DamageCategory {
  LOW("low damage", 8.0),
  MODERATE("moderate damage", 14.5),
  HIGH("high damage", 25.0),
  NEAR_AMORPHOUS("near-amorphous", Double.POSITIVE_INFINITY);

  private final String label;
  private final double maxFwhm;

  DamageCategory(String label, double maxFwhm) {
    this.label = label;
    this.maxFwhm = maxFwhm;
  }

  public String getLabel() {
    return label;
  }

  public double getMaxFwhm() {
    return maxFwhm;
  }

  public static DamageCategory forFwhm(double fwhm) {
    for (DamageCategory category : values()) {
      if (fwhm <= category.maxFwhm) {
        return category;
      }
    }
    // Only NaN gets here.
    return NEAR_AMORPHOUS;
  }
}
