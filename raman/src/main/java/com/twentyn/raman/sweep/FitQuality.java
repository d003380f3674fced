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

/**
 * Buckets for R^2 in the fit-quality histogram: excellent above 0.9, good from 0.7 to 0.9, fair from 0.3 up to 0.7,
 * poor below 0.3.
 */
public enum FitQuality {
  EXCELLENT("excellent"),
  GOOD("good"),
  FAIR("fair"),
  POOR("poor");

  private final String label;

  FitQuality(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static FitQuality of(double rSquared) {
    if (rSquared > 0.9) {
      return EXCELLENT;
    }
    if (rSquared >= 0.7) {
      return GOOD;
    }
    if (rSquared >= 0.3) {
      return FAIR;
    }
    return POOR;
  }
}
