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
 * Zircon vibrational bands, in cm^-1.  The internal SiO4 modes and External-4 are closed intervals; the three low
 * frequency lattice modes are half-open so that they tile [195, 230) without overlap.
 */
public enum SpectralRegion {
  V3_SIO4("v3(SiO4)", 990.0, 1020.0, true),
  V1_SIO4("v1(SiO4)", 965.0, 985.0, true),
  V2_SIO4("v2(SiO4)", 430.0, 450.0, true),
  EXTERNAL_1("External-1", 195.0, 210.0, false),
  EXTERNAL_2("External-2", 210.0, 220.0, false),
  EXTERNAL_3("External-3", 220.0, 230.0, false),
  EXTERNAL_4("External-4", 350.0, 365.0, true);

  public static final String UNCLASSIFIED_LABEL = "unclassified";

  private final String label;
  private final double low;
  private final double high;
  private final boolean closed;

  SpectralRegion(String label, double low, double high, boolean closed) {
    this.label = label;
    this.low = low;
    this.high = high;
    this.closed = closed;
  }

  public boolean contains(double center) {
    if (center < low) {
      return false;
    }
    return closed ? center <= high : center < high;
  }

  public String getLabel() {
    return label;
  }

  public double getLow() {
    return low;
  }

  public double getHigh() {
    return high;
  }

  public boolean isClosed() {
    return closed;
  }

  public static SpectralRegion fromLabel(String label) {
    for (SpectralRegion region : values()) {
      if (region.label.equals(label)) {
        return region;
      }
    }
    throw new IllegalArgumentException(String.format("No spectral region labelled '%s'", label));
  }
}
