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
 * How strongly the choice of normalization moves the width statistics under a fixed baseline method.
 */
public enum ImpactLevel {
  MINIMAL("minimal", 0.5, 1.0),
  LOW("low", 1.0, 2.5),
  MODERATE("moderate", 2.0, 5.0),
  HIGH("high", Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);

  private final String label;
  private final double fwhmLimit;
  private final double cvLimit;

  ImpactLevel(String label, double fwhmLimit, double cvLimit) {
    this.label = label;
    this.fwhmLimit = fwhmLimit;
    this.cvLimit = cvLimit;
  }

  public String getLabel() {
    return label;
  }

  /**
   * The first level whose strict limits both spreads fall under.
   */
  public static ImpactLevel classify(double deltaFwhm, double deltaCv) {
    for (ImpactLevel level : values()) {
      if (deltaFwhm < level.fwhmLimit && deltaCv < level.cvLimit) {
        return level;
      }
    }
    return HIGH;
  }
}
