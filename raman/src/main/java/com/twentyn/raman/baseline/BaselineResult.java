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

package com.twentyn.raman.baseline;

public class BaselineResult {
  private final double[] corrected;
  private final double[] baseline;

  public BaselineResult(double[] corrected, double[] baseline) {
    this.corrected = corrected;
    this.baseline = baseline;
  }

  /**
   * Plain raw-minus-baseline correction, used by every method that does no post-scaling of its own.
   */
  public static BaselineResult subtract(double[] intensities, double[] baseline) {
    double[] corrected = new double[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      corrected[i] = intensities[i] - baseline[i];
    }
    return new BaselineResult(corrected, baseline);
  }

  public double[] getCorrected() {
    return corrected.clone();
  }

  public double[] getBaseline() {
    return baseline.clone();
  }
}
