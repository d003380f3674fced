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

import org.apache.commons.math3.stat.StatUtils;

/**
 * Count, mean, sample standard deviation and coefficient of variation of one column.  A single value has a standard
 * deviation (and so a CV) of zero; an empty column has NaN everywhere.
 */
public class DescriptiveStats {
  private final int count;
  private final double mean;
  private final double std;

  private DescriptiveStats(int count, double mean, double std) {
    this.count = count;
    this.mean = mean;
    this.std = std;
  }

  public static DescriptiveStats of(double[] values) {
    if (values.length == 0) {
      return new DescriptiveStats(0, Double.NaN, Double.NaN);
    }
    double mean = StatUtils.mean(values);
    double std = values.length < 2 ? 0.0 : Math.sqrt(StatUtils.variance(values, mean));
    return new DescriptiveStats(values.length, mean, std);
  }

  public int getCount() {
    return count;
  }

  public double getMean() {
    return mean;
  }

  public double getStd() {
    return std;
  }

  /**
   * std / |mean| as a percentage; 0 when std is 0, NaN when the mean is 0 but the values vary.
   */
  public double getCoefficientOfVariation() {
    if (count == 0) {
      return Double.NaN;
    }
    if (std == 0.0) {
      return 0.0;
    }
    if (mean == 0.0) {
      return Double.NaN;
    }
    return std / Math.abs(mean) * 100.0;
  }
}
