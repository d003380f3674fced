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

package com.twentyn.raman.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.raman.fitting.FittingMethod;

public class FittingConfig {
  public static final FittingMethod DEFAULT_METHOD = FittingMethod.TRUST_REGION;
  public static final double DEFAULT_TOLERANCE = 1e-10;
  public static final int DEFAULT_MAX_ITERATIONS = 2000;
  public static final int DEFAULT_MAX_EVALUATIONS = 10000;

  @JsonProperty("method")
  private final FittingMethod method;

  @JsonProperty("tolerance")
  private final double tolerance;

  @JsonProperty("max_iterations")
  private final int maxIterations;

  @JsonProperty("max_evaluations")
  private final int maxEvaluations;

  @JsonCreator
  public FittingConfig(@JsonProperty("method") FittingMethod method,
                       @JsonProperty("tolerance") Double tolerance,
                       @JsonProperty("max_iterations") Integer maxIterations,
                       @JsonProperty("max_evaluations") Integer maxEvaluations) {
    this.method = method == null ? DEFAULT_METHOD : method;
    this.tolerance = tolerance == null ? DEFAULT_TOLERANCE : tolerance;
    this.maxIterations = maxIterations == null ? DEFAULT_MAX_ITERATIONS : maxIterations;
    this.maxEvaluations = maxEvaluations == null ? DEFAULT_MAX_EVALUATIONS : maxEvaluations;
  }

  public static FittingConfig defaults() {
    return new FittingConfig(null, null, null, null);
  }

  public FittingMethod getMethod() {
    return method;
  }

  public double getTolerance() {
    return tolerance;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }
}
