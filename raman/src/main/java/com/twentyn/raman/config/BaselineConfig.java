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
import com.twentyn.raman.baseline.BaselineMethod;

public class BaselineConfig {
  public static final BaselineMethod DEFAULT_METHOD = BaselineMethod.SPLINE;
  public static final double DEFAULT_LAMBDA = 1e5;
  public static final int DEFAULT_MAX_ITERATIONS = 50;
  public static final double DEFAULT_CONVERGENCE_RATIO = 1e-5;
  public static final int DEFAULT_POLYNOMIAL_DEGREE = 3;
  public static final double DEFAULT_SPLINE_SMOOTHING = 0.3;
  public static final int DEFAULT_SPLINE_RESOLUTION = 4;

  @JsonProperty("method")
  private final BaselineMethod method;

  // Penalty weight on the second difference of the reweighted least-squares baseline.
  @JsonProperty("lambda")
  private final double lambda;

  @JsonProperty("max_iterations")
  private final int maxIterations;

  @JsonProperty("convergence_ratio")
  private final double convergenceRatio;

  @JsonProperty("polynomial_degree")
  private final int polynomialDegree;

  // Fraction of the retained points each local fit of the spline baseline looks at.
  @JsonProperty("spline_smoothing")
  private final double splineSmoothing;

  @JsonProperty("spline_resolution")
  private final int splineResolution;

  @JsonCreator
  public BaselineConfig(@JsonProperty("method") BaselineMethod method,
                        @JsonProperty("lambda") Double lambda,
                        @JsonProperty("max_iterations") Integer maxIterations,
                        @JsonProperty("convergence_ratio") Double convergenceRatio,
                        @JsonProperty("polynomial_degree") Integer polynomialDegree,
                        @JsonProperty("spline_smoothing") Double splineSmoothing,
                        @JsonProperty("spline_resolution") Integer splineResolution) {
    this.method = method == null ? DEFAULT_METHOD : method;
    this.lambda = lambda == null ? DEFAULT_LAMBDA : lambda;
    this.maxIterations = maxIterations == null ? DEFAULT_MAX_ITERATIONS : maxIterations;
    this.convergenceRatio = convergenceRatio == null ? DEFAULT_CONVERGENCE_RATIO : convergenceRatio;
    this.polynomialDegree = polynomialDegree == null ? DEFAULT_POLYNOMIAL_DEGREE : polynomialDegree;
    this.splineSmoothing = splineSmoothing == null ? DEFAULT_SPLINE_SMOOTHING : splineSmoothing;
    this.splineResolution = splineResolution == null ? DEFAULT_SPLINE_RESOLUTION : splineResolution;
  }

  public static BaselineConfig defaults() {
    return new BaselineConfig(null, null, null, null, null, null, null);
  }

  public BaselineConfig withMethod(BaselineMethod newMethod) {
    return new BaselineConfig(newMethod, lambda, maxIterations, convergenceRatio, polynomialDegree,
        splineSmoothing, splineResolution);
  }

  public BaselineMethod getMethod() {
    return method;
  }

  public double getLambda() {
    return lambda;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public double getConvergenceRatio() {
    return convergenceRatio;
  }

  public int getPolynomialDegree() {
    return polynomialDegree;
  }

  public double getSplineSmoothing() {
    return splineSmoothing;
  }

  public int getSplineResolution() {
    return splineResolution;
  }
}
