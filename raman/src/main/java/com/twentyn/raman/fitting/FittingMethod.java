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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.math3.fitting.leastsquares.GaussNewtonOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Nonlinear least-squares strategies for the peak fitter.  Only {@link #TRUST_REGION} honours parameter bounds; the
 * other two run unconstrained.
 */
public enum FittingMethod {
  // Levenberg-Marquardt is itself a trust-region scheme; bounds are imposed by projecting each trial point.
  TRUST_REGION("trf", Arrays.asList("trust_region", "trust-region"), true) {
    @Override
    public LeastSquaresOptimizer createOptimizer(double tolerance) {
      return new LevenbergMarquardtOptimizer()
          .withCostRelativeTolerance(tolerance)
          .withParameterRelativeTolerance(tolerance)
          .withOrthoTolerance(tolerance);
    }
  },
  DOGLEG("dogbox", Arrays.asList("dogleg", "gauss_newton"), false) {
    @Override
    public LeastSquaresOptimizer createOptimizer(double tolerance) {
      return new GaussNewtonOptimizer(GaussNewtonOptimizer.Decomposition.QR);
    }
  },
  LEVENBERG_MARQUARDT("lm", Arrays.asList("levenberg_marquardt", "levenberg-marquardt"), false) {
    @Override
    public LeastSquaresOptimizer createOptimizer(double tolerance) {
      return new LevenbergMarquardtOptimizer()
          .withCostRelativeTolerance(tolerance)
          .withParameterRelativeTolerance(tolerance);
    }
  };

  private static final Logger LOGGER = LogManager.getFormatterLogger(FittingMethod.class);

  public static final FittingMethod FALLBACK = TRUST_REGION;

  private final String configName;
  private final List<String> aliases;
  private final boolean supportsBounds;

  FittingMethod(String configName, List<String> aliases, boolean supportsBounds) {
    this.configName = configName;
    this.aliases = aliases;
    this.supportsBounds = supportsBounds;
  }

  public abstract LeastSquaresOptimizer createOptimizer(double tolerance);

  public boolean supportsBounds() {
    return supportsBounds;
  }

  @JsonValue
  public String getConfigName() {
    return configName;
  }

  @JsonCreator
  public static FittingMethod fromName(String name) {
    if (name != null) {
      String key = name.trim().toLowerCase();
      for (FittingMethod method : values()) {
        if (method.configName.equals(key) || method.name().toLowerCase().equals(key) || method.aliases.contains(key)) {
          return method;
        }
      }
    }
    LOGGER.warn("Unknown fitting method '%s', falling back to %s", name, FALLBACK.getConfigName());
    return FALLBACK;
  }
}
