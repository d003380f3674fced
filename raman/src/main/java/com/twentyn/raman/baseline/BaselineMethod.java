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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.twentyn.raman.config.BaselineConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The closed set of background estimation algorithms.  Each constant builds its own corrector from the parameters in
 * a {@link BaselineConfig}, so callers never branch on method names.
 */
public enum BaselineMethod {
  REWEIGHTED_LEAST_SQUARES("rls", Arrays.asList("arpls", "als", "reweighted_least_squares")) {
    @Override
    public BaselineCorrector createCorrector(BaselineConfig config) {
      return new ReweightedLeastSquaresBaseline(
          config.getLambda(), config.getMaxIterations(), config.getConvergenceRatio());
    }
  },
  POLYNOMIAL("polynomial", Arrays.asList("poly", "polyfit")) {
    @Override
    public BaselineCorrector createCorrector(BaselineConfig config) {
      return new PolynomialBaseline(config.getPolynomialDegree());
    }
  },
  SPLINE("spline", Collections.singletonList("smoothing_spline")) {
    @Override
    public BaselineCorrector createCorrector(BaselineConfig config) {
      return new SplineBaseline(config.getSplineSmoothing(), config.getSplineResolution());
    }
  };

  private static final Logger LOGGER = LogManager.getFormatterLogger(BaselineMethod.class);

  public static final BaselineMethod FALLBACK = SPLINE;

  private final String configName;
  private final List<String> aliases;

  BaselineMethod(String configName, List<String> aliases) {
    this.configName = configName;
    this.aliases = aliases;
  }

  public abstract BaselineCorrector createCorrector(BaselineConfig config);

  @JsonValue
  public String getConfigName() {
    return configName;
  }

  /**
   * Resolves a method name from a config file or the command line.  Unrecognized names do not fail: they resolve to
   * {@link #FALLBACK} with a warning.
   */
  @JsonCreator
  public static BaselineMethod fromName(String name) {
    if (name != null) {
      String key = name.trim().toLowerCase();
      for (BaselineMethod method : values()) {
        if (method.configName.equals(key) || method.name().toLowerCase().equals(key) || method.aliases.contains(key)) {
          return method;
        }
      }
    }
    LOGGER.warn("Unknown baseline method '%s', falling back to %s", name, FALLBACK.getConfigName());
    return FALLBACK;
  }
}
