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

package com.twentyn.raman.processing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Intensity scaling strategies applied after baseline correction.  Every strategy returns an all-zero array rather than
 * dividing by zero.
 */
public enum NormalizationMethod {
  MIN_MAX("minmax", Arrays.asList("min_max", "range")) {
    @Override
    double[] scale(double[] y, double[] x, int referenceIndex) {
      double min = Arrays.stream(y).min().orElse(0.0);
      double max = Arrays.stream(y).max().orElse(0.0);
      if (max == min) {
        return new double[y.length];
      }
      double[] out = new double[y.length];
      for (int i = 0; i < y.length; i++) {
        out[i] = (y[i] - min) / (max - min);
      }
      return out;
    }
  },
  AREA("area", Collections.singletonList("integral")) {
    @Override
    double[] scale(double[] y, double[] x, int referenceIndex) {
      return divide(y, Math.abs(trapezoid(y, x)));
    }
  },
  PEAK("peak", Arrays.asList("reference", "reference_peak", "max")) {
    @Override
    double[] scale(double[] y, double[] x, int referenceIndex) {
      double divisor = referenceIndex >= 0 && referenceIndex < y.length ?
          y[referenceIndex] : Arrays.stream(y).max().orElse(0.0);
      return divide(y, divisor);
    }
  },
  VECTOR("vector", Arrays.asList("l2", "euclidean", "norm")) {
    @Override
    double[] scale(double[] y, double[] x, int referenceIndex) {
      double sumSq = 0.0;
      for (double v : y) {
        sumSq += v * v;
      }
      return divide(y, Math.sqrt(sumSq));
    }
  },
  NONE("none", Arrays.asList("identity", "raw")) {
    @Override
    double[] scale(double[] y, double[] x, int referenceIndex) {
      return y.clone();
    }
  };

  private static final Logger LOGGER = LogManager.getFormatterLogger(NormalizationMethod.class);

  public static final NormalizationMethod FALLBACK = MIN_MAX;

  private final String configName;
  private final List<String> aliases;

  NormalizationMethod(String configName, List<String> aliases) {
    this.configName = configName;
    this.aliases = aliases;
  }

  /**
   * @param y Intensities to scale.
   * @param x Wavenumbers, or null to integrate with unit spacing.
   * @param referenceIndex Index of the reference peak for {@link #PEAK}; negative means use the maximum.
   */
  abstract double[] scale(double[] y, double[] x, int referenceIndex);

  @JsonValue
  public String getConfigName() {
    return configName;
  }

  @JsonCreator
  public static NormalizationMethod fromName(String name) {
    if (name != null) {
      String key = name.trim().toLowerCase();
      for (NormalizationMethod method : values()) {
        if (method.configName.equals(key) || method.name().toLowerCase().equals(key) || method.aliases.contains(key)) {
          return method;
        }
      }
    }
    LOGGER.warn("Unknown normalization method '%s', falling back to %s", name, FALLBACK.getConfigName());
    return FALLBACK;
  }

  static double trapezoid(double[] y, double[] x) {
    double area = 0.0;
    for (int i = 1; i < y.length; i++) {
      double dx = x == null ? 1.0 : x[i] - x[i - 1];
      area += 0.5 * (y[i] + y[i - 1]) * dx;
    }
    return area;
  }

  private static double[] divide(double[] y, double divisor) {
    if (divisor == 0.0 || !Double.isFinite(divisor)) {
      return new double[y.length];
    }
    double[] out = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      out[i] = y[i] / divisor;
    }
    return out;
  }
}
