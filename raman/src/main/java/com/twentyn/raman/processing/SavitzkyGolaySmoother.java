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

import com.twentyn.raman.config.SmoothingConfig;
import com.twentyn.raman.spectrum.Spectrum;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Savitzky-Golay smoothing: every sample is replaced by the value at its centre of a least-squares polynomial fit over
 * the surrounding window.  The first and last half-windows are evaluated from the polynomial fitted to the first and
 * last full window, so the output keeps the input's length without padding.
 *
 * Smoothed intensities are clamped at zero and rescaled into [0, 1] if they overshoot, since ringing around sharp
 * peaks can push a normalized spectrum slightly out of range.
 */
public class SavitzkyGolaySmoother {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SavitzkyGolaySmoother.class);

  public Spectrum smooth(Spectrum spectrum, SmoothingConfig config) {
    return spectrum.withIntensities(smooth(spectrum.getIntensities(), config.getWindowLength(), config.getPolyOrder()));
  }

  public double[] smooth(double[] y, int requestedWindow, int requestedOrder) {
    int n = y.length;
    int order = Math.max(0, requestedOrder);
    if (n < order + 2) {
      LOGGER.debug("Spectrum of %d points is too short to smooth with order %d", n, order);
      return y.clone();
    }

    int window = requestedWindow % 2 == 0 ? requestedWindow + 1 : requestedWindow;
    if (window > n) {
      window = n % 2 == 0 ? n - 1 : n;
    }
    if (order >= window) {
      order = window - 1;
    }
    if (window != requestedWindow || order != requestedOrder) {
      LOGGER.debug("Adjusted smoothing window/order from %d/%d to %d/%d for %d points",
          requestedWindow, requestedOrder, window, order, n);
    }
    if (window < 3) {
      return clampAndRescale(y.clone());
    }

    int half = window / 2;
    RealMatrix projection = polynomialProjection(window, order);
    double[] centre = projection.getRow(0);

    double[] out = new double[n];
    for (int i = half; i < n - half; i++) {
      double s = 0.0;
      for (int k = 0; k < window; k++) {
        s += centre[k] * y[i - half + k];
      }
      out[i] = s;
    }

    double[] headCoefficients = projection.operate(slice(y, 0, window));
    for (int i = 0; i < half; i++) {
      out[i] = evaluate(headCoefficients, i - half);
    }
    double[] tailCoefficients = projection.operate(slice(y, n - window, window));
    for (int i = n - half; i < n; i++) {
      out[i] = evaluate(tailCoefficients, i - (n - 1 - half));
    }

    return clampAndRescale(out);
  }

  /**
   * The pseudo-inverse of the window's Vandermonde matrix: multiplying it by a window of samples yields the polynomial
   * coefficients, lowest power first, in coordinates centred on the window.
   */
  static RealMatrix polynomialProjection(int window, int order) {
    int half = window / 2;
    double[][] vandermonde = new double[window][order + 1];
    for (int row = 0; row < window; row++) {
      double t = row - half;
      double power = 1.0;
      for (int col = 0; col <= order; col++) {
        vandermonde[row][col] = power;
        power *= t;
      }
    }
    return new SingularValueDecomposition(new Array2DRowRealMatrix(vandermonde, false)).getSolver().getInverse();
  }

  private static double evaluate(double[] coefficients, double t) {
    double value = 0.0;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      value = value * t + coefficients[k];
    }
    return value;
  }

  private static double[] slice(double[] y, int from, int length) {
    double[] out = new double[length];
    System.arraycopy(y, from, out, 0, length);
    return out;
  }

  static double[] clampAndRescale(double[] y) {
    double max = 0.0;
    for (int i = 0; i < y.length; i++) {
      if (y[i] < 0) {
        y[i] = 0.0;
      }
      max = Math.max(max, y[i]);
    }
    if (max > 1.0) {
      for (int i = 0; i < y.length; i++) {
        y[i] /= max;
      }
    }
    return y;
  }
}
