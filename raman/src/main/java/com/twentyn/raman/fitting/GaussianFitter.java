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

import com.twentyn.raman.config.FittingConfig;
import com.twentyn.raman.processing.DetectedPeak;
import com.twentyn.raman.spectrum.Spectrum;
import org.apache.commons.math3.analysis.function.Gaussian;
import org.apache.commons.math3.analysis.integration.SimpsonIntegrator;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.SimpleVectorValueChecker;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fits G(x) = A * exp(-(x - mu)^2 / (2 sigma^2)) + c to a window around one detected peak.
 *
 * The window spans the peak's half-maximum bounds plus 20% of its width on each side, clipped to the spectrum.  With
 * the trust-region method every trial point is projected back into
 * 0 <= A <= min(1, 2 A0), 0 < sigma <= width, mu inside the window, -0.1 <= c <= 0.1.
 */
public class GaussianFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GaussianFitter.class);

  public static final int MIN_WINDOW_POINTS = 5;
  public static final double WINDOW_MARGIN_FRACTION = 0.2;
  public static final double MAX_AMPLITUDE = 1.0;
  public static final double MAX_ABS_OFFSET = 0.1;
  // Degrees of freedom consumed by A, mu, sigma and c.
  public static final int MODEL_PARAMETERS = 4;

  private static final double SIGMA_FLOOR = 1e-9;
  private static final int INTEGRATION_MAX_EVALUATIONS = 100000;

  private static final int A = 0;
  private static final int MU = 1;
  private static final int SIGMA = 2;
  private static final int C = 3;

  public FitOutcome fit(Spectrum spectrum, DetectedPeak peak, FittingConfig config) {
    double width = peak.getFwhm();
    if (!(width > 0)) {
      return FitOutcome.failure(String.format("peak at %.2f has non-positive width %.4f", peak.getWavenumber(), width));
    }

    double lo = Math.max(spectrum.getWavenumber(0), peak.getLeftHalfMax() - WINDOW_MARGIN_FRACTION * width);
    double hi = Math.min(spectrum.getWavenumber(spectrum.size() - 1),
        peak.getRightHalfMax() + WINDOW_MARGIN_FRACTION * width);

    int first = -1;
    int last = -1;
    for (int i = 0; i < spectrum.size(); i++) {
      double x = spectrum.getWavenumber(i);
      if (x >= lo && x <= hi) {
        if (first < 0) {
          first = i;
        }
        last = i;
      }
    }
    int n = first < 0 ? 0 : last - first + 1;
    if (n < MIN_WINDOW_POINTS) {
      return FitOutcome.failure(String.format("only %d samples in fit window [%.2f, %.2f] for peak at %.2f",
          n, lo, hi, peak.getWavenumber()));
    }

    double[] x = new double[n];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = spectrum.getWavenumber(first + i);
      y[i] = spectrum.getIntensity(first + i);
    }

    double initialAmplitude = peak.getIntensity();
    if (!(initialAmplitude > 0)) {
      return FitOutcome.failure(String.format("peak at %.2f has non-positive intensity", peak.getWavenumber()));
    }
    double[] lower = {0.0, x[0], SIGMA_FLOOR, -MAX_ABS_OFFSET};
    double[] upper = {Math.min(MAX_AMPLITUDE, 2.0 * initialAmplitude), x[n - 1], width, MAX_ABS_OFFSET};
    double[] start = {initialAmplitude, peak.getWavenumber(), width / FittedPeak.FWHM_PER_SIGMA, 0.0};
    FittingMethod method = config.getMethod();
    if (method.supportsBounds()) {
      start = project(start, lower, upper);
    }

    RealVector solution;
    try {
      LeastSquaresBuilder builder = new LeastSquaresBuilder()
          .start(start)
          .model(model(x))
          .target(y)
          .lazyEvaluation(false)
          .maxEvaluations(config.getMaxEvaluations())
          .maxIterations(config.getMaxIterations())
          .checker(LeastSquaresFactory.evaluationChecker(
              new SimpleVectorValueChecker(config.getTolerance(), config.getTolerance())));
      if (method.supportsBounds()) {
        builder.parameterValidator(boundsValidator(lower, upper));
      }
      LeastSquaresOptimizer.Optimum optimum = method.createOptimizer(config.getTolerance()).optimize(builder.build());
      solution = optimum.getPoint();
      LOGGER.debug("Fit of peak at %.2f converged in %d iterations", peak.getWavenumber(), optimum.getIterations());
    } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
      return FitOutcome.failure(String.format("optimizer failed for peak at %.2f: %s",
          peak.getWavenumber(), e.getMessage()));
    }

    double[] p = solution.toArray();
    if (method.supportsBounds()) {
      p = project(p, lower, upper);
    } else {
      // The model is symmetric in sigma, so an unconstrained solver may land on its negative.
      p[SIGMA] = Math.abs(p[SIGMA]);
    }
    for (double v : p) {
      if (!Double.isFinite(v)) {
        return FitOutcome.failure(String.format("non-finite parameters for peak at %.2f", peak.getWavenumber()));
      }
    }
    if (p[A] < 0) {
      return FitOutcome.failure(String.format("negative amplitude %.4f for peak at %.2f", p[A], peak.getWavenumber()));
    }
    if (!(p[SIGMA] > 0)) {
      return FitOutcome.failure(String.format("collapsed sigma for peak at %.2f", peak.getWavenumber()));
    }

    return FitOutcome.success(buildPeak(x, y, p, lo, hi, peak.isWidthCorrected()));
  }

  private FittedPeak buildPeak(double[] x, double[] y, double[] p, double lo, double hi, boolean widthCorrected) {
    int n = x.length;
    double mean = 0.0;
    for (double v : y) {
      mean += v;
    }
    mean /= n;

    double ssRes = 0.0;
    double ssTot = 0.0;
    for (int i = 0; i < n; i++) {
      double z = (x[i] - p[MU]) / p[SIGMA];
      double fitted = p[A] * Math.exp(-0.5 * z * z) + p[C];
      ssRes += (y[i] - fitted) * (y[i] - fitted);
      ssTot += (y[i] - mean) * (y[i] - mean);
    }

    double rSquared;
    if (ssTot > 0) {
      rSquared = 1.0 - ssRes / ssTot;
    } else {
      rSquared = ssRes == 0.0 ? 1.0 : 0.0;
    }

    double variance = ssTot / n;
    double reducedChiSquare = variance > 0 ?
        (ssRes / variance) / Math.max(1, n - MODEL_PARAMETERS) : Double.NaN;

    return new FittedPeak(p[A], p[MU], p[SIGMA], p[C], integrate(p, lo, hi), rSquared, reducedChiSquare,
        lo, hi, n, widthCorrected);
  }

  /**
   * Area under the fitted curve minus its offset across the fit window.
   */
  static double integrate(double[] p, double lo, double hi) {
    if (p[A] == 0.0 || !(hi > lo)) {
      return 0.0;
    }
    try {
      return new SimpsonIntegrator().integrate(INTEGRATION_MAX_EVALUATIONS, new Gaussian(p[A], p[MU], p[SIGMA]), lo, hi);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      LOGGER.debug("Simpson integration failed (%s); using the closed form", e.getMessage());
      double scale = p[SIGMA] * Math.sqrt(2.0);
      return p[A] * p[SIGMA] * Math.sqrt(Math.PI / 2.0) * Erf.erf((lo - p[MU]) / scale, (hi - p[MU]) / scale);
    }
  }

  static MultivariateJacobianFunction model(final double[] x) {
    return new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double a = point.getEntry(A);
        double mu = point.getEntry(MU);
        double sigma = point.getEntry(SIGMA);
        double c = point.getEntry(C);
        double sigma2 = sigma * sigma;

        RealVector value = new ArrayRealVector(x.length);
        RealMatrix jacobian = new Array2DRowRealMatrix(x.length, MODEL_PARAMETERS);
        for (int i = 0; i < x.length; i++) {
          double dx = x[i] - mu;
          double e = Math.exp(-dx * dx / (2.0 * sigma2));
          value.setEntry(i, a * e + c);
          jacobian.setEntry(i, A, e);
          jacobian.setEntry(i, MU, a * e * dx / sigma2);
          jacobian.setEntry(i, SIGMA, a * e * dx * dx / (sigma2 * sigma));
          jacobian.setEntry(i, C, 1.0);
        }
        return new Pair<>(value, jacobian);
      }
    };
  }

  static ParameterValidator boundsValidator(final double[] lower, final double[] upper) {
    return new ParameterValidator() {
      @Override
      public RealVector validate(RealVector params) {
        return new ArrayRealVector(project(params.toArray(), lower, upper), false);
      }
    };
  }

  static double[] project(double[] p, double[] lower, double[] upper) {
    double[] out = new double[p.length];
    for (int i = 0; i < p.length; i++) {
      out[i] = Math.max(lower[i], Math.min(upper[i], p[i]));
    }
    return out;
  }
}
