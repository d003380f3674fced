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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Asymmetrically reweighted penalized least squares.  Each iteration solves (W + lambda * D * D^T) z = W y and then
 * re-derives W from the residuals: anything above the current baseline is treated as peak and ignored, anything at
 * or below it is weighted exponentially against a threshold derived from the negative residuals.
 */
public class ReweightedLeastSquaresBaseline implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReweightedLeastSquaresBaseline.class);

  private final double lambda;
  private final int maxIterations;
  private final double convergenceRatio;

  public ReweightedLeastSquaresBaseline(double lambda, int maxIterations, double convergenceRatio) {
    this.lambda = lambda;
    this.maxIterations = Math.max(1, maxIterations);
    this.convergenceRatio = convergenceRatio;
  }

  @Override
  public BaselineResult estimate(double[] wavenumbers, double[] intensities) {
    int n = intensities.length;
    if (n < 3) {
      // No second difference exists; the spectrum is its own baseline.
      return BaselineResult.subtract(intensities, intensities.clone());
    }

    double[][] penalty = BandedSymmetricSolver.secondDifferencePenalty(n);
    double[] weights = new double[n];
    Arrays.fill(weights, 1.0);
    double[] z = intensities.clone();

    int iteration = 0;
    while (iteration < maxIterations) {
      iteration++;
      z = solve(penalty, weights, intensities);

      double[] residuals = new double[n];
      int negativeCount = 0;
      for (int i = 0; i < n; i++) {
        residuals[i] = intensities[i] - z[i];
        if (residuals[i] < 0) {
          negativeCount++;
        }
      }
      if (negativeCount < 2) {
        LOGGER.debug("Stopping after %d iterations: fewer than two points below the baseline", iteration);
        break;
      }

      double[] negatives = new double[negativeCount];
      int j = 0;
      for (double d : residuals) {
        if (d < 0) {
          negatives[j++] = d;
        }
      }
      double mean = StatUtils.mean(negatives);
      double std = Math.sqrt(StatUtils.populationVariance(negatives, mean));
      if (!(std > 0)) {
        break;
      }

      double[] newWeights = updateWeights(residuals, mean, std);
      if (!(StatUtils.max(newWeights) > 0)) {
        // With every weight at zero only the penalty would remain, and its system is singular.
        LOGGER.debug("Stopping after %d iterations: all weights underflowed", iteration);
        break;
      }
      double ratio = new ArrayRealVector(weights, false).subtract(new ArrayRealVector(newWeights, false)).getNorm() /
          new ArrayRealVector(weights, false).getNorm();
      weights = newWeights;
      if (ratio < convergenceRatio) {
        LOGGER.debug("Baseline converged after %d iterations (ratio %.3e)", iteration, ratio);
        break;
      }
    }
    if (iteration >= maxIterations) {
      LOGGER.debug("Baseline reached the iteration cap of %d", maxIterations);
    }

    return BaselineResult.subtract(intensities, z);
  }

  /**
   * Points above the baseline get weight 0.  Points at or below it get exp((d - (2 * std - mean)) / std), where mean
   * and std describe the negative residuals.  The exponent is at most mean / std - 2 there, so every weight stays
   * below one and deeper dips weigh less.
   */
  static double[] updateWeights(double[] residuals, double negativeMean, double negativeStd) {
    double threshold = 2.0 * negativeStd - negativeMean;
    double[] weights = new double[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      double d = residuals[i];
      weights[i] = d > 0 ? 0.0 : Math.exp((d - threshold) / negativeStd);
    }
    return weights;
  }

  private double[] solve(double[][] penalty, double[] weights, double[] y) {
    int n = y.length;
    double[][] band = new double[n][3];
    double[] rhs = new double[n];
    for (int i = 0; i < n; i++) {
      band[i][0] = weights[i] + lambda * penalty[i][0];
      band[i][1] = lambda * penalty[i][1];
      band[i][2] = lambda * penalty[i][2];
      rhs[i] = weights[i] * y[i];
    }
    return new BandedSymmetricSolver(band, 2).solve(rhs);
  }
}
