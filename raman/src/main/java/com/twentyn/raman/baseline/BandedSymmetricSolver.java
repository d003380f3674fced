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

import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Solves symmetric positive definite banded systems with an LDL^T factorization that never leaves the band.  The
 * reweighted least-squares baseline solves one of these per iteration, and a dense solve would cost O(L^3) on
 * spectra with thousands of points.
 *
 * The lower band is stored row by row: {@code band[i][k]} holds A(i, i - k) for k in [0, bandwidth].
 */
public class BandedSymmetricSolver {
  private static final double PIVOT_EPSILON = 1e-300;

  private final int n;
  private final int bandwidth;
  private final double[][] factor;
  private final double[] diagonal;

  public BandedSymmetricSolver(double[][] band, int bandwidth) {
    this.n = band.length;
    this.bandwidth = bandwidth;
    this.factor = new double[n][bandwidth + 1];
    this.diagonal = new double[n];
    factorize(band);
  }

  private void factorize(double[][] band) {
    for (int j = 0; j < n; j++) {
      int start = Math.max(0, j - bandwidth);
      for (int i = start; i < j; i++) {
        double s = band[j][j - i];
        for (int k = Math.max(start, i - bandwidth); k < i; k++) {
          s -= factor[j][j - k] * factor[i][i - k] * diagonal[k];
        }
        factor[j][j - i] = s / diagonal[i];
      }
      double d = band[j][0];
      for (int k = start; k < j; k++) {
        d -= factor[j][j - k] * factor[j][j - k] * diagonal[k];
      }
      if (!(Math.abs(d) > PIVOT_EPSILON)) {
        throw new SingularMatrixException();
      }
      diagonal[j] = d;
      factor[j][0] = 1.0;
    }
  }

  public double[] solve(double[] b) {
    if (b.length != n) {
      throw new IllegalArgumentException(String.format("Right hand side has length %d, expected %d", b.length, n));
    }
    double[] x = b.clone();
    // L z = b
    for (int j = 0; j < n; j++) {
      for (int k = Math.max(0, j - bandwidth); k < j; k++) {
        x[j] -= factor[j][j - k] * x[k];
      }
    }
    // D y = z
    for (int j = 0; j < n; j++) {
      x[j] /= diagonal[j];
    }
    // L^T x = y
    for (int j = n - 1; j >= 0; j--) {
      for (int i = j + 1; i <= Math.min(n - 1, j + bandwidth); i++) {
        x[j] -= factor[i][i - j] * x[i];
      }
    }
    return x;
  }

  /**
   * Builds the lower band of D * D^T, where D is the L x (L - 2) second-difference operator whose column j carries
   * (1, -2, 1) on rows j, j + 1 and j + 2.
   */
  public static double[][] secondDifferencePenalty(int length) {
    double[][] band = new double[length][3];
    double[] stencil = {1.0, -2.0, 1.0};
    for (int col = 0; col + 2 < length; col++) {
      for (int a = 0; a < 3; a++) {
        for (int b = 0; b <= a; b++) {
          band[col + a][a - b] += stencil[a] * stencil[b];
        }
      }
    }
    return band;
  }
}
