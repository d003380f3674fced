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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Least-squares polynomial through the samples that lie outside the prominent peaks, evaluated over the whole
 * spectrum and never allowed above the raw signal.
 */
public class PolynomialBaseline implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PolynomialBaseline.class);

  private final int degree;

  public PolynomialBaseline(int degree) {
    this.degree = Math.max(0, degree);
  }

  @Override
  public BaselineResult estimate(double[] wavenumbers, double[] intensities) {
    int n = intensities.length;
    boolean[] keep = PeakMask.keepOutsidePeaks(intensities);
    int retained = PeakMask.count(keep);

    int fitDegree = degree;
    if (retained < degree + 2) {
      LOGGER.warn("Only %d points left outside peaks for a degree %d polynomial; falling back to a linear fit",
          retained, degree);
      fitDegree = 1;
    }
    if (retained < 2) {
      Arrays.fill(keep, true);
      retained = n;
    }
    fitDegree = Math.min(fitDegree, Math.max(0, retained - 1));

    // Fitting on x rescaled to [-1, 1] keeps the Vandermonde matrix well conditioned at wavenumbers in the thousands.
    double[] scaled = rescale(wavenumbers);
    double[] coefficients = fit(PeakMask.select(scaled, keep), PeakMask.select(intensities, keep), fitDegree);

    double[] baseline = new double[n];
    for (int i = 0; i < n; i++) {
      baseline[i] = evaluate(coefficients, scaled[i]);
    }
    return BaselineResult.subtract(intensities, PeakMask.clipToSpectrum(baseline, intensities));
  }

  static double[] fit(double[] x, double[] y, int degree) {
    double[][] vandermonde = new double[x.length][degree + 1];
    for (int i = 0; i < x.length; i++) {
      double power = 1.0;
      for (int k = 0; k <= degree; k++) {
        vandermonde[i][k] = power;
        power *= x[i];
      }
    }
    DecompositionSolver solver =
        new SingularValueDecomposition(new Array2DRowRealMatrix(vandermonde, false)).getSolver();
    RealVector coefficients = solver.solve(new ArrayRealVector(y, false));
    return coefficients.toArray();
  }

  static double evaluate(double[] coefficients, double x) {
    double value = 0.0;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      value = value * x + coefficients[k];
    }
    return value;
  }

  private static double[] rescale(double[] x) {
    double lo = x[0];
    double hi = x[x.length - 1];
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = hi > lo ? 2.0 * (x[i] - lo) / (hi - lo) - 1.0 : 0.0;
    }
    return out;
  }
}
