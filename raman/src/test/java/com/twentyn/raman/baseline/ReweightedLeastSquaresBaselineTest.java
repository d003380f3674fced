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

import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ReweightedLeastSquaresBaselineTest {

  @Test
  public void testRecoversSlopingBackgroundUnderPeak() {
    double[] x = SyntheticSpectra.axis(100.0, 1200.0, 1.0);
    double[] truth = new double[x.length];
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      truth[i] = 0.2 + 0.0002 * (x[i] - 150.0);
      y[i] = truth[i] + SyntheticSpectra.gaussian(x[i], 1.0, 1008.0, 4.0);
    }

    BaselineResult result = new ReweightedLeastSquaresBaseline(1e5, 50, 1e-5).estimate(x, y);
    double[] baseline = result.getBaseline();
    double[] corrected = result.getCorrected();
    for (int i = 0; i < x.length; i++) {
      assertEquals(String.format("Baseline at %.0f", x[i]), truth[i], baseline[i], 0.02);
      assertEquals("Corrected is the residual", y[i] - baseline[i], corrected[i], 1e-12);
    }
    int peakIndex = 1008 - 100;
    assertTrue("Peak survives correction", corrected[peakIndex] > 0.95);
  }

  @Test
  public void testWeightsFollowResidualSign() {
    double[] residuals = {0.5, 0.0, -0.01, -10.0};
    double mean = -0.02;
    double std = 0.01;
    double[] w = ReweightedLeastSquaresBaseline.updateWeights(residuals, mean, std);
    assertEquals("Points above the baseline are ignored", 0.0, w[0], 0.0);
    assertEquals("Threshold is subtracted from the residual", Math.exp(-4.0), w[1], 1e-15);
    assertEquals(Math.exp(-5.0), w[2], 1e-15);
    assertTrue("Deep negatives fade out", w[3] < 1e-100);
    for (int i = 1; i < w.length; i++) {
      assertTrue("Weight " + i + " stays below one", w[i] < 1.0);
      assertTrue("Weights fall with depth", i == 1 || w[i] < w[i - 1]);
    }
  }

  @Test
  public void testShortSpectrumIsItsOwnBaseline() {
    BaselineResult result = new ReweightedLeastSquaresBaseline(1e5, 50, 1e-5)
        .estimate(new double[]{1.0, 2.0}, new double[]{3.0, 4.0});
    assertEquals(0.0, result.getCorrected()[0], 0.0);
    assertEquals(4.0, result.getBaseline()[1], 0.0);
  }
}
