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

import com.twentyn.raman.config.BaselineConfig;
import com.twentyn.raman.spectrum.Spectrum;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BaselineEstimatorTest {
  private Spectrum spectrum;
  private BaselineEstimator estimator;

  @Before
  public void setUp() throws Exception {
    spectrum = SyntheticSpectra.zirconSpectrum();
    estimator = new BaselineEstimator();
  }

  @Test
  public void testEveryMethodKeepsLengthAndStaysUnderSpectrum() {
    for (BaselineMethod method : BaselineMethod.values()) {
      BaselineResult result = estimator.estimate(spectrum, BaselineConfig.defaults().withMethod(method));
      assertEquals(method + " baseline length", spectrum.size(), result.getBaseline().length);
      assertEquals(method + " corrected length", spectrum.size(), result.getCorrected().length);
      if (method != BaselineMethod.REWEIGHTED_LEAST_SQUARES) {
        for (int i = 0; i < spectrum.size(); i++) {
          assertTrue(method + " baseline must not exceed the raw spectrum",
              result.getBaseline()[i] <= spectrum.getIntensity(i));
        }
      }
    }
  }

  @Test
  public void testPolynomialBaselineFollowsLinearBackground() {
    BaselineResult result = estimator.estimate(spectrum,
        BaselineConfig.defaults().withMethod(BaselineMethod.POLYNOMIAL));
    for (int i = 0; i < spectrum.size(); i += 50) {
      double expected = 0.2 + 0.0002 * (spectrum.getWavenumber(i) - 150.0);
      assertEquals(String.format("Baseline at %.0f", spectrum.getWavenumber(i)),
          expected, result.getBaseline()[i], 0.03);
    }
  }

  @Test
  public void testSplineCorrectionIsScaledToUnitRange() {
    Spectrum corrected = estimator.correct(spectrum, BaselineConfig.defaults());
    assertEquals("Spline correction floors at zero", 0.0, corrected.getMinIntensity(), 1e-12);
    assertEquals("Spline correction peaks at one", 1.0, corrected.getMaxIntensity(), 1e-12);
    int v3 = 1008 - 100;
    assertEquals("Strongest band is the maximum", 1.0, corrected.getIntensity(v3), 0.05);
  }

  @Test
  public void testSplineLinearFallbackInterpolatesRetainedPoints() {
    double[] baseline = SplineBaseline.linearBaseline(new double[]{0.0, 1.0, 2.0, 3.0, 4.0},
        new double[]{1.0, 3.0}, new double[]{10.0, 30.0});
    assertEquals("Edge value holds before the first retained point", 10.0, baseline[0], 1e-12);
    assertEquals(20.0, baseline[2], 1e-12);
    assertEquals("Edge value holds after the last retained point", 30.0, baseline[4], 1e-12);
  }

  @Test
  public void testUnknownMethodFallsBackToSpline() {
    assertEquals(BaselineMethod.SPLINE, BaselineMethod.fromName("wavelet"));
    assertEquals(BaselineMethod.REWEIGHTED_LEAST_SQUARES, BaselineMethod.fromName("arPLS"));
    assertEquals(BaselineMethod.POLYNOMIAL, BaselineMethod.fromName("Polynomial"));
  }
}
