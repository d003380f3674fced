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

package com.twentyn.raman.config;

import com.twentyn.raman.baseline.BaselineMethod;
import com.twentyn.raman.fitting.FittingMethod;
import com.twentyn.raman.processing.NormalizationMethod;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;

public class ProcessingConfigTest {

  private static ProcessingConfig parse(String json) throws Exception {
    return ProcessingConfig.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testDefaults() {
    ProcessingConfig config = ProcessingConfig.defaults();
    assertEquals(BaselineMethod.SPLINE, config.getBaseline().getMethod());
    assertEquals(NormalizationMethod.MIN_MAX, config.getNormalization().getMethod());
    assertEquals(1e5, config.getBaseline().getLambda(), 0.0);
    assertEquals(11, config.getSmoothing().getWindowLength());
    assertEquals(FittingMethod.TRUST_REGION, config.getFitting().getMethod());
    assertEquals("results", config.getIo().getOutputDirectory());
  }

  @Test
  public void testPartialConfigFallsBackToDefaults() throws Exception {
    ProcessingConfig config = parse(
        "{\"baseline\": {\"method\": \"polynomial\", \"polynomial_degree\": 5}, \"unknown_section\": {}}");
    assertEquals(BaselineMethod.POLYNOMIAL, config.getBaseline().getMethod());
    assertEquals(5, config.getBaseline().getPolynomialDegree());
    assertEquals("Unset fields keep their defaults",
        BaselineConfig.DEFAULT_MAX_ITERATIONS, config.getBaseline().getMaxIterations());
    assertEquals(NormalizationMethod.MIN_MAX, config.getNormalization().getMethod());
    assertEquals(SmoothingConfig.DEFAULT_POLY_ORDER, config.getSmoothing().getPolyOrder());
  }

  @Test
  public void testUnknownMethodNamesFallBack() throws Exception {
    ProcessingConfig config = parse(
        "{\"baseline\": {\"method\": \"wavelet\"}, \"normalization\": {\"method\": \"snv\"}}");
    assertEquals(BaselineMethod.FALLBACK, config.getBaseline().getMethod());
    assertEquals(NormalizationMethod.FALLBACK, config.getNormalization().getMethod());
  }

  @Test
  public void testMethodAliases() throws Exception {
    ProcessingConfig config = parse(
        "{\"baseline\": {\"method\": \"ALS\"}, \"normalization\": {\"method\": \"l2\"}}");
    assertEquals(BaselineMethod.REWEIGHTED_LEAST_SQUARES, config.getBaseline().getMethod());
    assertEquals(NormalizationMethod.VECTOR, config.getNormalization().getMethod());
  }

  @Test
  public void testBundledConfigMatchesDefaults() throws Exception {
    ProcessingConfig bundled;
    try (InputStream is = ProcessingConfigTest.class.getResourceAsStream("/raman_config.json")) {
      assertNotNull("raman_config.json is on the classpath", is);
      bundled = ProcessingConfig.load(is);
    }
    assertEquals(ProcessingConfig.defaults().toJson(), bundled.toJson());
  }

  @Test
  public void testWithMethodsCopies() throws Exception {
    ProcessingConfig base = ProcessingConfig.defaults();
    ProcessingConfig derived = base.withBaselineMethod(BaselineMethod.POLYNOMIAL)
        .withNormalizationMethod(NormalizationMethod.AREA);
    assertNotSame(base, derived);
    assertEquals(BaselineMethod.SPLINE, base.getBaseline().getMethod());
    assertEquals(BaselineMethod.POLYNOMIAL, derived.getBaseline().getMethod());
    assertEquals(NormalizationMethod.AREA, derived.getNormalization().getMethod());

    ProcessingConfig roundTripped = parse(derived.toJson());
    assertEquals(BaselineMethod.POLYNOMIAL, roundTripped.getBaseline().getMethod());
    assertEquals(NormalizationMethod.AREA, roundTripped.getNormalization().getMethod());
  }
}
