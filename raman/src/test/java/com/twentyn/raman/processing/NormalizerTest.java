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

import com.twentyn.raman.config.NormalizationConfig;
import com.twentyn.raman.spectrum.Spectrum;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class NormalizerTest {
  private static final double[] X = {0.0, 2.0, 4.0, 6.0, 8.0};
  private static final double[] Y = {1.0, 3.0, 5.0, 3.0, 1.0};

  private final Normalizer normalizer = new Normalizer();

  @Test
  public void testMinMaxSpansUnitInterval() {
    double[] out = normalizer.normalize(Y, X, NormalizationMethod.MIN_MAX, -1);
    assertArrayEquals(new double[]{0.0, 0.5, 1.0, 0.5, 0.0}, out, 1e-12);
  }

  @Test
  public void testAreaUsesWavenumberSpacing() {
    // Trapezoid over spacing 2: (2 + 4 + 4 + 2) * 2 = 24.
    double[] out = normalizer.normalize(Y, X, NormalizationMethod.AREA, -1);
    assertEquals(5.0 / 24.0, out[2], 1e-12);
    double[] unitSpacing = normalizer.normalize(Y, null, NormalizationMethod.AREA, -1);
    assertEquals("Without wavenumbers the spacing is one", 5.0 / 12.0, unitSpacing[2], 1e-12);
  }

  @Test
  public void testPeakUsesReferenceIndexWhenInRange() {
    assertEquals(5.0 / 3.0, normalizer.normalize(Y, X, NormalizationMethod.PEAK, 1)[2], 1e-12);
    assertEquals("Out of range reference falls back to the maximum",
        1.0, normalizer.normalize(Y, X, NormalizationMethod.PEAK, 99)[2], 1e-12);
    assertEquals(1.0, normalizer.normalize(Y, X, NormalizationMethod.PEAK, -1)[2], 1e-12);
  }

  @Test
  public void testVectorHasUnitNorm() {
    double[] out = normalizer.normalize(Y, X, NormalizationMethod.VECTOR, -1);
    double sumSq = Arrays.stream(out).map(v -> v * v).sum();
    assertEquals(1.0, sumSq, 1e-12);
  }

  @Test
  public void testDegenerateInputsGiveZeros() {
    double[] flat = {2.0, 2.0, 2.0};
    double[] zeros = {0.0, 0.0, 0.0};
    double[] x = {1.0, 2.0, 3.0};
    for (NormalizationMethod method : Arrays.asList(
        NormalizationMethod.AREA, NormalizationMethod.PEAK, NormalizationMethod.VECTOR)) {
      assertArrayEquals(method + " of zeros", new double[3], normalizer.normalize(zeros, x, method, -1), 0.0);
    }
    assertArrayEquals("Min-max of a flat spectrum", new double[3],
        normalizer.normalize(flat, x, NormalizationMethod.MIN_MAX, -1), 0.0);
    assertArrayEquals("A zero reference intensity gives zeros", new double[5],
        normalizer.normalize(new double[]{0.0, 1.0, 2.0, 1.0, 0.0}, X, NormalizationMethod.PEAK, 0), 0.0);
  }

  @Test
  public void testNoneCopiesAndNormalizationIsDeterministic() {
    Spectrum s = SyntheticSpectra.zirconSpectrum();
    assertArrayEquals(s.getIntensities(), normalizer.normalize(s, NormalizationMethod.NONE).getIntensities(), 0.0);
    for (NormalizationMethod method : NormalizationMethod.values()) {
      assertArrayEquals(method + " must be deterministic",
          normalizer.normalize(s, method).getIntensities(), normalizer.normalize(s, method).getIntensities(), 0.0);
    }
    Spectrum minMax = normalizer.normalize(s, NormalizationConfig.defaults());
    assertEquals(0.0, minMax.getMinIntensity(), 1e-12);
    assertEquals(1.0, minMax.getMaxIntensity(), 1e-12);
  }

  @Test
  public void testUnknownNameFallsBackToMinMax() {
    assertEquals(NormalizationMethod.MIN_MAX, NormalizationMethod.fromName("snv"));
    assertEquals(NormalizationMethod.MIN_MAX, NormalizationMethod.fromName(null));
    assertEquals(NormalizationMethod.VECTOR, NormalizationMethod.fromName("L2"));
    assertEquals(NormalizationMethod.AREA, NormalizationMethod.fromName("area"));
  }
}
