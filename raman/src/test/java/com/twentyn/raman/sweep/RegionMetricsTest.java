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

package com.twentyn.raman.sweep;

import com.twentyn.raman.analysis.PeakRecord;
import com.twentyn.raman.classification.SpectralRegion;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RegionMetricsTest {

  @Test
  public void testCompositeScoreWeights() {
    assertEquals(0.4 * 0.9 + 0.3 * 0.8 + 0.3 * 0.99, RegionMetrics.compositeScore(10.0, 0.8, 1.0), 1e-12);
    assertEquals("Perfect consistency and fit", 1.0, RegionMetrics.compositeScore(0.0, 1.0, 0.0), 1e-12);
  }

  @Test
  public void testRegionStatistics() {
    List<PeakRecord> records = Arrays.asList(
        SyntheticSpectra.record("Z1", 1000.0, 10.0, 0.9),
        SyntheticSpectra.record("Z1", 1010.0, 12.0, 0.7));
    RegionMetrics metrics = RegionMetrics.compute(SpectralRegion.V3_SIO4, records);
    assertEquals(2, metrics.getCount());
    assertEquals(11.0, metrics.getFwhm().getMean(), 1e-12);
    assertEquals("Sample standard deviation", Math.sqrt(2.0), metrics.getFwhm().getStd(), 1e-12);
    assertEquals(100.0 * Math.sqrt(2.0) / 11.0, metrics.getFwhm().getCoefficientOfVariation(), 1e-9);
    assertEquals(0.8, metrics.getRSquared().getMean(), 1e-12);
    double expected = RegionMetrics.compositeScore(metrics.getFwhm().getCoefficientOfVariation(), 0.8,
        metrics.getCenter().getCoefficientOfVariation());
    assertEquals(expected, metrics.getCompositeScore(), 1e-12);
  }

  @Test
  public void testSinglePeakHasZeroSpread() {
    RegionMetrics metrics = RegionMetrics.compute(SpectralRegion.V1_SIO4,
        Collections.singletonList(SyntheticSpectra.record("Z1", 975.0, 7.0, 0.95)));
    assertEquals(0.0, metrics.getFwhm().getStd(), 0.0);
    assertEquals(0.0, metrics.getFwhm().getCoefficientOfVariation(), 0.0);
    assertEquals(0.4 + 0.3 * 0.95 + 0.3, metrics.getCompositeScore(), 1e-12);
  }

  @Test
  public void testEmptyRegionScoreIsNaN() {
    RegionMetrics metrics = RegionMetrics.compute(SpectralRegion.EXTERNAL_3, Collections.<PeakRecord>emptyList());
    assertEquals(0, metrics.getCount());
    assertTrue(Double.isNaN(metrics.getCompositeScore()));
  }
}
