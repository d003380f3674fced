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

package com.twentyn.raman.analysis;

import com.twentyn.raman.classification.DamageCategory;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class SampleDamageSummaryTest {

  @Test
  public void testGroupsV3PeaksBySample() {
    ResultTable table = new ResultTable(Arrays.asList(
        SyntheticSpectra.record("ZB", 1008.0, 6.0, 0.99),
        SyntheticSpectra.record("ZA", 1007.0, 12.0, 0.98),
        SyntheticSpectra.record("ZA", 1009.0, 20.0, 0.97),
        SyntheticSpectra.record("ZA", 440.0, 30.0, 0.97),
        SyntheticSpectra.record("ZC", 975.0, 5.0, 0.97)));

    List<SampleDamageSummary> summaries = SampleDamageSummary.summarize(table);
    assertEquals("Samples without a v3 band are left out", 2, summaries.size());

    SampleDamageSummary za = summaries.get(0);
    assertEquals("Ordered by sample id", "ZA", za.getSampleId());
    assertEquals("Only v3 peaks count", 2, za.getPeakCount());
    assertEquals(16.0, za.getMeanFwhm(), 1e-9);
    assertEquals(-0.1402 + 0.07683 * 16.0, za.getMeanDose(), 1e-9);
    assertEquals(DamageCategory.HIGH, za.getCategory());
    assertEquals(1, za.getCategoryCount(DamageCategory.MODERATE));
    assertEquals(1, za.getCategoryCount(DamageCategory.HIGH));
    assertEquals(0, za.getCategoryCount(DamageCategory.LOW));

    SampleDamageSummary zb = summaries.get(1);
    assertEquals("ZB", zb.getSampleId());
    assertEquals(DamageCategory.LOW, zb.getCategory());
  }
}
