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

package com.twentyn.raman.io;

import com.twentyn.raman.analysis.CleaningResult;
import com.twentyn.raman.analysis.OutlierDetector;
import com.twentyn.raman.analysis.PeakRecord;
import com.twentyn.raman.analysis.ResultTable;
import com.twentyn.raman.analysis.SampleDamageSummary;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ResultTableWriterTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static final ResultTable TABLE = new ResultTable(Arrays.asList(
      SyntheticSpectra.record("Z1", 1008.123456, 6.5, 0.98765432),
      SyntheticSpectra.record("Z1", 975.0, 5.0, 0.9),
      SyntheticSpectra.record("Z2", 1006.0, 30.0, 0.95),
      SyntheticSpectra.record("Z2", 640.0, 12.0, 0.8)));

  @Test
  public void testNumberFormats() {
    assertEquals("1.2346", ResultTableWriter.fixed(1.23456));
    assertEquals("0.987654", ResultTableWriter.rSquared(0.9876543));
    assertEquals("-0.5000", ResultTableWriter.fixed(-0.5));
    assertEquals("NaN", ResultTableWriter.fixed(Double.NaN));
  }

  @Test
  public void testPeakTableLayout() throws Exception {
    StringWriter out = new StringWriter();
    new ResultTableWriter().writePeaks(TABLE, out);
    String[] lines = out.toString().split("\n");
    assertEquals("Header plus one line per peak", 5, lines.length);
    assertEquals(String.join("\t", ResultTableWriter.PEAK_HEADER), lines[0]);

    String[] first = lines[1].split("\t", -1);
    assertEquals(ResultTableWriter.PEAK_HEADER.size(), first.length);
    assertEquals("Z1", first[ResultTableWriter.PEAK_HEADER.indexOf("sample_id")]);
    assertEquals("v3(SiO4)", first[ResultTableWriter.PEAK_HEADER.indexOf("region")]);
    assertEquals("1008.1235", first[ResultTableWriter.PEAK_HEADER.indexOf("center")]);
    assertEquals("0.987654", first[ResultTableWriter.PEAK_HEADER.indexOf("r_squared")]);
    assertEquals("low damage", first[ResultTableWriter.PEAK_HEADER.indexOf("damage_category")]);

    String[] last = lines[4].split("\t", -1);
    assertEquals("unclassified", last[ResultTableWriter.PEAK_HEADER.indexOf("region")]);
  }

  @Test
  public void testOutlierAndDamageTables() throws Exception {
    CleaningResult cleaning = new OutlierDetector().clean(TABLE);
    ResultTableWriter writer = new ResultTableWriter();

    File outliers = new File(tempFolder.getRoot(), "outlier_summary.tsv");
    writer.writeOutlierReport(cleaning.getReport(), outliers);
    List<String> outlierLines = Files.readAllLines(outliers.toPath(), StandardCharsets.UTF_8);
    assertEquals(String.join("\t", ResultTableWriter.OUTLIER_HEADER), outlierLines.get(0));
    assertEquals(1 + cleaning.getReport().getRegions().size(), outlierLines.size());
    assertTrue(outlierLines.get(1).startsWith("v3(SiO4)\t2\t0\t2\t"));

    File damage = new File(tempFolder.getRoot(), "sample_damage_summary.tsv");
    List<SampleDamageSummary> summaries = SampleDamageSummary.summarize(cleaning.getCleaned());
    writer.writeDamageSummary(summaries, damage);
    List<String> damageLines = Files.readAllLines(damage.toPath(), StandardCharsets.UTF_8);
    assertEquals(3, damageLines.size());
    assertTrue(damageLines.get(1).startsWith("Z1\t1\t6.5000\t"));
    assertTrue(damageLines.get(2).startsWith("Z2\t1\t30.0000\t"));
  }

  @Test
  public void testEmptyTableWritesHeaderOnly() throws Exception {
    StringWriter out = new StringWriter();
    new ResultTableWriter().writePeaks(ResultTable.empty(), out);
    assertEquals(String.join("\t", ResultTableWriter.PEAK_HEADER) + "\n", out.toString());
  }
}
