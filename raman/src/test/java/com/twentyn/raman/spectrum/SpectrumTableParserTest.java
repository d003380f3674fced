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

package com.twentyn.raman.spectrum;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumTableParserTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testRowsAreSortedAndDuplicatesDropped() throws Exception {
    String table = "wavenumber\tG1_core\tG2_rim\n" +
        "102\t0.3\t1.3\n" +
        "100\t0.1\t1.1\n" +
        "101\t0.2\t1.2\n" +
        "101\t9.9\t9.9\n" +
        "103\tn/a\t1.4\n";
    List<Spectrum> spectra = new SpectrumTableParser().parse(stream(table), "Z3", SpectrumTableParser.TSV_FORMAT);

    assertEquals("One spectrum per intensity column", 2, spectra.size());
    Spectrum first = spectra.get(0);
    assertEquals("Z3", first.getSampleId());
    assertEquals("G1_core", first.getSpectrumId());
    assertEquals("G1", first.getGrain());
    assertEquals("core", first.getLocation());
    assertArrayEquals(new double[]{100.0, 101.0, 102.0, 103.0}, first.getWavenumbers(), 0.0);
    assertEquals("First occurrence of a duplicate wavenumber wins", 0.2, first.getIntensity(1), 0.0);
    assertTrue("Non-numeric cells become NaN", Double.isNaN(first.getIntensity(3)));
    assertEquals(1.4, spectra.get(1).getIntensity(3), 0.0);
  }

  @Test(expected = IOException.class)
  public void testSingleColumnTableIsRejected() throws Exception {
    new SpectrumTableParser().parse(stream("wavenumber\n100\n101\n"), "Z3", SpectrumTableParser.TSV_FORMAT);
  }

  @Test
  public void testCsvFileUsesBaseNameAsSampleId() throws Exception {
    File csv = tempFolder.newFile("ZR-044.csv");
    FileUtils.writeStringToFile(csv, "wavenumber,G5_mantle\n200,0.5\n201,0.6\n202,0.7\n", StandardCharsets.UTF_8);
    List<Spectrum> spectra = new SpectrumTableParser().parse(csv);
    assertEquals(1, spectra.size());
    assertEquals("ZR-044", spectra.get(0).getSampleId());
    assertEquals("mantle", spectra.get(0).getLocation());
    assertEquals(3, spectra.get(0).size());
  }
}
