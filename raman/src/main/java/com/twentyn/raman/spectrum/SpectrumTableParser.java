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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a table of spectra: the first column holds wavenumbers, every further column is one spectrum whose header
 * names its grain and location (grain_location).  The sample id comes from the file's base name.
 */
public class SpectrumTableParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumTableParser.class);

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true).
      withHeader();
  public static final CSVFormat CSV_FORMAT = CSVFormat.newFormat(',').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true).
      withHeader();

  public List<Spectrum> parse(File file) throws IOException {
    String sampleId = FilenameUtils.getBaseName(file.getName());
    CSVFormat format = "csv".equalsIgnoreCase(FilenameUtils.getExtension(file.getName())) ? CSV_FORMAT : TSV_FORMAT;
    try (InputStream is = new FileInputStream(file)) {
      return parse(is, sampleId, format);
    }
  }

  public List<Spectrum> parse(InputStream inStream, String sampleId, CSVFormat format) throws IOException {
    List<String> header;
    // Keyed on wavenumber so rows come out sorted and duplicated wavenumbers collapse onto the first occurrence.
    TreeMap<Double, double[]> rows = new TreeMap<>();

    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), format)) {
      header = parser.getHeaderNames();
      if (header.size() < 2) {
        throw new IOException(String.format(
            "Spectrum table for sample %s has %d column(s); need a wavenumber column and at least one spectrum",
            sampleId, header.size()));
      }

      int skipped = 0;
      for (CSVRecord record : parser) {
        Double wavenumber = parseDouble(record.get(0));
        if (wavenumber == null || !Double.isFinite(wavenumber)) {
          skipped++;
          continue;
        }
        double[] values = new double[header.size() - 1];
        for (int col = 1; col < header.size(); col++) {
          Double v = col < record.size() ? parseDouble(record.get(col)) : null;
          values[col - 1] = v == null ? Double.NaN : v;
        }
        if (rows.putIfAbsent(wavenumber, values) != null) {
          LOGGER.warn("Duplicate wavenumber %f in sample %s; keeping the first row", wavenumber, sampleId);
        }
      }
      if (skipped > 0) {
        LOGGER.warn("Skipped %d rows without a numeric wavenumber in sample %s", skipped, sampleId);
      }
    }

    double[] wavenumbers = new double[rows.size()];
    double[][] columns = new double[header.size() - 1][rows.size()];
    int i = 0;
    for (Map.Entry<Double, double[]> entry : rows.entrySet()) {
      wavenumbers[i] = entry.getKey();
      for (int col = 0; col < columns.length; col++) {
        columns[col][i] = entry.getValue()[col];
      }
      i++;
    }

    List<Spectrum> spectra = new ArrayList<>(columns.length);
    for (int col = 0; col < columns.length; col++) {
      spectra.add(Spectrum.fromColumn(sampleId, header.get(col + 1), wavenumbers, columns[col]));
    }
    LOGGER.info("Read %d spectra with %d points each for sample %s", spectra.size(), wavenumbers.length, sampleId);
    return spectra;
  }

  private static Double parseDouble(String s) {
    if (s == null || s.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
