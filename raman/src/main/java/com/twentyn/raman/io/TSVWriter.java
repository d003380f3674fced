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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes header-keyed rows as tab separated values.  Columns absent from a row are written empty; keys that are not
 * columns are rejected so that a typo cannot silently drop a value.
 */
public class TSVWriter implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<String> header;
  private CSVPrinter printer;

  public TSVWriter(List<String> header) {
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
  }

  public void open(File f) throws IOException {
    File parent = f.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException(String.format("Unable to create output directory %s", parent.getAbsolutePath()));
    }
    open(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8));
  }

  public void open(Writer writer) throws IOException {
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
  }

  public List<String> getHeader() {
    return header;
  }

  public void append(Map<String, ?> row) throws IOException {
    if (printer == null) {
      throw new IllegalStateException("TSVWriter must be opened before rows are appended");
    }
    for (String key : row.keySet()) {
      if (!header.contains(key)) {
        throw new IllegalArgumentException(String.format("Unknown column '%s'", key));
      }
    }
    List<Object> vals = new ArrayList<>(header.size());
    for (String field : header) {
      Object val = row.get(field);
      vals.add(val == null ? "" : val);
    }
    printer.printRecord(vals);
  }

  public void append(List<? extends Map<String, ?>> rows) throws IOException {
    for (Map<String, ?> row : rows) {
      append(row);
    }
    printer.flush();
  }

  public void flush() throws IOException {
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }
}
