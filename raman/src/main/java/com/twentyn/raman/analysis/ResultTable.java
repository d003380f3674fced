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

import com.twentyn.raman.classification.SpectralRegion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * An ordered, unmodifiable list of peak records.  A record's row index is its position in the list, which is what the
 * outlier report refers to.
 */
public class ResultTable {
  private static final ResultTable EMPTY = new ResultTable(Collections.emptyList());

  private final List<PeakRecord> records;

  public ResultTable(List<PeakRecord> records) {
    this.records = Collections.unmodifiableList(new ArrayList<>(records));
  }

  public static ResultTable empty() {
    return EMPTY;
  }

  public static ResultTable concat(Collection<ResultTable> tables) {
    List<PeakRecord> all = new ArrayList<>();
    for (ResultTable table : tables) {
      all.addAll(table.records);
    }
    return new ResultTable(all);
  }

  public List<PeakRecord> getRecords() {
    return records;
  }

  public PeakRecord get(int row) {
    return records.get(row);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /**
   * Returns a new table without the given rows, keeping the order of the rest.
   */
  public ResultTable without(Set<Integer> rows) {
    if (rows.isEmpty()) {
      return this;
    }
    List<PeakRecord> kept = new ArrayList<>(records.size() - rows.size());
    for (int i = 0; i < records.size(); i++) {
      if (!rows.contains(i)) {
        kept.add(records.get(i));
      }
    }
    return new ResultTable(kept);
  }

  /**
   * Row indices keyed by region label.  Every region appears, in enum order, followed by the unclassified rows; groups
   * may be empty.
   */
  public Map<String, List<Integer>> rowsByRegion() {
    Map<String, List<Integer>> groups = new LinkedHashMap<>();
    for (SpectralRegion region : SpectralRegion.values()) {
      groups.put(region.getLabel(), new ArrayList<>());
    }
    groups.put(SpectralRegion.UNCLASSIFIED_LABEL, new ArrayList<>());
    for (int i = 0; i < records.size(); i++) {
      groups.get(records.get(i).getRegionLabel()).add(i);
    }
    return groups;
  }

  public List<PeakRecord> inRegion(SpectralRegion region) {
    List<PeakRecord> out = new ArrayList<>();
    for (PeakRecord record : records) {
      if (record.getRegion().map(region::equals).orElse(false)) {
        out.add(record);
      }
    }
    return out;
  }

  public double[] column(ToDoubleFunction<PeakRecord> extractor) {
    return column(records, extractor);
  }

  public static double[] column(List<PeakRecord> rows, ToDoubleFunction<PeakRecord> extractor) {
    double[] out = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      out[i] = extractor.applyAsDouble(rows.get(i));
    }
    return out;
  }
}
