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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * What a cleaning pass removed, region by region, with FWHM and R^2 statistics before and after.
 */
public class OutlierReport {
  private final List<RegionSummary> regions;
  private final SortedSet<Integer> removedRows;
  private final int initialCount;

  public OutlierReport(List<RegionSummary> regions, SortedSet<Integer> removedRows, int initialCount) {
    this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
    this.removedRows = Collections.unmodifiableSortedSet(removedRows);
    this.initialCount = initialCount;
  }

  public List<RegionSummary> getRegions() {
    return regions;
  }

  public RegionSummary getRegion(String label) {
    for (RegionSummary summary : regions) {
      if (summary.getLabel().equals(label)) {
        return summary;
      }
    }
    throw new IllegalArgumentException(String.format("No outlier summary for region '%s'", label));
  }

  /**
   * Row indices of the input table that were removed, ascending.
   */
  public SortedSet<Integer> getRemovedRows() {
    return removedRows;
  }

  public int getInitialCount() {
    return initialCount;
  }

  public int getRemovedCount() {
    return removedRows.size();
  }

  public int getRemainingCount() {
    return initialCount - removedRows.size();
  }

  public static class RegionSummary {
    private final String label;
    private final int initialCount;
    private final List<Integer> removedRows;
    private final Map<OutlierCriterion, Integer> criterionCounts;
    private final DescriptiveStats fwhmBefore;
    private final DescriptiveStats fwhmAfter;
    private final double meanRSquaredBefore;
    private final double meanRSquaredAfter;

    public RegionSummary(String label, int initialCount, List<Integer> removedRows,
                         Map<OutlierCriterion, Integer> criterionCounts,
                         DescriptiveStats fwhmBefore, DescriptiveStats fwhmAfter,
                         double meanRSquaredBefore, double meanRSquaredAfter) {
      this.label = label;
      this.initialCount = initialCount;
      this.removedRows = Collections.unmodifiableList(new ArrayList<>(removedRows));
      this.criterionCounts = Collections.unmodifiableMap(new EnumMap<>(criterionCounts));
      this.fwhmBefore = fwhmBefore;
      this.fwhmAfter = fwhmAfter;
      this.meanRSquaredBefore = meanRSquaredBefore;
      this.meanRSquaredAfter = meanRSquaredAfter;
    }

    public String getLabel() {
      return label;
    }

    public int getInitialCount() {
      return initialCount;
    }

    public int getRemovedCount() {
      return removedRows.size();
    }

    public int getRemainingCount() {
      return initialCount - removedRows.size();
    }

    public List<Integer> getRemovedRows() {
      return removedRows;
    }

    /**
     * How many rows failed each test.  A row failing two tests is counted under both.
     */
    public int getCriterionCount(OutlierCriterion criterion) {
      Integer count = criterionCounts.get(criterion);
      return count == null ? 0 : count;
    }

    public DescriptiveStats getFwhmBefore() {
      return fwhmBefore;
    }

    public DescriptiveStats getFwhmAfter() {
      return fwhmAfter;
    }

    public double getMeanRSquaredBefore() {
      return meanRSquaredBefore;
    }

    public double getMeanRSquaredAfter() {
      return meanRSquaredAfter;
    }
  }
}
