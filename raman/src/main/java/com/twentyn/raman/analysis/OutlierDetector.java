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
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Flags implausible peaks region by region and removes them in a single pass.
 *
 * Within a spectral region a row is flagged if its R^2 is too low, its FWHM falls outside the Tukey fences of that
 * region's FWHMs, its FWHM z-score is too large, or its FWHM exceeds an absolute cap.  Unclassified rows are only
 * checked against the stricter R^2 and FWHM limits.
 *
 * The region statistics are recomputed over the rows not yet flagged until a round flags nothing new, and only then is
 * the union of flags removed.  The survivors therefore pass every test against their own statistics, so cleaning a
 * cleaned table removes nothing.
 */
public class OutlierDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(OutlierDetector.class);

  private final OutlierCriteria criteria;

  public OutlierDetector() {
    this(OutlierCriteria.defaults());
  }

  public OutlierDetector(OutlierCriteria criteria) {
    this.criteria = criteria;
  }

  public CleaningResult clean(ResultTable table) {
    SortedSet<Integer> removed = new TreeSet<>();
    List<OutlierReport.RegionSummary> summaries = new ArrayList<>();

    for (Map.Entry<String, List<Integer>> group : table.rowsByRegion().entrySet()) {
      String label = group.getKey();
      List<Integer> rows = group.getValue();
      Map<OutlierCriterion, Integer> counts = new EnumMap<>(OutlierCriterion.class);
      SortedSet<Integer> flagged = SpectralRegion.UNCLASSIFIED_LABEL.equals(label) ?
          flagUnclassified(table, rows, counts) : flagRegion(table, rows, counts);
      removed.addAll(flagged);

      List<PeakRecord> before = new ArrayList<>(rows.size());
      List<PeakRecord> after = new ArrayList<>(rows.size());
      for (Integer row : rows) {
        before.add(table.get(row));
        if (!flagged.contains(row)) {
          after.add(table.get(row));
        }
      }
      summaries.add(new OutlierReport.RegionSummary(label, rows.size(), new ArrayList<>(flagged), counts,
          DescriptiveStats.of(ResultTable.column(before, PeakRecord::getFwhm)),
          DescriptiveStats.of(ResultTable.column(after, PeakRecord::getFwhm)),
          meanOrNaN(ResultTable.column(before, PeakRecord::getRSquared)),
          meanOrNaN(ResultTable.column(after, PeakRecord::getRSquared))));
      if (!flagged.isEmpty()) {
        LOGGER.info("Region %s: removing %d of %d peaks", label, flagged.size(), rows.size());
      }
    }

    LOGGER.info("Outlier removal: %d of %d peaks removed", removed.size(), table.size());
    return new CleaningResult(table.without(removed), new OutlierReport(summaries, removed, table.size()));
  }

  private SortedSet<Integer> flagRegion(ResultTable table, List<Integer> rows, Map<OutlierCriterion, Integer> counts) {
    SortedSet<Integer> flagged = new TreeSet<>();
    List<Integer> remaining = new ArrayList<>(rows);
    int rounds = 0;
    while (!remaining.isEmpty()) {
      SortedSet<Integer> newlyFlagged = flagRound(table, remaining, counts);
      if (newlyFlagged.isEmpty()) {
        break;
      }
      rounds++;
      flagged.addAll(newlyFlagged);
      remaining.removeAll(newlyFlagged);
    }
    if (rounds > 1) {
      LOGGER.debug("Region statistics settled after %d flagging rounds", rounds);
    }
    return flagged;
  }

  private SortedSet<Integer> flagRound(ResultTable table, List<Integer> rows, Map<OutlierCriterion, Integer> counts) {
    SortedSet<Integer> flagged = new TreeSet<>();
    int n = rows.size();
    double[] fwhm = new double[n];
    for (int i = 0; i < n; i++) {
      fwhm[i] = table.get(rows.get(i)).getFwhm();
    }

    double lowerFence = Double.NEGATIVE_INFINITY;
    double upperFence = Double.POSITIVE_INFINITY;
    if (n >= criteria.getMinIqrCount()) {
      Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
      percentile.setData(fwhm);
      double q1 = percentile.evaluate(25.0);
      double q3 = percentile.evaluate(75.0);
      double iqr = q3 - q1;
      lowerFence = q1 - criteria.getIqrMultiplier() * iqr;
      upperFence = q3 + criteria.getIqrMultiplier() * iqr;
    }

    double mean = Double.NaN;
    double std = 0.0;
    if (n >= criteria.getMinZCount()) {
      mean = StatUtils.mean(fwhm);
      std = Math.sqrt(StatUtils.variance(fwhm, mean));
    }

    for (int i = 0; i < n; i++) {
      PeakRecord record = table.get(rows.get(i));
      boolean outlier = false;
      if (record.getRSquared() < criteria.getMinRSquared()) {
        outlier = count(counts, OutlierCriterion.LOW_FIT_QUALITY);
      }
      if (fwhm[i] < lowerFence || fwhm[i] > upperFence) {
        outlier = count(counts, OutlierCriterion.IQR_FENCE);
      }
      if (std > 0 && Math.abs(fwhm[i] - mean) / std > criteria.getZThreshold()) {
        outlier = count(counts, OutlierCriterion.Z_SCORE);
      }
      if (fwhm[i] > criteria.getMaxFwhm()) {
        outlier = count(counts, OutlierCriterion.EXCESSIVE_WIDTH);
      }
      if (outlier) {
        flagged.add(rows.get(i));
      }
    }
    return flagged;
  }

  private SortedSet<Integer> flagUnclassified(ResultTable table, List<Integer> rows,
                                              Map<OutlierCriterion, Integer> counts) {
    SortedSet<Integer> flagged = new TreeSet<>();
    for (Integer row : rows) {
      PeakRecord record = table.get(row);
      boolean outlier = false;
      if (record.getRSquared() < criteria.getUnclassifiedMinRSquared()) {
        outlier = count(counts, OutlierCriterion.LOW_FIT_QUALITY);
      }
      if (record.getFwhm() > criteria.getUnclassifiedMaxFwhm()) {
        outlier = count(counts, OutlierCriterion.EXCESSIVE_WIDTH);
      }
      if (outlier) {
        flagged.add(row);
      }
    }
    return flagged;
  }

  private static boolean count(Map<OutlierCriterion, Integer> counts, OutlierCriterion criterion) {
    counts.merge(criterion, 1, Integer::sum);
    return true;
  }

  private static double meanOrNaN(double[] values) {
    return values.length == 0 ? Double.NaN : StatUtils.mean(values);
  }
}
