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

import com.twentyn.raman.analysis.DescriptiveStats;
import com.twentyn.raman.analysis.OutlierCriterion;
import com.twentyn.raman.analysis.OutlierReport;
import com.twentyn.raman.analysis.PeakRecord;
import com.twentyn.raman.analysis.ResultTable;
import com.twentyn.raman.analysis.SampleDamageSummary;
import com.twentyn.raman.classification.DamageCategory;
import com.twentyn.raman.fitting.FittedPeak;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializes peak tables, outlier reports and sample damage summaries.  R^2 is written with six decimals and every
 * other float with four.
 */
public class ResultTableWriter {
  public static final List<String> PEAK_HEADER = Arrays.asList(
      "sample_id", "spectrum_id", "grain", "location", "peak_index", "region",
      "center", "amplitude", "sigma", "fwhm", "offset", "analytical_area", "numerical_area",
      "r_squared", "reduced_chi_square", "window_start", "window_end", "n_points", "width_corrected",
      "damage_category", "estimated_dose");

  public static final List<String> OUTLIER_HEADER;
  static {
    List<String> header = new ArrayList<>(Arrays.asList("region", "initial_count", "removed", "remaining"));
    for (OutlierCriterion criterion : OutlierCriterion.values()) {
      header.add(criterion.getColumnName());
    }
    header.addAll(Arrays.asList(
        "fwhm_mean_before", "fwhm_std_before", "fwhm_cv_before",
        "fwhm_mean_after", "fwhm_std_after", "fwhm_cv_after",
        "r_squared_mean_before", "r_squared_mean_after", "removed_rows"));
    OUTLIER_HEADER = header;
  }

  public static final List<String> DAMAGE_HEADER;
  static {
    List<String> header = new ArrayList<>(Arrays.asList(
        "sample_id", "v3_peak_count", "mean_fwhm", "mean_dose", "damage_category"));
    for (DamageCategory category : DamageCategory.values()) {
      header.add(category.name().toLowerCase() + "_count");
    }
    DAMAGE_HEADER = header;
  }

  public void writePeaks(ResultTable table, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(PEAK_HEADER)) {
      writer.open(file);
      writePeaks(table, writer);
    }
  }

  public void writePeaks(ResultTable table, Writer out) throws IOException {
    try (TSVWriter writer = new TSVWriter(PEAK_HEADER)) {
      writer.open(out);
      writePeaks(table, writer);
    }
  }

  private void writePeaks(ResultTable table, TSVWriter writer) throws IOException {
    for (PeakRecord record : table.getRecords()) {
      FittedPeak peak = record.getPeak();
      Map<String, Object> row = new HashMap<>();
      row.put("sample_id", record.getSampleId());
      row.put("spectrum_id", record.getSpectrumId());
      row.put("grain", record.getGrain());
      row.put("location", record.getLocation());
      row.put("peak_index", record.getPeakIndex());
      row.put("region", record.getRegionLabel());
      row.put("center", fixed(peak.getCenter()));
      row.put("amplitude", fixed(peak.getAmplitude()));
      row.put("sigma", fixed(peak.getSigma()));
      row.put("fwhm", fixed(peak.getFwhm()));
      row.put("offset", fixed(peak.getOffset()));
      row.put("analytical_area", fixed(peak.getAnalyticalArea()));
      row.put("numerical_area", fixed(peak.getNumericalArea()));
      row.put("r_squared", rSquared(peak.getRSquared()));
      row.put("reduced_chi_square", fixed(peak.getReducedChiSquare()));
      row.put("window_start", fixed(peak.getWindowStart()));
      row.put("window_end", fixed(peak.getWindowEnd()));
      row.put("n_points", peak.getPointCount());
      row.put("width_corrected", peak.isWidthCorrected());
      row.put("damage_category", record.getDamageCategory().getLabel());
      row.put("estimated_dose", fixed(record.getEstimatedDose()));
      writer.append(row);
    }
    writer.flush();
  }

  public void writeOutlierReport(OutlierReport report, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(OUTLIER_HEADER)) {
      writer.open(file);
      for (OutlierReport.RegionSummary summary : report.getRegions()) {
        Map<String, Object> row = new HashMap<>();
        row.put("region", summary.getLabel());
        row.put("initial_count", summary.getInitialCount());
        row.put("removed", summary.getRemovedCount());
        row.put("remaining", summary.getRemainingCount());
        for (OutlierCriterion criterion : OutlierCriterion.values()) {
          row.put(criterion.getColumnName(), summary.getCriterionCount(criterion));
        }
        putStats(row, "fwhm", "_before", summary.getFwhmBefore());
        putStats(row, "fwhm", "_after", summary.getFwhmAfter());
        row.put("r_squared_mean_before", rSquared(summary.getMeanRSquaredBefore()));
        row.put("r_squared_mean_after", rSquared(summary.getMeanRSquaredAfter()));
        row.put("removed_rows", StringUtils.join(summary.getRemovedRows(), ','));
        writer.append(row);
      }
      writer.flush();
    }
  }

  public void writeDamageSummary(List<SampleDamageSummary> summaries, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(DAMAGE_HEADER)) {
      writer.open(file);
      for (SampleDamageSummary summary : summaries) {
        Map<String, Object> row = new HashMap<>();
        row.put("sample_id", summary.getSampleId());
        row.put("v3_peak_count", summary.getPeakCount());
        row.put("mean_fwhm", fixed(summary.getMeanFwhm()));
        row.put("mean_dose", fixed(summary.getMeanDose()));
        row.put("damage_category", summary.getCategory().getLabel());
        for (DamageCategory category : DamageCategory.values()) {
          row.put(category.name().toLowerCase() + "_count", summary.getCategoryCount(category));
        }
        writer.append(row);
      }
      writer.flush();
    }
  }

  private static void putStats(Map<String, Object> row, String prefix, String suffix, DescriptiveStats stats) {
    row.put(prefix + "_mean" + suffix, fixed(stats.getMean()));
    row.put(prefix + "_std" + suffix, fixed(stats.getStd()));
    row.put(prefix + "_cv" + suffix, fixed(stats.getCoefficientOfVariation()));
  }

  public static String fixed(double value) {
    return format(value, 4);
  }

  public static String rSquared(double value) {
    return format(value, 6);
  }

  private static String format(double value, int decimals) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    return String.format(Locale.ROOT, "%." + decimals + "f", value);
  }
}
