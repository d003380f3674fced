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

import com.twentyn.raman.classification.SpectralRegion;
import com.twentyn.raman.sweep.CombinationResult;
import com.twentyn.raman.sweep.ComparativeSummary;
import com.twentyn.raman.sweep.FitQuality;
import com.twentyn.raman.sweep.NormalizationImpact;
import com.twentyn.raman.sweep.RegionMetrics;
import com.twentyn.raman.sweep.RegionRanking;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.twentyn.raman.io.ResultTableWriter.fixed;
import static com.twentyn.raman.io.ResultTableWriter.rSquared;

/**
 * Writes the files of a combinatorial sweep into one directory: per-combination peak tables and region metrics, the
 * comparative region table (one row per combination and region, failed combinations included), the combination
 * overview, rankings and normalization impact.
 */
public class SweepReportWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SweepReportWriter.class);

  public static final String COMPARATIVE_FILE = "comparative_region_metrics.tsv";
  public static final String OVERVIEW_FILE = "combination_summary.tsv";
  public static final String RANKINGS_FILE = "region_rankings.tsv";
  public static final String IMPACT_FILE = "normalization_impact.tsv";
  public static final String RESULTS_SUFFIX = "_results.tsv";
  public static final String REGION_METRICS_SUFFIX = "_region_metrics.tsv";

  public static final List<String> REGION_METRICS_COLUMNS = Arrays.asList(
      "region", "count", "r_squared_mean", "r_squared_std", "fwhm_mean", "fwhm_std", "fwhm_cv",
      "center_mean", "center_std", "center_cv", "area_mean", "area_std", "composite_score");

  public static final List<String> COMPARATIVE_HEADER;
  static {
    List<String> header = new ArrayList<>(Arrays.asList("combination", "baseline", "normalization", "status"));
    header.addAll(REGION_METRICS_COLUMNS);
    COMPARATIVE_HEADER = header;
  }

  public static final List<String> OVERVIEW_HEADER;
  static {
    List<String> header = new ArrayList<>(Arrays.asList(
        "combination", "baseline", "normalization", "status", "failure_reason", "total_peaks", "raw_peaks",
        "removed_outliers", "spectra_processed", "spectra_skipped", "failed_fits"));
    for (FitQuality quality : FitQuality.values()) {
      header.add(quality.getLabel());
    }
    header.addAll(Arrays.asList("pct_excellent", "pct_poor", "r_squared_mean", "r_squared_std",
        "fwhm_mean", "fwhm_std", "fwhm_cv"));
    OVERVIEW_HEADER = header;
  }

  public static final List<String> RANKINGS_HEADER = Arrays.asList("region", "ranked_by", "rank", "combination", "value");
  public static final List<String> IMPACT_HEADER =
      Arrays.asList("baseline", "scope", "variants", "delta_fwhm", "delta_cv", "impact");

  private final ResultTableWriter tableWriter = new ResultTableWriter();

  public void write(ComparativeSummary summary, File outputDirectory) throws IOException {
    for (CombinationResult result : summary.getResults()) {
      if (!result.isSuccess()) {
        continue;
      }
      tableWriter.writePeaks(result.getCleanedTable(), new File(outputDirectory, result.getName() + RESULTS_SUFFIX));
      writeRegionMetrics(result, new File(outputDirectory, result.getName() + REGION_METRICS_SUFFIX));
    }
    writeComparative(summary, new File(outputDirectory, COMPARATIVE_FILE));
    writeOverview(summary, new File(outputDirectory, OVERVIEW_FILE));
    writeRankings(summary, new File(outputDirectory, RANKINGS_FILE));
    writeImpact(summary, new File(outputDirectory, IMPACT_FILE));
    LOGGER.info("Wrote sweep reports for %d combinations to %s",
        summary.getResults().size(), outputDirectory.getAbsolutePath());
  }

  public void writeRegionMetrics(CombinationResult result, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(REGION_METRICS_COLUMNS)) {
      writer.open(file);
      for (SpectralRegion region : SpectralRegion.values()) {
        writer.append(regionRow(result.getRegionMetrics(region)));
      }
      writer.flush();
    }
  }

  public void writeComparative(ComparativeSummary summary, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(COMPARATIVE_HEADER)) {
      writer.open(file);
      for (CombinationResult result : summary.getResults()) {
        for (SpectralRegion region : SpectralRegion.values()) {
          Map<String, Object> row = regionRow(result.getRegionMetrics(region));
          putIdentity(row, result);
          writer.append(row);
        }
      }
      writer.flush();
    }
  }

  public void writeOverview(ComparativeSummary summary, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(OVERVIEW_HEADER)) {
      writer.open(file);
      for (CombinationResult result : summary.getResults()) {
        Map<String, Object> row = new HashMap<>();
        putIdentity(row, result);
        row.put("failure_reason", result.isSuccess() ? "" : result.getFailureReason());
        row.put("total_peaks", result.getTotalPeaks());
        row.put("raw_peaks", result.getRawPeakCount());
        row.put("removed_outliers", result.getRemovedOutliers());
        row.put("spectra_processed", result.getSpectraProcessed());
        row.put("spectra_skipped", result.getSpectraSkipped());
        row.put("failed_fits", result.getFailedFits());
        for (FitQuality quality : FitQuality.values()) {
          row.put(quality.getLabel(), result.getQualityCount(quality));
        }
        row.put("pct_excellent", fixed(result.getPercentExcellent()));
        row.put("pct_poor", fixed(result.getPercentPoor()));
        row.put("r_squared_mean", rSquared(result.getRSquared().getMean()));
        row.put("r_squared_std", rSquared(result.getRSquared().getStd()));
        row.put("fwhm_mean", fixed(result.getFwhm().getMean()));
        row.put("fwhm_std", fixed(result.getFwhm().getStd()));
        row.put("fwhm_cv", fixed(result.getFwhm().getCoefficientOfVariation()));
        writer.append(row);
      }
      writer.flush();
    }
  }

  public void writeRankings(ComparativeSummary summary, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(RANKINGS_HEADER)) {
      writer.open(file);
      for (RegionRanking ranking : summary.getRankings().values()) {
        appendRanking(writer, ranking.getRegion(), "composite_score", ranking.getByCompositeScore(), false);
        appendRanking(writer, ranking.getRegion(), "fwhm_cv", ranking.getByFwhmCv(), false);
        appendRanking(writer, ranking.getRegion(), "r_squared_mean", ranking.getByMeanRSquared(), true);
      }
      writer.flush();
    }
  }

  private void appendRanking(TSVWriter writer, SpectralRegion region, String rankedBy,
                             List<RegionRanking.Entry> entries, boolean isRSquared) throws IOException {
    for (int i = 0; i < entries.size(); i++) {
      Map<String, Object> row = new HashMap<>();
      row.put("region", region.getLabel());
      row.put("ranked_by", rankedBy);
      row.put("rank", i + 1);
      row.put("combination", entries.get(i).getCombination());
      row.put("value", isRSquared ? rSquared(entries.get(i).getValue()) : fixed(entries.get(i).getValue()));
      writer.append(row);
    }
  }

  public void writeImpact(ComparativeSummary summary, File file) throws IOException {
    try (TSVWriter writer = new TSVWriter(IMPACT_HEADER)) {
      writer.open(file);
      for (NormalizationImpact impact : summary.getImpacts()) {
        if (impact.getGlobal() != null) {
          writer.append(impactRow(impact, "global", impact.getGlobal()));
        }
        for (Map.Entry<SpectralRegion, NormalizationImpact.Spread> entry : impact.getRegions().entrySet()) {
          writer.append(impactRow(impact, entry.getKey().getLabel(), entry.getValue()));
        }
      }
      writer.flush();
    }
  }

  private static Map<String, Object> impactRow(NormalizationImpact impact, String scope,
                                               NormalizationImpact.Spread spread) {
    Map<String, Object> row = new HashMap<>();
    row.put("baseline", impact.getBaselineMethod().getConfigName());
    row.put("scope", scope);
    row.put("variants", impact.getVariantCount());
    row.put("delta_fwhm", fixed(spread.getDeltaFwhm()));
    row.put("delta_cv", fixed(spread.getDeltaCv()));
    row.put("impact", spread.getLevel().getLabel());
    return row;
  }

  private static void putIdentity(Map<String, Object> row, CombinationResult result) {
    row.put("combination", result.getName());
    row.put("baseline", result.getBaselineMethod().getConfigName());
    row.put("normalization", result.getNormalizationMethod().getConfigName());
    row.put("status", result.isSuccess() ? "ok" : "failed");
  }

  private static Map<String, Object> regionRow(RegionMetrics metrics) {
    Map<String, Object> row = new HashMap<>();
    row.put("region", metrics.getRegion().getLabel());
    row.put("count", metrics.getCount());
    row.put("r_squared_mean", rSquared(metrics.getRSquared().getMean()));
    row.put("r_squared_std", rSquared(metrics.getRSquared().getStd()));
    row.put("fwhm_mean", fixed(metrics.getFwhm().getMean()));
    row.put("fwhm_std", fixed(metrics.getFwhm().getStd()));
    row.put("fwhm_cv", fixed(metrics.getFwhm().getCoefficientOfVariation()));
    row.put("center_mean", fixed(metrics.getCenter().getMean()));
    row.put("center_std", fixed(metrics.getCenter().getStd()));
    row.put("center_cv", fixed(metrics.getCenter().getCoefficientOfVariation()));
    row.put("area_mean", fixed(metrics.getArea().getMean()));
    row.put("area_std", fixed(metrics.getArea().getStd()));
    row.put("composite_score", fixed(metrics.getCompositeScore()));
    return row;
  }
}
