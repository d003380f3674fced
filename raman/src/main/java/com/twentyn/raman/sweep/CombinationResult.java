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

package com.twentyn.raman.sweep;

import com.twentyn.raman.analysis.CleaningResult;
import com.twentyn.raman.analysis.DescriptiveStats;
import com.twentyn.raman.analysis.PeakRecord;
import com.twentyn.raman.analysis.ProcessingRun;
import com.twentyn.raman.analysis.ResultTable;
import com.twentyn.raman.baseline.BaselineMethod;
import com.twentyn.raman.classification.SpectralRegion;
import com.twentyn.raman.processing.NormalizationMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The outcome of one baseline x normalization pairing.  Statistics describe the cleaned table.  A failed combination
 * carries only its identity and the reason; all of its statistics are empty.
 */
public class CombinationResult {
  private final BaselineMethod baselineMethod;
  private final NormalizationMethod normalizationMethod;
  private final String failureReason;
  private final ResultTable cleanedTable;
  private final int rawPeakCount;
  private final int spectraProcessed;
  private final int spectraSkipped;
  private final int failedFits;
  private final Map<FitQuality, Integer> qualityHistogram;
  private final DescriptiveStats rSquared;
  private final DescriptiveStats fwhm;
  private final Map<SpectralRegion, RegionMetrics> regionMetrics;

  private CombinationResult(BaselineMethod baselineMethod, NormalizationMethod normalizationMethod,
                            String failureReason, ResultTable cleanedTable, int rawPeakCount, int spectraProcessed,
                            int spectraSkipped, int failedFits) {
    this.baselineMethod = baselineMethod;
    this.normalizationMethod = normalizationMethod;
    this.failureReason = failureReason;
    this.cleanedTable = cleanedTable;
    this.rawPeakCount = rawPeakCount;
    this.spectraProcessed = spectraProcessed;
    this.spectraSkipped = spectraSkipped;
    this.failedFits = failedFits;

    Map<FitQuality, Integer> histogram = new EnumMap<>(FitQuality.class);
    for (FitQuality quality : FitQuality.values()) {
      histogram.put(quality, 0);
    }
    for (PeakRecord record : cleanedTable.getRecords()) {
      histogram.merge(FitQuality.of(record.getRSquared()), 1, Integer::sum);
    }
    this.qualityHistogram = Collections.unmodifiableMap(histogram);
    this.rSquared = DescriptiveStats.of(cleanedTable.column(PeakRecord::getRSquared));
    this.fwhm = DescriptiveStats.of(cleanedTable.column(PeakRecord::getFwhm));

    Map<SpectralRegion, RegionMetrics> metrics = new EnumMap<>(SpectralRegion.class);
    for (SpectralRegion region : SpectralRegion.values()) {
      metrics.put(region, RegionMetrics.compute(region, cleanedTable.inRegion(region)));
    }
    this.regionMetrics = Collections.unmodifiableMap(metrics);
  }

  public static CombinationResult fromRun(BaselineMethod baselineMethod, NormalizationMethod normalizationMethod,
                                          ProcessingRun run, CleaningResult cleaning) {
    return new CombinationResult(baselineMethod, normalizationMethod, null, cleaning.getCleaned(),
        run.getTable().size(), run.getSpectraProcessed(), run.getSpectraSkipped(), run.getFailedFits());
  }

  public static CombinationResult failed(BaselineMethod baselineMethod, NormalizationMethod normalizationMethod,
                                         String reason) {
    return new CombinationResult(baselineMethod, normalizationMethod, reason, ResultTable.empty(), 0, 0, 0, 0);
  }

  public static String nameOf(BaselineMethod baselineMethod, NormalizationMethod normalizationMethod) {
    return baselineMethod.getConfigName() + "+" + normalizationMethod.getConfigName();
  }

  public String getName() {
    return nameOf(baselineMethod, normalizationMethod);
  }

  public BaselineMethod getBaselineMethod() {
    return baselineMethod;
  }

  public NormalizationMethod getNormalizationMethod() {
    return normalizationMethod;
  }

  public boolean isSuccess() {
    return failureReason == null;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public ResultTable getCleanedTable() {
    return cleanedTable;
  }

  public int getTotalPeaks() {
    return cleanedTable.size();
  }

  public int getRawPeakCount() {
    return rawPeakCount;
  }

  public int getRemovedOutliers() {
    return rawPeakCount - cleanedTable.size();
  }

  public int getSpectraProcessed() {
    return spectraProcessed;
  }

  public int getSpectraSkipped() {
    return spectraSkipped;
  }

  public int getFailedFits() {
    return failedFits;
  }

  public int getQualityCount(FitQuality quality) {
    return qualityHistogram.get(quality);
  }

  public double getPercentExcellent() {
    return percentOf(FitQuality.EXCELLENT);
  }

  public double getPercentPoor() {
    return percentOf(FitQuality.POOR);
  }

  private double percentOf(FitQuality quality) {
    int total = getTotalPeaks();
    return total == 0 ? 0.0 : 100.0 * qualityHistogram.get(quality) / total;
  }

  public DescriptiveStats getRSquared() {
    return rSquared;
  }

  public DescriptiveStats getFwhm() {
    return fwhm;
  }

  public RegionMetrics getRegionMetrics(SpectralRegion region) {
    return regionMetrics.get(region);
  }

  public Map<SpectralRegion, RegionMetrics> getRegionMetrics() {
    return regionMetrics;
  }
}
