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

import com.twentyn.raman.classification.DamageCategory;
import com.twentyn.raman.classification.RadiationDamageClassifier;
import com.twentyn.raman.classification.SpectralRegion;
import org.apache.commons.math3.stat.StatUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-sample radiation damage from the v3(SiO4) band, the band whose broadening tracks metamictization.  Samples with
 * no v3 peak are left out.
 */
public class SampleDamageSummary {
  public static final SpectralRegion INDICATOR_REGION = SpectralRegion.V3_SIO4;

  private final String sampleId;
  private final int peakCount;
  private final double meanFwhm;
  private final double meanDose;
  private final DamageCategory category;
  private final Map<DamageCategory, Integer> categoryCounts;

  public SampleDamageSummary(String sampleId, int peakCount, double meanFwhm, double meanDose,
                             DamageCategory category, Map<DamageCategory, Integer> categoryCounts) {
    this.sampleId = sampleId;
    this.peakCount = peakCount;
    this.meanFwhm = meanFwhm;
    this.meanDose = meanDose;
    this.category = category;
    this.categoryCounts = Collections.unmodifiableMap(new EnumMap<>(categoryCounts));
  }

  /**
   * One summary per sample, ordered by sample id.
   */
  public static List<SampleDamageSummary> summarize(ResultTable table) {
    Map<String, List<PeakRecord>> bySample = new TreeMap<>();
    for (PeakRecord record : table.inRegion(INDICATOR_REGION)) {
      bySample.computeIfAbsent(record.getSampleId(), k -> new ArrayList<>()).add(record);
    }

    RadiationDamageClassifier classifier = new RadiationDamageClassifier();
    List<SampleDamageSummary> summaries = new ArrayList<>(bySample.size());
    for (Map.Entry<String, List<PeakRecord>> entry : bySample.entrySet()) {
      List<PeakRecord> records = entry.getValue();
      Map<DamageCategory, Integer> counts = new EnumMap<>(DamageCategory.class);
      for (DamageCategory category : DamageCategory.values()) {
        counts.put(category, 0);
      }
      for (PeakRecord record : records) {
        counts.merge(record.getDamageCategory(), 1, Integer::sum);
      }
      double meanFwhm = StatUtils.mean(ResultTable.column(records, PeakRecord::getFwhm));
      double meanDose = StatUtils.mean(ResultTable.column(records, PeakRecord::getEstimatedDose));
      summaries.add(new SampleDamageSummary(entry.getKey(), records.size(), meanFwhm, meanDose,
          classifier.categorize(meanFwhm), counts));
    }
    return summaries;
  }

  public String getSampleId() {
    return sampleId;
  }

  public int getPeakCount() {
    return peakCount;
  }

  public double getMeanFwhm() {
    return meanFwhm;
  }

  public double getMeanDose() {
    return meanDose;
  }

  public DamageCategory getCategory() {
    return category;
  }

  public int getCategoryCount(DamageCategory category) {
    Integer count = categoryCounts.get(category);
    return count == null ? 0 : count;
  }
}
