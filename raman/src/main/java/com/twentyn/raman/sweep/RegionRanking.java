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

import com.twentyn.raman.classification.SpectralRegion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Orders the successful combinations three ways for one region.  Combinations with no usable score for the region
 * are left out, and equal values are broken by combination name so the order is stable.
 */
public class RegionRanking {
  private final SpectralRegion region;
  private final List<Entry> byCompositeScore;
  private final List<Entry> byFwhmCv;
  private final List<Entry> byMeanRSquared;

  private RegionRanking(SpectralRegion region, List<Entry> byCompositeScore, List<Entry> byFwhmCv,
                        List<Entry> byMeanRSquared) {
    this.region = region;
    this.byCompositeScore = Collections.unmodifiableList(byCompositeScore);
    this.byFwhmCv = Collections.unmodifiableList(byFwhmCv);
    this.byMeanRSquared = Collections.unmodifiableList(byMeanRSquared);
  }

  public static RegionRanking rank(SpectralRegion region, List<CombinationResult> results) {
    List<CombinationResult> eligible = new ArrayList<>();
    for (CombinationResult result : results) {
      if (result.isSuccess() && Double.isFinite(result.getRegionMetrics(region).getCompositeScore())) {
        eligible.add(result);
      }
    }
    return new RegionRanking(region,
        order(eligible, r -> r.getRegionMetrics(region).getCompositeScore(), true),
        order(eligible, r -> r.getRegionMetrics(region).getFwhm().getCoefficientOfVariation(), false),
        order(eligible, r -> r.getRegionMetrics(region).getRSquared().getMean(), true));
  }

  private static List<Entry> order(List<CombinationResult> results, Function<CombinationResult, Double> metric,
                                   boolean descending) {
    List<Entry> entries = new ArrayList<>(results.size());
    for (CombinationResult result : results) {
      entries.add(new Entry(result.getName(), metric.apply(result)));
    }
    Comparator<Entry> byValue = Comparator.comparingDouble(Entry::getValue);
    if (descending) {
      byValue = byValue.reversed();
    }
    entries.sort(byValue.thenComparing(Entry::getCombination));
    return entries;
  }

  public SpectralRegion getRegion() {
    return region;
  }

  public List<Entry> getByCompositeScore() {
    return byCompositeScore;
  }

  public List<Entry> getByFwhmCv() {
    return byFwhmCv;
  }

  public List<Entry> getByMeanRSquared() {
    return byMeanRSquared;
  }

  public static class Entry {
    private final String combination;
    private final double value;

    public Entry(String combination, double value) {
      this.combination = combination;
      this.value = value;
    }

    public String getCombination() {
      return combination;
    }

    public double getValue() {
      return value;
    }
  }
}
