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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a sweep produced: one result per requested combination, in request order, plus the per-region rankings
 * and the normalization impact assessment derived from them.
 */
public class ComparativeSummary {
  private final List<CombinationResult> results;
  private final Map<SpectralRegion, RegionRanking> rankings;
  private final List<NormalizationImpact> impacts;
  private final List<String> diagnostics;

  public ComparativeSummary(List<CombinationResult> results, List<String> diagnostics) {
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    Map<SpectralRegion, RegionRanking> ranked = new EnumMap<>(SpectralRegion.class);
    for (SpectralRegion region : SpectralRegion.values()) {
      ranked.put(region, RegionRanking.rank(region, this.results));
    }
    this.rankings = Collections.unmodifiableMap(ranked);
    this.impacts = Collections.unmodifiableList(NormalizationImpact.assess(this.results));
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public List<CombinationResult> getResults() {
    return results;
  }

  public List<CombinationResult> getSuccessfulResults() {
    List<CombinationResult> successful = new ArrayList<>();
    for (CombinationResult result : results) {
      if (result.isSuccess()) {
        successful.add(result);
      }
    }
    return successful;
  }

  public CombinationResult getResult(String name) {
    for (CombinationResult result : results) {
      if (result.getName().equals(name)) {
        return result;
      }
    }
    throw new IllegalArgumentException(String.format("No combination named '%s'", name));
  }

  public RegionRanking getRanking(SpectralRegion region) {
    return rankings.get(region);
  }

  public Map<SpectralRegion, RegionRanking> getRankings() {
    return rankings;
  }

  public List<NormalizationImpact> getImpacts() {
    return impacts;
  }

  public List<String> getDiagnostics() {
    return diagnostics;
  }
}
