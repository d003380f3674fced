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

import com.twentyn.raman.baseline.BaselineMethod;
import com.twentyn.raman.classification.SpectralRegion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * For one baseline method, the spread (max - min) of mean FWHM and FWHM CV across its normalization variants, over
 * all peaks and per region.  Only successful variants with peaks in the scope count; a region no variant populated is
 * absent.
 */
public class NormalizationImpact {
  private final BaselineMethod baselineMethod;
  private final int variantCount;
  private final Spread global;
  private final Map<SpectralRegion, Spread> regions;

  private NormalizationImpact(BaselineMethod baselineMethod, int variantCount, Spread global,
                              Map<SpectralRegion, Spread> regions) {
    this.baselineMethod = baselineMethod;
    this.variantCount = variantCount;
    this.global = global;
    this.regions = Collections.unmodifiableMap(regions);
  }

  /**
   * One entry per baseline method that has at least one successful combination, in the order first seen.
   */
  public static List<NormalizationImpact> assess(List<CombinationResult> results) {
    Map<BaselineMethod, List<CombinationResult>> byBaseline = new EnumMap<>(BaselineMethod.class);
    List<BaselineMethod> order = new ArrayList<>();
    for (CombinationResult result : results) {
      if (!result.isSuccess()) {
        continue;
      }
      if (!byBaseline.containsKey(result.getBaselineMethod())) {
        order.add(result.getBaselineMethod());
        byBaseline.put(result.getBaselineMethod(), new ArrayList<>());
      }
      byBaseline.get(result.getBaselineMethod()).add(result);
    }

    List<NormalizationImpact> impacts = new ArrayList<>(order.size());
    for (BaselineMethod method : order) {
      List<CombinationResult> variants = byBaseline.get(method);
      List<double[]> globalPoints = new ArrayList<>();
      for (CombinationResult variant : variants) {
        if (variant.getTotalPeaks() > 0) {
          globalPoints.add(new double[]{variant.getFwhm().getMean(), variant.getFwhm().getCoefficientOfVariation()});
        }
      }
      Map<SpectralRegion, Spread> regionSpreads = new EnumMap<>(SpectralRegion.class);
      for (SpectralRegion region : SpectralRegion.values()) {
        List<double[]> points = new ArrayList<>();
        for (CombinationResult variant : variants) {
          RegionMetrics metrics = variant.getRegionMetrics(region);
          if (metrics.getCount() > 0) {
            points.add(new double[]{metrics.getFwhm().getMean(), metrics.getFwhm().getCoefficientOfVariation()});
          }
        }
        if (!points.isEmpty()) {
          regionSpreads.put(region, Spread.of(points));
        }
      }
      impacts.add(new NormalizationImpact(method, variants.size(),
          globalPoints.isEmpty() ? null : Spread.of(globalPoints), regionSpreads));
    }
    return impacts;
  }

  public BaselineMethod getBaselineMethod() {
    return baselineMethod;
  }

  public int getVariantCount() {
    return variantCount;
  }

  /**
   * Null when none of the variants produced a peak.
   */
  public Spread getGlobal() {
    return global;
  }

  public Map<SpectralRegion, Spread> getRegions() {
    return regions;
  }

  public static class Spread {
    private final double deltaFwhm;
    private final double deltaCv;
    private final ImpactLevel level;

    public Spread(double deltaFwhm, double deltaCv) {
      this.deltaFwhm = deltaFwhm;
      this.deltaCv = deltaCv;
      this.level = ImpactLevel.classify(deltaFwhm, deltaCv);
    }

    // Each point is {mean FWHM, FWHM CV}.
    static Spread of(List<double[]> points) {
      double minFwhm = Double.POSITIVE_INFINITY;
      double maxFwhm = Double.NEGATIVE_INFINITY;
      double minCv = Double.POSITIVE_INFINITY;
      double maxCv = Double.NEGATIVE_INFINITY;
      for (double[] point : points) {
        minFwhm = Math.min(minFwhm, point[0]);
        maxFwhm = Math.max(maxFwhm, point[0]);
        minCv = Math.min(minCv, point[1]);
        maxCv = Math.max(maxCv, point[1]);
      }
      return new Spread(maxFwhm - minFwhm, maxCv - minCv);
    }

    public double getDeltaFwhm() {
      return deltaFwhm;
    }

    public double getDeltaCv() {
      return deltaCv;
    }

    public ImpactLevel getLevel() {
      return level;
    }
  }
}
