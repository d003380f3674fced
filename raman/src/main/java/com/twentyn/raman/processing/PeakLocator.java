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

package com.twentyn.raman.processing;

import com.twentyn.raman.config.PeakDetectionConfig;
import com.twentyn.raman.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds peaks in a processed spectrum and measures their half-maximum widths.
 *
 * Candidates are local maxima (a flat top resolves to its middle sample).  They are filtered, in order, by absolute
 * height, by minimum spacing (higher peaks claim their neighbourhood first), by prominence and finally by width at half
 * the prominence.  Height and prominence thresholds are percentages of the spectrum maximum.
 */
public class PeakLocator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakLocator.class);

  public static final double RELATIVE_WIDTH_HEIGHT = 0.5;

  public List<DetectedPeak> locate(Spectrum spectrum, PeakDetectionConfig config) {
    double[] y = spectrum.getIntensities();
    double max = spectrum.getMaxIntensity();
    if (!(max > 0)) {
      LOGGER.debug("Spectrum %s has no positive intensity; no peaks", spectrum.getLabel());
      return new ArrayList<>();
    }

    double minHeight = config.getHeightPercent() / 100.0 * max;
    double minProminence = config.getProminencePercent() / 100.0 * max;

    List<Integer> candidates = new ArrayList<>();
    for (int peak : localMaxima(y)) {
      if (y[peak] >= minHeight) {
        candidates.add(peak);
      }
    }
    candidates = selectByDistance(candidates, y, config.getDistance());

    List<DetectedPeak> peaks = new ArrayList<>();
    for (int peak : candidates) {
      int[] bases = new int[2];
      double prominence = prominence(y, peak, bases);
      if (prominence < minProminence) {
        continue;
      }
      DetectedPeak detected = measureWidth(spectrum, y, peak, prominence, bases[0], bases[1]);
      if (Math.abs(detected.getWidthInSamples()) < config.getMinWidth()) {
        continue;
      }
      peaks.add(detected);
    }
    LOGGER.debug("Found %d peaks in %s (%d local maxima above height)", peaks.size(), spectrum.getLabel(),
        candidates.size());
    return peaks;
  }

  /**
   * Indices of the local maxima of y; plateaus report their middle sample and edges never qualify.
   */
  public static List<Integer> localMaxima(double[] y) {
    List<Integer> maxima = new ArrayList<>();
    int i = 1;
    int last = y.length - 1;
    while (i < last) {
      if (y[i - 1] < y[i]) {
        int ahead = i + 1;
        while (ahead < last && y[ahead] == y[i]) {
          ahead++;
        }
        if (y[ahead] < y[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
          continue;
        }
      }
      i++;
    }
    return maxima;
  }

  /**
   * Drops peaks closer than distance samples to a higher peak.  Ties go to the peak that comes later in the
   * spectrum, which is what a stable sort on height produces when walked from the top.
   */
  public static List<Integer> selectByDistance(List<Integer> peaks, double[] y, int distance) {
    if (distance <= 1 || peaks.size() < 2) {
      return new ArrayList<>(peaks);
    }
    int size = peaks.size();
    boolean[] keep = new boolean[size];
    Arrays.fill(keep, true);

    Integer[] priority = new Integer[size];
    for (int i = 0; i < size; i++) {
      priority[i] = i;
    }
    Arrays.sort(priority, Comparator.comparingDouble(i -> y[peaks.get(i)]));

    for (int p = size - 1; p >= 0; p--) {
      int j = priority[p];
      if (!keep[j]) {
        continue;
      }
      for (int k = j - 1; k >= 0 && peaks.get(j) - peaks.get(k) < distance; k--) {
        keep[k] = false;
      }
      for (int k = j + 1; k < size && peaks.get(k) - peaks.get(j) < distance; k++) {
        keep[k] = false;
      }
    }

    List<Integer> selected = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      if (keep[i]) {
        selected.add(peaks.get(i));
      }
    }
    return selected;
  }

  /**
   * Height of the peak above the higher of the two minima found walking outwards until a strictly higher sample (or
   * the spectrum edge).  The indices of those minima are written into bases.
   */
  public static double prominence(double[] y, int peak, int[] bases) {
    int leftBase = peak;
    double leftMin = y[peak];
    for (int i = peak; i >= 0 && y[i] <= y[peak]; i--) {
      if (y[i] < leftMin) {
        leftMin = y[i];
        leftBase = i;
      }
    }
    int rightBase = peak;
    double rightMin = y[peak];
    for (int i = peak; i < y.length && y[i] <= y[peak]; i++) {
      if (y[i] < rightMin) {
        rightMin = y[i];
        rightBase = i;
      }
    }
    bases[0] = leftBase;
    bases[1] = rightBase;
    return y[peak] - Math.max(leftMin, rightMin);
  }

  /**
   * All local maxima whose prominence is at least minProminence.  Used to mask peaks out of baseline fits.
   */
  public static List<Integer> findProminentMaxima(double[] y, double minProminence) {
    List<Integer> result = new ArrayList<>();
    int[] bases = new int[2];
    for (int peak : localMaxima(y)) {
      if (prominence(y, peak, bases) >= minProminence) {
        result.add(peak);
      }
    }
    return result;
  }

  /**
   * Interpolates where the signal crosses half the prominence on either side of the peak, never searching past the
   * prominence bases.  Inverted or non-bracketing bounds are repaired and flagged rather than discarded.
   */
  DetectedPeak measureWidth(Spectrum spectrum, double[] y, int peak, double prominence, int leftBase, int rightBase) {
    double height = y[peak] - prominence * RELATIVE_WIDTH_HEIGHT;

    int i = peak;
    while (leftBase < i && height < y[i]) {
      i--;
    }
    double left = i;
    if (y[i] < height && i + 1 < y.length) {
      left += (height - y[i]) / (y[i + 1] - y[i]);
    }

    i = peak;
    while (i < rightBase && height < y[i]) {
      i++;
    }
    double right = i;
    if (y[i] < height && i - 1 >= 0) {
      right -= (height - y[i]) / (y[i - 1] - y[i]);
    }

    boolean corrected = false;
    double rawWidth = right - left;
    if (rawWidth < 0) {
      LOGGER.warn("Negative raw width %.3f samples for peak at %.2f in %s; using its absolute value",
          rawWidth, spectrum.getWavenumber(peak), spectrum.getLabel());
      double swap = left;
      left = right;
      right = swap;
      corrected = true;
    }
    double width = right - left;
    if (peak < left || peak > right) {
      LOGGER.debug("Half-max bounds [%.2f, %.2f] miss peak index %d in %s; recentering",
          left, right, peak, spectrum.getLabel());
      left = peak - width / 2.0;
      right = peak + width / 2.0;
      corrected = true;
    }

    double fwhm = width * spectrum.getAverageSpacing();
    return new DetectedPeak(peak, spectrum.getWavenumber(peak), y[peak], prominence, left, right,
        spectrum.wavenumberAt(left), spectrum.wavenumberAt(right), fwhm, corrected);
  }
}
