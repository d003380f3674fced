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

package com.twentyn.raman.baseline;

import com.twentyn.raman.processing.PeakLocator;

import java.util.Arrays;

/**
 * Marks which samples of a raw spectrum may anchor a baseline fit: everything except a window around each prominent
 * local maximum.
 */
class PeakMask {
  // Maxima less prominent than this fraction of the intensity range are left in the fit as noise.
  static final double PROMINENCE_FRACTION = 0.05;
  // Half-width of the excluded window, as a fraction of the spectrum length.
  static final double WINDOW_FRACTION = 0.02;

  private PeakMask() {
  }

  static boolean[] keepOutsidePeaks(double[] y) {
    boolean[] keep = new boolean[y.length];
    Arrays.fill(keep, true);
    if (y.length < 3) {
      return keep;
    }

    double min = Arrays.stream(y).min().getAsDouble();
    double max = Arrays.stream(y).max().getAsDouble();
    double range = max - min;
    if (!(range > 0)) {
      return keep;
    }

    int halfWindow = Math.max(1, (int) Math.round(WINDOW_FRACTION * y.length));
    for (int peak : PeakLocator.findProminentMaxima(y, PROMINENCE_FRACTION * range)) {
      int from = Math.max(0, peak - halfWindow);
      int to = Math.min(y.length - 1, peak + halfWindow);
      for (int i = from; i <= to; i++) {
        keep[i] = false;
      }
    }
    return keep;
  }

  static int count(boolean[] keep) {
    int c = 0;
    for (boolean k : keep) {
      if (k) {
        c++;
      }
    }
    return c;
  }

  static double[] select(double[] values, boolean[] keep) {
    double[] out = new double[count(keep)];
    int j = 0;
    for (int i = 0; i < values.length; i++) {
      if (keep[i]) {
        out[j++] = values[i];
      }
    }
    return out;
  }

  static double[] clipToSpectrum(double[] baseline, double[] y) {
    double[] out = new double[baseline.length];
    for (int i = 0; i < baseline.length; i++) {
      out[i] = Math.min(baseline[i], y[i]);
    }
    return out;
  }
}
