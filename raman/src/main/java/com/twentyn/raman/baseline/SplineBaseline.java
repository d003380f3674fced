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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Smoothing-spline baseline through the samples outside the prominent peaks.  The retained points are smoothed with
 * loess, joined by a cubic spline evaluated on a finer grid, and resampled onto the spectrum's own wavenumbers.  If the
 * smoother or spline cannot be built, the baseline falls back to straight lines between the retained points.
 *
 * Unlike the other methods, the corrected spectrum is floored at zero and scaled to a peak of one.
 */
public class SplineBaseline implements BaselineCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SplineBaseline.class);

  // Loess needs at least this many points inside every local fit.
  private static final double MIN_POINTS_PER_FIT = 4.0;
  private static final int LOESS_ROBUSTNESS_ITERATIONS = 2;

  private final double smoothing;
  private final int resolution;

  public SplineBaseline(double smoothing, int resolution) {
    this.smoothing = smoothing;
    this.resolution = Math.max(1, resolution);
  }

  @Override
  public BaselineResult estimate(double[] wavenumbers, double[] intensities) {
    int n = intensities.length;
    boolean[] keep = PeakMask.keepOutsidePeaks(intensities);
    if (PeakMask.count(keep) < n / 2.0) {
      LOGGER.debug("Peak masking removed %d of %d points; masking by median intensity instead",
          n - PeakMask.count(keep), n);
      keep = keepBelowMedian(intensities);
    }
    if (PeakMask.count(keep) < 2) {
      keep = new boolean[n];
      Arrays.fill(keep, true);
    }

    double[] xs = PeakMask.select(wavenumbers, keep);
    double[] ys = PeakMask.select(intensities, keep);

    double[] baseline;
    try {
      baseline = splineBaseline(wavenumbers, xs, ys);
    } catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException e) {
      LOGGER.warn("Spline baseline failed (%s); falling back to linear interpolation", e.getMessage());
      baseline = linearBaseline(wavenumbers, xs, ys);
    }
    baseline = PeakMask.clipToSpectrum(baseline, intensities);

    double[] corrected = new double[n];
    double floor = Double.POSITIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      corrected[i] = intensities[i] - baseline[i];
      floor = Math.min(floor, corrected[i]);
    }
    double peak = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      corrected[i] -= floor;
      peak = Math.max(peak, corrected[i]);
    }
    if (peak > 0) {
      for (int i = 0; i < n; i++) {
        corrected[i] /= peak;
      }
    }
    return new BaselineResult(corrected, baseline);
  }

  static boolean[] keepBelowMedian(double[] y) {
    double median = StatUtils.percentile(y, 50.0);
    boolean[] keep = new boolean[y.length];
    for (int i = 0; i < y.length; i++) {
      keep[i] = y[i] <= median;
    }
    return keep;
  }

  private double[] splineBaseline(double[] wavenumbers, double[] xs, double[] ys) {
    double bandwidth = Math.min(1.0, Math.max(smoothing, MIN_POINTS_PER_FIT / xs.length));
    double[] smoothed = new LoessInterpolator(bandwidth, LOESS_ROBUSTNESS_ITERATIONS).smooth(xs, ys);
    for (double v : smoothed) {
      if (!Double.isFinite(v)) {
        LOGGER.warn("Loess produced non-finite values; falling back to linear interpolation");
        return linearBaseline(wavenumbers, xs, ys);
      }
    }
    PolynomialSplineFunction spline = new SplineInterpolator().interpolate(xs, smoothed);

    int n = wavenumbers.length;
    int fine = (n - 1) * resolution + 1;
    double lo = wavenumbers[0];
    double hi = wavenumbers[n - 1];
    double[] fineX = new double[fine];
    double[] fineY = new double[fine];
    for (int i = 0; i < fine; i++) {
      fineX[i] = fine == 1 ? lo : lo + (hi - lo) * i / (fine - 1);
      fineY[i] = spline.value(clamp(fineX[i], xs[0], xs[xs.length - 1]));
    }
    if (fine == 1) {
      return new double[]{fineY[0]};
    }

    PolynomialSplineFunction resample = new LinearInterpolator().interpolate(fineX, fineY);
    double[] baseline = new double[n];
    for (int i = 0; i < n; i++) {
      baseline[i] = resample.value(clamp(wavenumbers[i], lo, hi));
    }
    return baseline;
  }

  static double[] linearBaseline(double[] wavenumbers, double[] xs, double[] ys) {
    double[] baseline = new double[wavenumbers.length];
    if (xs.length == 1) {
      Arrays.fill(baseline, ys[0]);
      return baseline;
    }
    PolynomialSplineFunction line = new LinearInterpolator().interpolate(xs, ys);
    for (int i = 0; i < wavenumbers.length; i++) {
      baseline[i] = line.value(clamp(wavenumbers[i], xs[0], xs[xs.length - 1]));
    }
    return baseline;
  }

  private static double clamp(double v, double lo, double hi) {
    return Math.max(lo, Math.min(hi, v));
  }
}
