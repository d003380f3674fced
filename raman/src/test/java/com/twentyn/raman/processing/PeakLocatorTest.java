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
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PeakLocatorTest {
  private final PeakLocator locator = new PeakLocator();

  private static Spectrum twoBands(double step) {
    double[] x = SyntheticSpectra.axis(300.0, 700.0, step);
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = SyntheticSpectra.gaussian(x[i], 1.0, 440.0, 5.0) + SyntheticSpectra.gaussian(x[i], 0.5, 600.0, 3.0);
    }
    return new Spectrum(x, y);
  }

  @Test
  public void testFindsBandsWithHalfMaximumWidths() {
    List<DetectedPeak> peaks = locator.locate(twoBands(1.0), PeakDetectionConfig.defaults());
    assertEquals(2, peaks.size());

    DetectedPeak v2 = peaks.get(0);
    assertEquals(440.0, v2.getWavenumber(), 0.0);
    assertEquals("FWHM of a sigma 5 Gaussian", 2.355 * 5.0, v2.getFwhm(), 0.1);
    assertEquals(440.0 - 1.1775 * 5.0, v2.getLeftHalfMax(), 0.1);
    assertEquals(440.0 + 1.1775 * 5.0, v2.getRightHalfMax(), 0.1);
    assertEquals(1.0, v2.getProminence(), 1e-6);
    assertFalse(v2.isWidthCorrected());

    DetectedPeak other = peaks.get(1);
    assertEquals(600.0, other.getWavenumber(), 0.0);
    assertEquals(2.355 * 3.0, other.getFwhm(), 0.1);
  }

  @Test
  public void testFwhmScalesWithSampleSpacing() {
    List<DetectedPeak> peaks = locator.locate(twoBands(0.5), PeakDetectionConfig.defaults());
    assertEquals(2, peaks.size());
    assertEquals("Widths are reported in wavenumbers", 2.355 * 5.0, peaks.get(0).getFwhm(), 0.05);
    assertEquals(2.0 * peaks.get(0).getFwhm(), peaks.get(0).getWidthInSamples(), 1e-9);
  }

  @Test
  public void testThresholdsDropSmallAndNarrowPeaks() {
    double[] x = SyntheticSpectra.axis(0.0, 200.0, 1.0);
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = SyntheticSpectra.gaussian(x[i], 1.0, 50.0, 4.0) + SyntheticSpectra.gaussian(x[i], 0.05, 120.0, 4.0);
    }
    y[170] = 0.8;
    List<DetectedPeak> peaks = locator.locate(new Spectrum(x, y), PeakDetectionConfig.defaults());
    assertEquals("Only the main band passes height and width limits", 1, peaks.size());
    assertEquals(50.0, peaks.get(0).getWavenumber(), 0.0);
  }

  @Test
  public void testPlateauResolvesToItsMiddle() {
    double[] y = {0.0, 1.0, 2.0, 2.0, 2.0, 1.0, 0.0};
    assertEquals(Arrays.asList(3), PeakLocator.localMaxima(y));
    double[] even = {0.0, 2.0, 2.0, 0.0};
    assertEquals(Arrays.asList(1), PeakLocator.localMaxima(even));
  }

  @Test
  public void testDistanceKeepsTheHigherPeak() {
    double[] y = new double[30];
    y[10] = 1.0;
    y[14] = 2.0;
    y[25] = 1.5;
    List<Integer> selected = PeakLocator.selectByDistance(Arrays.asList(10, 14, 25), y, 10);
    assertEquals(Arrays.asList(14, 25), selected);

    double[] tie = new double[30];
    tie[10] = 1.0;
    tie[14] = 1.0;
    assertEquals("Ties keep the later peak", Arrays.asList(14),
        PeakLocator.selectByDistance(Arrays.asList(10, 14), tie, 10));
  }

  @Test
  public void testProminenceUsesHigherOfTheTwoBases() {
    double[] y = {0.0, 3.0, 1.0, 2.0, 0.5, 0.0};
    int[] bases = new int[2];
    assertEquals("Left walk stops at the higher sample at index 1", 1.0, PeakLocator.prominence(y, 3, bases), 1e-12);
    assertEquals(2, bases[0]);
    assertEquals(5, bases[1]);
    assertTrue(PeakLocator.findProminentMaxima(y, 1.5).contains(1));
    assertFalse(PeakLocator.findProminentMaxima(y, 1.5).contains(3));
  }

  @Test
  public void testInvertedHalfMaxBoundsAreSwapped() {
    // A negative prominence puts the half-height above the sample, so both crossings are extrapolated past each other.
    double[] y = {4.0, 3.0, 2.0, 3.0, 4.0};
    Spectrum spectrum = new Spectrum(SyntheticSpectra.axis(100.0, 104.0, 1.0), y);
    DetectedPeak peak = locator.measureWidth(spectrum, y, 2, -2.0, 0, 4);
    assertTrue(peak.isWidthCorrected());
    assertEquals(1.0, peak.getLeftPosition(), 1e-12);
    assertEquals(3.0, peak.getRightPosition(), 1e-12);
    assertEquals("Absolute value of the raw width of -2 samples", 2.0, peak.getWidthInSamples(), 1e-12);
    assertEquals(2.0, peak.getFwhm(), 1e-12);
  }

  @Test
  public void testBoundsMissingThePeakAreRecentered() {
    double[] y = {6.0, 4.0, 3.0, 2.5, 2.0};
    Spectrum spectrum = new Spectrum(SyntheticSpectra.axis(100.0, 104.0, 1.0), y);
    // Raw bounds are [0, 1], left of the peak at index 2.
    DetectedPeak peak = locator.measureWidth(spectrum, y, 2, -2.0, 0, 4);
    assertTrue(peak.isWidthCorrected());
    assertEquals(1.0, peak.getWidthInSamples(), 1e-12);
    assertEquals("Window is centred on the peak", 2.0,
        (peak.getLeftPosition() + peak.getRightPosition()) / 2.0, 1e-12);
    assertEquals(101.5, peak.getLeftHalfMax(), 1e-12);
    assertEquals(102.5, peak.getRightHalfMax(), 1e-12);
  }
}
