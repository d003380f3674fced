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

import com.twentyn.raman.baseline.BaselineEstimator;
import com.twentyn.raman.classification.RadiationDamageClassifier;
import com.twentyn.raman.classification.RegionClassifier;
import com.twentyn.raman.config.BaselineConfig;
import com.twentyn.raman.config.FittingConfig;
import com.twentyn.raman.config.ProcessingConfig;
import com.twentyn.raman.fitting.FitOutcome;
import com.twentyn.raman.fitting.GaussianFitter;
import com.twentyn.raman.processing.DetectedPeak;
import com.twentyn.raman.processing.Normalizer;
import com.twentyn.raman.processing.PeakLocator;
import com.twentyn.raman.processing.SavitzkyGolaySmoother;
import com.twentyn.raman.spectrum.Spectrum;
import com.twentyn.raman.test.util.SyntheticSpectra;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumProcessorTest {

  @Test
  public void testBandsAreRecoveredAcrossNoiseSeeds() {
    SpectrumProcessor processor = new SpectrumProcessor(ProcessingConfig.defaults());
    String[] regions = {"v3(SiO4)", "v1(SiO4)", "v2(SiO4)"};
    for (double noise : new double[]{0.005, 0.01}) {
      for (long seed = 1; seed <= 20; seed++) {
        String label = String.format("noise %.3f seed %d", noise, seed);
        ResultTable table = processor.process(SyntheticSpectra.zirconSpectrum("Z1", "G1_core", seed, noise))
            .getTable();
        for (int p = 0; p < regions.length; p++) {
          List<Integer> rows = table.rowsByRegion().get(regions[p]);
          assertEquals(label + ": one band in " + regions[p], 1, rows.size());
          PeakRecord record = table.get(rows.get(0));
          assertEquals(label + ": centre in " + regions[p], SyntheticSpectra.CENTERS[p], record.getCenter(), 1.0);
          assertTrue(label + ": fit quality in " + regions[p], record.getRSquared() > 0.9);
        }
      }
    }
  }

  @Test
  public void testSyntheticZirconSpectrumEndToEnd() {
    ProcessingRun run = new SpectrumProcessor(ProcessingConfig.defaults()).process(SyntheticSpectra.zirconSpectrum());
    ResultTable table = run.getTable();

    assertEquals(1, run.getSpectraProcessed());
    assertEquals(0, run.getSpectraSkipped());
    assertEquals(0, run.getFailedFits());
    assertEquals("Exactly the three synthetic bands are found", 3, table.size());

    double[] expectedCenters = {440.0, 975.0, 1008.0};
    String[] expectedRegions = {"v2(SiO4)", "v1(SiO4)", "v3(SiO4)"};
    RadiationDamageClassifier damage = new RadiationDamageClassifier();
    for (int i = 0; i < 3; i++) {
      PeakRecord record = table.get(i);
      assertEquals("Peak centre " + i, expectedCenters[i], record.getCenter(), 1.0);
      assertTrue("Fit quality " + i, record.getRSquared() > 0.9);
      assertEquals(expectedRegions[i], record.getRegionLabel());
      assertEquals("Peaks are numbered from one", i + 1, record.getPeakIndex());
      assertEquals("Z1", record.getSampleId());
      assertEquals("G1", record.getGrain());
      assertEquals("core", record.getLocation());
      assertEquals(damage.estimateDose(record.getFwhm()), record.getEstimatedDose(), 1e-12);
      assertEquals(damage.categorize(record.getFwhm()), record.getDamageCategory());
    }
    assertTrue("The widest band stays widest", table.get(0).getFwhm() > table.get(1).getFwhm());
  }

  @Test
  public void testFailedFitsAreCountedAndSkipped() {
    GaussianFitter fitter = Mockito.mock(GaussianFitter.class);
    Mockito.doReturn(FitOutcome.failure("forced")).when(fitter)
        .fit(Mockito.any(Spectrum.class), Mockito.any(DetectedPeak.class), Mockito.any(FittingConfig.class));

    SpectrumProcessor processor = new SpectrumProcessor(ProcessingConfig.defaults(), new BaselineEstimator(),
        new Normalizer(), new SavitzkyGolaySmoother(), new PeakLocator(), fitter, new RegionClassifier(),
        new RadiationDamageClassifier());
    ProcessingRun run = processor.process(SyntheticSpectra.zirconSpectrum());

    assertEquals(1, run.getSpectraProcessed());
    assertEquals(3, run.getDetectedPeaks());
    assertEquals(3, run.getFailedFits());
    assertTrue(run.getTable().isEmpty());
  }

  @Test
  public void testPreprocessingErrorSkipsOnlyThatSpectrum() {
    Spectrum broken = SyntheticSpectra.zirconSpectrum("Z1", "G2_rim", 1L, 0.005);
    Spectrum healthy = SyntheticSpectra.zirconSpectrum("Z1", "G3_core", 2L, 0.005);

    BaselineEstimator baseline = Mockito.spy(new BaselineEstimator());
    Mockito.doThrow(new SingularMatrixException()).when(baseline)
        .correct(Mockito.argThat(s -> s != null && "G2_rim".equals(s.getSpectrumId())),
            Mockito.any(BaselineConfig.class));

    SpectrumProcessor processor = new SpectrumProcessor(ProcessingConfig.defaults(), baseline, new Normalizer(),
        new SavitzkyGolaySmoother(), new PeakLocator(), new GaussianFitter(), new RegionClassifier(),
        new RadiationDamageClassifier());
    ProcessingRun run = processor.process(Arrays.asList(broken, healthy));

    assertEquals(1, run.getSpectraSkipped());
    assertEquals(1, run.getSpectraProcessed());
    assertEquals(3, run.getTable().size());
    assertEquals("G3_core", run.getTable().get(0).getSpectrumId());
  }

  @Test
  public void testLowQualitySpectrumIsSkipped() {
    double[] x = SyntheticSpectra.axis(100.0, 200.0, 1.0);
    double[] y = new double[x.length];
    Arrays.fill(y, Double.NaN);
    y[3] = 1.0;
    ProcessingRun run = new SpectrumProcessor(ProcessingConfig.defaults())
        .process(Collections.singletonList(Spectrum.fromColumn("Z9", "G1_core", x, y)));
    assertEquals(1, run.getSpectraSkipped());
    assertEquals(0, run.getSpectraProcessed());
    assertTrue(run.getTable().isEmpty());
  }
}
