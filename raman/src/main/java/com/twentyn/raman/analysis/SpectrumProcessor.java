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
import com.twentyn.raman.classification.SpectralRegion;
import com.twentyn.raman.config.ProcessingConfig;
import com.twentyn.raman.fitting.FitOutcome;
import com.twentyn.raman.fitting.FittedPeak;
import com.twentyn.raman.fitting.GaussianFitter;
import com.twentyn.raman.processing.DetectedPeak;
import com.twentyn.raman.processing.Normalizer;
import com.twentyn.raman.processing.PeakLocator;
import com.twentyn.raman.processing.SavitzkyGolaySmoother;
import com.twentyn.raman.spectrum.Spectrum;
import com.twentyn.raman.spectrum.SpectrumQualityFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs the per-spectrum pipeline: quality screening, baseline removal, normalization, smoothing, peak detection,
 * Gaussian fitting and classification.  A spectrum that cannot be processed is skipped and a peak that cannot be fit
 * is dropped; neither stops the batch.
 */
public class SpectrumProcessor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumProcessor.class);

  private final ProcessingConfig config;
  private final BaselineEstimator baselineEstimator;
  private final Normalizer normalizer;
  private final SavitzkyGolaySmoother smoother;
  private final PeakLocator peakLocator;
  private final GaussianFitter fitter;
  private final RegionClassifier regionClassifier;
  private final RadiationDamageClassifier damageClassifier;

  public SpectrumProcessor(ProcessingConfig config) {
    this(config, new BaselineEstimator(), new Normalizer(), new SavitzkyGolaySmoother(), new PeakLocator(),
        new GaussianFitter(), new RegionClassifier(), new RadiationDamageClassifier());
  }

  public SpectrumProcessor(ProcessingConfig config, BaselineEstimator baselineEstimator, Normalizer normalizer,
                           SavitzkyGolaySmoother smoother, PeakLocator peakLocator, GaussianFitter fitter,
                           RegionClassifier regionClassifier, RadiationDamageClassifier damageClassifier) {
    this.config = config;
    this.baselineEstimator = baselineEstimator;
    this.normalizer = normalizer;
    this.smoother = smoother;
    this.peakLocator = peakLocator;
    this.fitter = fitter;
    this.regionClassifier = regionClassifier;
    this.damageClassifier = damageClassifier;
  }

  public ProcessingConfig getConfig() {
    return config;
  }

  public ProcessingRun process(List<Spectrum> spectra) {
    List<PeakRecord> records = new ArrayList<>();
    int processed = 0;
    int skipped = 0;
    int detected = 0;
    int failed = 0;

    for (Spectrum raw : spectra) {
      Optional<Spectrum> screened = SpectrumQualityFilter.screen(raw);
      if (!screened.isPresent()) {
        skipped++;
        continue;
      }

      Spectrum prepared;
      List<DetectedPeak> peaks;
      try {
        prepared = prepare(screened.get());
        peaks = peakLocator.locate(prepared, config.getPeakDetection());
      } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
        LOGGER.warn("Skipping spectrum %s: preprocessing failed: %s", raw.getLabel(), e.getMessage());
        skipped++;
        continue;
      }
      processed++;
      detected += peaks.size();

      int peakIndex = 0;
      for (DetectedPeak peak : peaks) {
        FitOutcome outcome = fitter.fit(prepared, peak, config.getFitting());
        if (!outcome.isSuccess()) {
          LOGGER.warn("Dropping peak in %s: %s", raw.getLabel(), outcome.getFailureReason());
          failed++;
          continue;
        }
        peakIndex++;
        records.add(toRecord(prepared, peakIndex, outcome.getPeak()));
      }
      LOGGER.debug("%s: %d peaks detected, %d fitted", raw.getLabel(), peaks.size(), peakIndex);
    }

    LOGGER.info("Processed %d spectra (%d skipped): %d peaks fitted, %d fits failed",
        processed, skipped, records.size(), failed);
    return new ProcessingRun(new ResultTable(records), processed, skipped, detected, failed);
  }

  public ProcessingRun process(Spectrum spectrum) {
    return process(Collections.singletonList(spectrum));
  }

  /**
   * Baseline correction, normalization and smoothing, in that order.
   */
  public Spectrum prepare(Spectrum spectrum) {
    Spectrum corrected = baselineEstimator.correct(spectrum, config.getBaseline());
    Spectrum normalized = normalizer.normalize(corrected, config.getNormalization());
    return smoother.smooth(normalized, config.getSmoothing());
  }

  private PeakRecord toRecord(Spectrum spectrum, int peakIndex, FittedPeak peak) {
    SpectralRegion region = regionClassifier.classify(peak.getCenter()).orElse(null);
    return new PeakRecord(spectrum.getSampleId(), spectrum.getSpectrumId(), spectrum.getGrain(),
        spectrum.getLocation(), peakIndex, peak, region,
        damageClassifier.categorize(peak.getFwhm()), damageClassifier.estimateDose(peak.getFwhm()));
  }
}
