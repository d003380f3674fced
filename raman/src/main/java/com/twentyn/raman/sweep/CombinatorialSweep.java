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

import com.twentyn.raman.analysis.CleaningResult;
import com.twentyn.raman.analysis.OutlierCriteria;
import com.twentyn.raman.analysis.OutlierDetector;
import com.twentyn.raman.analysis.ProcessingRun;
import com.twentyn.raman.analysis.SpectrumProcessor;
import com.twentyn.raman.baseline.BaselineMethod;
import com.twentyn.raman.config.ProcessingConfig;
import com.twentyn.raman.processing.NormalizationMethod;
import com.twentyn.raman.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the full pipeline once per baseline x normalization pairing and compares the outcomes.
 *
 * Every combination gets its own copy of the configuration and its own processor, so combinations can run on a
 * thread pool.  Results are always gathered in submission order, which keeps the summary identical whatever the
 * thread count.  No combination can abort the sweep: failures are recorded against the combination that caused them.
 */
public class CombinatorialSweep {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CombinatorialSweep.class);

  public static final List<BaselineMethod> DEFAULT_BASELINE_METHODS =
      Collections.unmodifiableList(Arrays.asList(BaselineMethod.values()));
  public static final List<NormalizationMethod> DEFAULT_NORMALIZATION_METHODS =
      Collections.unmodifiableList(Arrays.asList(
          NormalizationMethod.MIN_MAX, NormalizationMethod.AREA, NormalizationMethod.VECTOR, NormalizationMethod.PEAK));

  private final ProcessingConfig baseConfig;
  private final OutlierCriteria outlierCriteria;
  private final int threads;

  public CombinatorialSweep(ProcessingConfig baseConfig) {
    this(baseConfig, OutlierCriteria.defaults(), 1);
  }

  public CombinatorialSweep(ProcessingConfig baseConfig, OutlierCriteria outlierCriteria, int threads) {
    this.baseConfig = baseConfig;
    this.outlierCriteria = outlierCriteria;
    this.threads = Math.max(1, threads);
  }

  public ComparativeSummary runSweep(List<Spectrum> inputs) {
    return runSweep(inputs, DEFAULT_BASELINE_METHODS, DEFAULT_NORMALIZATION_METHODS);
  }

  public ComparativeSummary runSweep(List<Spectrum> inputs, List<BaselineMethod> baselineMethods,
                                     List<NormalizationMethod> normalizationMethods) {
    List<String> diagnostics = new ArrayList<>();
    List<CombinationTask> tasks = new ArrayList<>(baselineMethods.size() * normalizationMethods.size());
    for (BaselineMethod baseline : baselineMethods) {
      for (NormalizationMethod normalization : normalizationMethods) {
        tasks.add(new CombinationTask(inputs, baseline, normalization));
      }
    }

    if (inputs.isEmpty()) {
      String message = "No input spectra; every combination is reported as failed";
      LOGGER.warn(message);
      diagnostics.add(message);
      List<CombinationResult> results = new ArrayList<>(tasks.size());
      for (CombinationTask task : tasks) {
        results.add(CombinationResult.failed(task.baseline, task.normalization, "no input spectra"));
      }
      return new ComparativeSummary(results, diagnostics);
    }

    LOGGER.info("Running %d combinations over %d spectra on %d thread(s)", tasks.size(), inputs.size(), threads);
    List<CombinationResult> results = threads > 1 ? runParallel(tasks) : runSequential(tasks);

    int failures = 0;
    for (CombinationResult result : results) {
      if (!result.isSuccess()) {
        failures++;
        diagnostics.add(String.format("%s failed: %s", result.getName(), result.getFailureReason()));
      }
    }
    LOGGER.info("Sweep finished: %d of %d combinations succeeded", results.size() - failures, results.size());
    return new ComparativeSummary(results, diagnostics);
  }

  private List<CombinationResult> runSequential(List<CombinationTask> tasks) {
    List<CombinationResult> results = new ArrayList<>(tasks.size());
    for (CombinationTask task : tasks) {
      results.add(task.call());
    }
    return results;
  }

  private List<CombinationResult> runParallel(List<CombinationTask> tasks) {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, tasks.size()));
    try {
      List<Future<CombinationResult>> futures = new ArrayList<>(tasks.size());
      for (CombinationTask task : tasks) {
        futures.add(executor.submit(task));
      }
      List<CombinationResult> results = new ArrayList<>(tasks.size());
      for (int i = 0; i < futures.size(); i++) {
        CombinationTask task = tasks.get(i);
        try {
          results.add(futures.get(i).get());
        } catch (ExecutionException e) {
          LOGGER.error("Combination %s threw: %s", task.name(), e.getCause());
          results.add(CombinationResult.failed(task.baseline, task.normalization, String.valueOf(e.getCause())));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOGGER.error("Interrupted while waiting for combination %s", task.name());
          results.add(CombinationResult.failed(task.baseline, task.normalization, "interrupted"));
        }
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private class CombinationTask implements Callable<CombinationResult> {
    private final List<Spectrum> inputs;
    private final BaselineMethod baseline;
    private final NormalizationMethod normalization;

    CombinationTask(List<Spectrum> inputs, BaselineMethod baseline, NormalizationMethod normalization) {
      this.inputs = inputs;
      this.baseline = baseline;
      this.normalization = normalization;
    }

    String name() {
      return CombinationResult.nameOf(baseline, normalization);
    }

    @Override
    public CombinationResult call() {
      ProcessingConfig config = baseConfig.withBaselineMethod(baseline).withNormalizationMethod(normalization);
      try {
        ProcessingRun run = new SpectrumProcessor(config).process(inputs);
        if (run.getTable().isEmpty()) {
          LOGGER.warn("Combination %s produced no peaks", name());
          return CombinationResult.failed(baseline, normalization, String.format(
              "no peaks fitted (%d spectra processed, %d skipped, %d fits failed)",
              run.getSpectraProcessed(), run.getSpectraSkipped(), run.getFailedFits()));
        }
        CleaningResult cleaning = new OutlierDetector(outlierCriteria).clean(run.getTable());
        CombinationResult result = CombinationResult.fromRun(baseline, normalization, run, cleaning);
        LOGGER.info("Combination %s: %d peaks kept of %d", name(), result.getTotalPeaks(), result.getRawPeakCount());
        return result;
      } catch (RuntimeException e) {
        LOGGER.error("Combination %s failed: %s", name(), e.getMessage());
        return CombinationResult.failed(baseline, normalization, e.getClass().getSimpleName() + ": " + e.getMessage());
      }
    }
  }
}
