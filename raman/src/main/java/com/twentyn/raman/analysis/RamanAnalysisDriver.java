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

import com.twentyn.raman.config.ProcessingConfig;
import com.twentyn.raman.io.ResultTableWriter;
import com.twentyn.raman.io.SweepReportWriter;
import com.twentyn.raman.spectrum.Spectrum;
import com.twentyn.raman.spectrum.SpectrumTableParser;
import com.twentyn.raman.sweep.CombinatorialSweep;
import com.twentyn.raman.sweep.ComparativeSummary;
import com.twentyn.raman.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class RamanAnalysisDriver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RamanAnalysisDriver.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_SWEEP = "s";
  public static final String OPTION_THREADS = "t";

  public static final String PEAKS_FULL_FILE = "peaks_full.tsv";
  public static final String PEAKS_CLEANED_FILE = "peaks_cleaned.tsv";
  public static final String OUTLIER_SUMMARY_FILE = "outlier_summary.tsv";
  public static final String DAMAGE_SUMMARY_FILE = "sample_damage_summary.tsv";

  private static final String[] INPUT_EXTENSIONS = new String[]{"tsv", "txt", "csv"};

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Fits the vibrational bands of zircon Raman spectra and estimates radiation damage.  Each input table holds ",
      "one sample: a wavenumber column followed by one intensity column per grain_location spectrum.  By default the ",
      "configured pipeline runs once and writes the full and cleaned peak tables; with --sweep every baseline and ",
      "normalization pairing is run and compared region by region."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {
    {
      add(Option.builder(OPTION_INPUT)
          .argName("path")
          .desc("Input spectrum tables, or directories of .tsv/.txt/.csv tables (default: the configured input dir)")
          .hasArgs()
          .valueSeparator(',')
          .longOpt("input")
      );
      add(Option.builder(OPTION_OUTPUT)
          .argName("directory")
          .desc("Directory for output tables (default: the configured output dir)")
          .hasArg()
          .longOpt("output")
      );
      add(Option.builder(OPTION_CONFIG)
          .argName("json file")
          .desc("Processing configuration; missing fields take their defaults")
          .hasArg()
          .longOpt("config")
      );
      add(Option.builder(OPTION_SWEEP)
          .argName("sweep")
          .desc("Run and compare every baseline x normalization combination")
          .longOpt("sweep")
      );
      add(Option.builder(OPTION_THREADS)
          .argName("count")
          .desc("Number of combinations to process concurrently in sweep mode (default 1)")
          .hasArg()
          .longOpt("threads")
      );
    }
  };

  public static void main(String[] args) throws IOException {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Runs the driver and returns the process exit status.
   */
  public static int run(String[] args) throws IOException {
    CLIUtil cliUtil = new CLIUtil(RamanAnalysisDriver.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);
    if (cl == null) {
      return 1;
    }

    ProcessingConfig config;
    if (cl.hasOption(OPTION_CONFIG)) {
      File configFile = new File(cl.getOptionValue(OPTION_CONFIG));
      if (!configFile.isFile()) {
        cliUtil.failWithMessage("Config file at %s does not exist", configFile.getAbsolutePath());
        return 1;
      }
      config = ProcessingConfig.load(configFile);
    } else {
      config = ProcessingConfig.defaults();
    }

    int threads = 1;
    if (cl.hasOption(OPTION_THREADS)) {
      try {
        threads = Integer.parseInt(cl.getOptionValue(OPTION_THREADS));
      } catch (NumberFormatException e) {
        cliUtil.failWithMessage("Thread count must be an integer, got '%s'", cl.getOptionValue(OPTION_THREADS));
        return 1;
      }
      if (threads < 1) {
        cliUtil.failWithMessage("Thread count must be positive, got %d", threads);
        return 1;
      }
    }

    String[] inputPaths = cl.hasOption(OPTION_INPUT) ?
        cl.getOptionValues(OPTION_INPUT) : new String[]{config.getIo().getInputDirectory()};
    List<File> inputFiles = collectInputs(inputPaths);
    if (inputFiles.isEmpty()) {
      cliUtil.failWithMessage("No input tables found under %s", StringUtils.join(inputPaths, ", "));
      return 1;
    }

    File outputDir = new File(cl.getOptionValue(OPTION_OUTPUT, config.getIo().getOutputDirectory()));
    if (!outputDir.exists() && !outputDir.mkdirs()) {
      LOGGER.error("Unable to create output directory at %s", outputDir.getAbsolutePath());
      return 1;
    }

    List<Spectrum> spectra = readSpectra(inputFiles);
    LOGGER.info("Read %d spectra from %d file(s)", spectra.size(), inputFiles.size());

    if (cl.hasOption(OPTION_SWEEP)) {
      ComparativeSummary summary = new CombinatorialSweep(config, OutlierCriteria.defaults(), threads).runSweep(spectra);
      new SweepReportWriter().write(summary, outputDir);
    } else {
      runSingle(config, spectra, outputDir);
    }
    return 0;
  }

  public static void runSingle(ProcessingConfig config, List<Spectrum> spectra, File outputDir) throws IOException {
    ProcessingRun run = new SpectrumProcessor(config).process(spectra);
    CleaningResult cleaning = new OutlierDetector().clean(run.getTable());

    ResultTableWriter writer = new ResultTableWriter();
    writer.writePeaks(run.getTable(), new File(outputDir, PEAKS_FULL_FILE));
    writer.writePeaks(cleaning.getCleaned(), new File(outputDir, PEAKS_CLEANED_FILE));
    writer.writeOutlierReport(cleaning.getReport(), new File(outputDir, OUTLIER_SUMMARY_FILE));
    writer.writeDamageSummary(SampleDamageSummary.summarize(cleaning.getCleaned()),
        new File(outputDir, DAMAGE_SUMMARY_FILE));
    LOGGER.info("Wrote %d peaks (%d after cleaning) to %s",
        run.getTable().size(), cleaning.getCleaned().size(), outputDir.getAbsolutePath());
  }

  static List<File> collectInputs(String[] paths) {
    List<File> files = new ArrayList<>();
    for (String path : paths) {
      File f = new File(path);
      if (f.isDirectory()) {
        List<File> found = new ArrayList<>(FileUtils.listFiles(f, INPUT_EXTENSIONS, false));
        Collections.sort(found);
        files.addAll(found);
      } else if (f.isFile()) {
        files.add(f);
      } else {
        LOGGER.warn("Input %s does not exist, ignoring", f.getAbsolutePath());
      }
    }
    return files;
  }

  static List<Spectrum> readSpectra(Collection<File> files) {
    SpectrumTableParser parser = new SpectrumTableParser();
    List<Spectrum> spectra = new ArrayList<>();
    for (File file : files) {
      try {
        spectra.addAll(parser.parse(file));
      } catch (IOException e) {
        LOGGER.error("Skipping %s: %s", file.getAbsolutePath(), e.getMessage());
      }
    }
    return spectra;
  }
}
