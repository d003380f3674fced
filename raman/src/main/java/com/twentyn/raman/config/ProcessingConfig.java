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

package com.twentyn.raman.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.raman.baseline.BaselineMethod;
import com.twentyn.raman.processing.NormalizationMethod;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Everything one pipeline run needs to know, grouped the way the JSON config file is laid out.  Instances are
 * immutable: the combinatorial sweep derives a fresh copy per baseline/normalization pair rather than mutating one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingConfig {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("normalization")
  private final NormalizationConfig normalization;

  @JsonProperty("baseline")
  private final BaselineConfig baseline;

  @JsonProperty("smoothing")
  private final SmoothingConfig smoothing;

  @JsonProperty("peak_detection")
  private final PeakDetectionConfig peakDetection;

  @JsonProperty("fitting")
  private final FittingConfig fitting;

  @JsonProperty("io")
  private final IOConfig io;

  @JsonCreator
  public ProcessingConfig(@JsonProperty("normalization") NormalizationConfig normalization,
                          @JsonProperty("baseline") BaselineConfig baseline,
                          @JsonProperty("smoothing") SmoothingConfig smoothing,
                          @JsonProperty("peak_detection") PeakDetectionConfig peakDetection,
                          @JsonProperty("fitting") FittingConfig fitting,
                          @JsonProperty("io") IOConfig io) {
    this.normalization = normalization == null ? NormalizationConfig.defaults() : normalization;
    this.baseline = baseline == null ? BaselineConfig.defaults() : baseline;
    this.smoothing = smoothing == null ? SmoothingConfig.defaults() : smoothing;
    this.peakDetection = peakDetection == null ? PeakDetectionConfig.defaults() : peakDetection;
    this.fitting = fitting == null ? FittingConfig.defaults() : fitting;
    this.io = io == null ? IOConfig.defaults() : io;
  }

  public static ProcessingConfig defaults() {
    return new ProcessingConfig(null, null, null, null, null, null);
  }

  public static ProcessingConfig load(File configFile) throws IOException {
    return OBJECT_MAPPER.readValue(configFile, ProcessingConfig.class);
  }

  public static ProcessingConfig load(InputStream is) throws IOException {
    return OBJECT_MAPPER.readValue(is, ProcessingConfig.class);
  }

  public String toJson() throws IOException {
    return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
  }

  public ProcessingConfig withBaselineMethod(BaselineMethod method) {
    return new ProcessingConfig(normalization, baseline.withMethod(method), smoothing, peakDetection, fitting, io);
  }

  public ProcessingConfig withNormalizationMethod(NormalizationMethod method) {
    return new ProcessingConfig(normalization.withMethod(method), baseline, smoothing, peakDetection, fitting, io);
  }

  public NormalizationConfig getNormalization() {
    return normalization;
  }

  public BaselineConfig getBaseline() {
    return baseline;
  }

  public SmoothingConfig getSmoothing() {
    return smoothing;
  }

  public PeakDetectionConfig getPeakDetection() {
    return peakDetection;
  }

  public FittingConfig getFitting() {
    return fitting;
  }

  public IOConfig getIo() {
    return io;
  }
}
