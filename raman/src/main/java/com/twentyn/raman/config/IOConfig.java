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
import com.fasterxml.jackson.annotation.JsonProperty;

public class IOConfig {
  public static final String DEFAULT_INPUT_DIRECTORY = "data";
  public static final String DEFAULT_OUTPUT_DIRECTORY = "results";

  @JsonProperty("input_directory")
  private final String inputDirectory;

  @JsonProperty("output_directory")
  private final String outputDirectory;

  @JsonCreator
  public IOConfig(@JsonProperty("input_directory") String inputDirectory,
                  @JsonProperty("output_directory") String outputDirectory) {
    this.inputDirectory = inputDirectory == null ? DEFAULT_INPUT_DIRECTORY : inputDirectory;
    this.outputDirectory = outputDirectory == null ? DEFAULT_OUTPUT_DIRECTORY : outputDirectory;
  }

  public static IOConfig defaults() {
    return new IOConfig(null, null);
  }

  public String getInputDirectory() {
    return inputDirectory;
  }

  public String getOutputDirectory() {
    return outputDirectory;
  }
}
