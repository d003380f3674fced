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

/**
 * Thresholds for the peak locator.  Height and prominence are percentages of the spectrum maximum; distance and width
 * are in samples.
 */
public class PeakDetectionConfig {
  public static final double DEFAULT_HEIGHT_PERCENT = 10.0;
  public static final double DEFAULT_PROMINENCE_PERCENT = 5.0;
  public static final int DEFAULT_DISTANCE = 10;
  public static final double DEFAULT_MIN_WIDTH = 3.0;

  @JsonProperty("height_percent")
  private final double heightPercent;

  @JsonProperty("prominence_percent")
  private final double prominencePercent;

  @JsonProperty("distance")
  private final int distance;

  @JsonProperty("min_width")
  private final double minWidth;

  @JsonCreator
  public PeakDetectionConfig(@JsonProperty("height_percent") Double heightPercent,
                             @JsonProperty("prominence_percent") Double prominencePercent,
                             @JsonProperty("distance") Integer distance,
                             @JsonProperty("min_width") Double minWidth) {
    this.heightPercent = heightPercent == null ? DEFAULT_HEIGHT_PERCENT : heightPercent;
    this.prominencePercent = prominencePercent == null ? DEFAULT_PROMINENCE_PERCENT : prominencePercent;
    this.distance = distance == null ? DEFAULT_DISTANCE : distance;
    this.minWidth = minWidth == null ? DEFAULT_MIN_WIDTH : minWidth;
  }

  public static PeakDetectionConfig defaults() {
    return new PeakDetectionConfig(null, null, null, null);
  }

  public double getHeightPercent() {
    return heightPercent;
  }

  public double getProminencePercent() {
    return prominencePercent;
  }

  public int getDistance() {
    return distance;
  }

  public double getMinWidth() {
    return minWidth;
  }
}
