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

public class SmoothingConfig {
  public static final int DEFAULT_WINDOW_LENGTH = 11;
  public static final int DEFAULT_POLY_ORDER = 3;

  @JsonProperty("window_length")
  private final int windowLength;

  @JsonProperty("poly_order")
  private final int polyOrder;

  @JsonCreator
  public SmoothingConfig(@JsonProperty("window_length") Integer windowLength,
                         @JsonProperty("poly_order") Integer polyOrder) {
    this.windowLength = windowLength == null ? DEFAULT_WINDOW_LENGTH : windowLength;
    this.polyOrder = polyOrder == null ? DEFAULT_POLY_ORDER : polyOrder;
  }

  public static SmoothingConfig defaults() {
    return new SmoothingConfig(null, null);
  }

  public int getWindowLength() {
    return windowLength;
  }

  public int getPolyOrder() {
    return polyOrder;
  }
}
