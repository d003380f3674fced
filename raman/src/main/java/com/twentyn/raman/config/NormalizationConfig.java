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
import com.twentyn.raman.processing.NormalizationMethod;

public class NormalizationConfig {
  public static final NormalizationMethod DEFAULT_METHOD = NormalizationMethod.MIN_MAX;

  @JsonProperty("method")
  private final NormalizationMethod method;

  // Only used by peak normalization; -1 scales by the spectrum maximum.
  @JsonProperty("reference_index")
  private final int referenceIndex;

  @JsonCreator
  public NormalizationConfig(@JsonProperty("method") NormalizationMethod method,
                             @JsonProperty("reference_index") Integer referenceIndex) {
    this.method = method == null ? DEFAULT_METHOD : method;
    this.referenceIndex = referenceIndex == null ? -1 : referenceIndex;
  }

  public static NormalizationConfig defaults() {
    return new NormalizationConfig(null, null);
  }

  public NormalizationConfig withMethod(NormalizationMethod newMethod) {
    return new NormalizationConfig(newMethod, referenceIndex);
  }

  public NormalizationMethod getMethod() {
    return method;
  }

  public int getReferenceIndex() {
    return referenceIndex;
  }
}
