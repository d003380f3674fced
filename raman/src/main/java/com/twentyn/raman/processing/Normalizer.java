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

import com.twentyn.raman.config.NormalizationConfig;
import com.twentyn.raman.spectrum.Spectrum;

public class Normalizer {

  public Spectrum normalize(Spectrum spectrum, NormalizationConfig config) {
    return spectrum.withIntensities(normalize(spectrum.getIntensities(), spectrum.getWavenumbers(),
        config.getMethod(), config.getReferenceIndex()));
  }

  public Spectrum normalize(Spectrum spectrum, NormalizationMethod method) {
    return spectrum.withIntensities(normalize(spectrum.getIntensities(), spectrum.getWavenumbers(), method, -1));
  }

  /**
   * @param wavenumbers Spacing used by area normalization; null integrates over unit spacing.
   */
  public double[] normalize(double[] intensities, double[] wavenumbers, NormalizationMethod method,
                            int referenceIndex) {
    if (intensities.length == 0) {
      return new double[0];
    }
    return method.scale(intensities, wavenumbers, referenceIndex);
  }
}
