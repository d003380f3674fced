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

package com.twentyn.raman.baseline;

import com.twentyn.raman.config.BaselineConfig;
import com.twentyn.raman.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for background removal: builds the corrector the config names and applies it to one spectrum.
 */
public class BaselineEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BaselineEstimator.class);

  public BaselineResult estimate(Spectrum spectrum, BaselineConfig config) {
    BaselineMethod method = config.getMethod();
    LOGGER.debug("Estimating %s baseline for %s", method.getConfigName(), spectrum.getLabel());
    return method.createCorrector(config).estimate(spectrum.getWavenumbers(), spectrum.getIntensities());
  }

  public Spectrum correct(Spectrum spectrum, BaselineConfig config) {
    return spectrum.withIntensities(estimate(spectrum, config).getCorrected());
  }
}
