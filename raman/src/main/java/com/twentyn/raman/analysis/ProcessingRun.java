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

/**
 * The peak table produced from a batch of spectra, with the bookkeeping needed to judge how much of the batch made it
 * through.
 */
public class ProcessingRun {
  private final ResultTable table;
  private final int spectraProcessed;
  private final int spectraSkipped;
  private final int detectedPeaks;
  private final int failedFits;

  public ProcessingRun(ResultTable table, int spectraProcessed, int spectraSkipped, int detectedPeaks,
                       int failedFits) {
    this.table = table;
    this.spectraProcessed = spectraProcessed;
    this.spectraSkipped = spectraSkipped;
    this.detectedPeaks = detectedPeaks;
    this.failedFits = failedFits;
  }

  public ResultTable getTable() {
    return table;
  }

  public int getSpectraProcessed() {
    return spectraProcessed;
  }

  public int getSpectraSkipped() {
    return spectraSkipped;
  }

  public int getDetectedPeaks() {
    return detectedPeaks;
  }

  public int getFailedFits() {
    return failedFits;
  }
}
