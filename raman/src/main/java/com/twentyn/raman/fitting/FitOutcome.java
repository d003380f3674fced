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

package com.twentyn.raman.fitting;

/**
 * Result of fitting one peak: either a {@link FittedPeak} or the reason there is none.  Callers must check
 * {@link #isSuccess()} before asking for the peak.
 */
public abstract class FitOutcome {

  private FitOutcome() {
  }

  public static FitOutcome success(FittedPeak peak) {
    return new Success(peak);
  }

  public static FitOutcome failure(String reason) {
    return new Failure(reason);
  }

  public abstract boolean isSuccess();

  /**
   * @throws IllegalStateException if this outcome is a failure.
   */
  public abstract FittedPeak getPeak();

  /**
   * @throws IllegalStateException if this outcome is a success.
   */
  public abstract String getFailureReason();

  public static final class Success extends FitOutcome {
    private final FittedPeak peak;

    private Success(FittedPeak peak) {
      this.peak = peak;
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public FittedPeak getPeak() {
      return peak;
    }

    @Override
    public String getFailureReason() {
      throw new IllegalStateException("Successful fit has no failure reason");
    }
  }

  public static final class Failure extends FitOutcome {
    private final String reason;

    private Failure(String reason) {
      this.reason = reason;
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public FittedPeak getPeak() {
      throw new IllegalStateException("Failed fit has no peak: " + reason);
    }

    @Override
    public String getFailureReason() {
      return reason;
    }

    @Override
    public String toString() {
      return "Failure: " + reason;
    }
  }
}
