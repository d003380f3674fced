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

package com.twentyn.raman.classification;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RadiationDamageClassifierTest {
  private final RadiationDamageClassifier classifier = new RadiationDamageClassifier();

  @Test
  public void testDoseCalibration() {
    assertEquals(-0.1402 + 0.07683 * 10.0, classifier.estimateDose(10.0), 1e-12);
    assertEquals(-0.1402, classifier.estimateDose(0.0), 1e-12);
  }

  @Test
  public void testDoseIsMonotonicInWidth() {
    double previous = Double.NEGATIVE_INFINITY;
    for (double fwhm = 1.0; fwhm < 60.0; fwhm += 0.5) {
      double dose = classifier.estimateDose(fwhm);
      assertTrue(String.format("Dose must increase at FWHM %.1f", fwhm), dose > previous);
      previous = dose;
    }
  }

  @Test
  public void testCategoryBoundariesAreInclusive() {
    assertEquals(DamageCategory.LOW, classifier.categorize(3.0));
    assertEquals(DamageCategory.LOW, classifier.categorize(8.0));
    assertEquals(DamageCategory.MODERATE, classifier.categorize(8.0001));
    assertEquals(DamageCategory.MODERATE, classifier.categorize(14.5));
    assertEquals(DamageCategory.HIGH, classifier.categorize(14.51));
    assertEquals(DamageCategory.HIGH, classifier.categorize(25.0));
    assertEquals(DamageCategory.NEAR_AMORPHOUS, classifier.categorize(25.01));
    assertEquals("low damage", DamageCategory.LOW.getLabel());
    assertEquals("moderate damage", DamageCategory.MODERATE.getLabel());
    assertEquals("high damage", DamageCategory.HIGH.getLabel());
    assertEquals("near-amorphous", DamageCategory.NEAR_AMORPHOUS.getLabel());
  }
}
