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

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RegionClassifierTest {
  private final RegionClassifier classifier = new RegionClassifier();

  @Test
  public void testHalfOpenExternalModesTileWithoutOverlap() {
    assertEquals("External-1", classifier.label(195.0));
    assertEquals("External-1", classifier.label(209.999));
    assertEquals("210 belongs to the next band", "External-2", classifier.label(210.0));
    assertEquals("External-3", classifier.label(220.0));
    assertEquals("External-3", classifier.label(229.999));
    assertEquals("230 is outside every band", SpectralRegion.UNCLASSIFIED_LABEL, classifier.label(230.0));
  }

  @Test
  public void testClosedBandsIncludeBothEnds() {
    assertEquals("External-4", classifier.label(350.0));
    assertEquals("External-4", classifier.label(365.0));
    assertEquals(SpectralRegion.UNCLASSIFIED_LABEL, classifier.label(365.01));
    assertEquals("v2(SiO4)", classifier.label(430.0));
    assertEquals("v2(SiO4)", classifier.label(450.0));
    assertEquals("v1(SiO4)", classifier.label(985.0));
    assertEquals(SpectralRegion.UNCLASSIFIED_LABEL, classifier.label(986.0));
    assertEquals("v3(SiO4)", classifier.label(990.0));
    assertEquals("v3(SiO4)", classifier.label(1020.0));
    assertEquals(SpectralRegion.UNCLASSIFIED_LABEL, classifier.label(1020.5));
  }

  @Test
  public void testEveryCenterHasAtMostOneRegion() {
    for (double c = 150.0; c <= 1100.0; c += 0.25) {
      int matches = 0;
      for (SpectralRegion region : SpectralRegion.values()) {
        if (region.contains(c)) {
          matches++;
        }
      }
      assertTrue(String.format("Center %.2f matched %d regions", c, matches), matches <= 1);
      Optional<SpectralRegion> classified = classifier.classify(c);
      assertEquals(matches == 1, classified.isPresent());
    }
  }

  @Test
  public void testNonFiniteCenterIsUnclassified() {
    assertFalse(classifier.classify(Double.NaN).isPresent());
    assertEquals(SpectralRegion.V3_SIO4, SpectralRegion.fromLabel("v3(SiO4)"));
  }
}
