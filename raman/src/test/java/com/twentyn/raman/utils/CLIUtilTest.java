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

package com.twentyn.raman.utils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {
  private static final List<Option.Builder> OPTIONS = Collections.singletonList(
      Option.builder("i").argName("path").desc("Inputs").hasArgs().valueSeparator(',').longOpt("input"));

  @Test
  public void testHelpIsAlwaysAvailable() {
    CLIUtil cliUtil = new CLIUtil(CLIUtilTest.class, "Test driver", OPTIONS);
    assertTrue(cliUtil.getOptions().hasOption("help"));
    assertTrue(cliUtil.getOptions().hasOption("input"));
    assertNull("Help short-circuits parsing", cliUtil.parseCommandLine(new String[]{"-h"}));
  }

  @Test
  public void testCommaSeparatedValues() {
    CLIUtil cliUtil = new CLIUtil(CLIUtilTest.class, "Test driver", OPTIONS);
    CommandLine cl = cliUtil.parseCommandLine(new String[]{"--input", "a.tsv,b.tsv"});
    assertNotNull(cl);
    assertArrayEquals(new String[]{"a.tsv", "b.tsv"}, cl.getOptionValues("i"));
    assertSame(cl, cliUtil.getCommandLine());
  }

  @Test
  public void testUnknownOptionYieldsNull() {
    CLIUtil cliUtil = new CLIUtil(CLIUtilTest.class, "Test driver", OPTIONS);
    assertNull(cliUtil.parseCommandLine(new String[]{"--bogus"}));
  }
}
