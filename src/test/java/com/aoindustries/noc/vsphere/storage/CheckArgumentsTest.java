/*
 * noc-vsphere-storage - Storage health check for vSphere hosts.
 * Copyright (C) 2023  AO Industries, Inc.
 *     support@aoindustries.com
 *     7262 Bull Pen Cir
 *     Mobile, AL 36695
 *
 * This file is part of noc-vsphere-storage.
 *
 * noc-vsphere-storage is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * noc-vsphere-storage is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with noc-vsphere-storage.  If not, see <https://www.gnu.org/licenses/>.
 */
package com.aoindustries.noc.vsphere.storage;

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * @author  AO Industries, Inc.
 */
public class CheckArgumentsTest extends TestCase {

  public CheckArgumentsTest(String testName) {
    super(testName);
  }

  public static Test suite() {
    return new TestSuite(CheckArgumentsTest.class);
  }

  public void testDefaults() throws ConfigurationException {
    CheckArguments arguments = CheckArguments.builder().hostName("esx1").mode(Mode.LUN).build();
    assertEquals("esx1", arguments.getHostName());
    assertSame(Mode.LUN, arguments.getMode());
    assertSame(Status.UNKNOWN, arguments.getMaintenanceStatus());
    assertTrue(arguments.getFilter().getAllowed().isEmpty());
    assertTrue(arguments.getFilter().getBanned().isEmpty());
  }

  public void testPatternsCompiled() throws ConfigurationException {
    CheckArguments arguments = CheckArguments.builder()
        .hostName("esx1")
        .mode(Mode.ADAPTER)
        .allow("^device:")
        .ban("model:FC.*")
        .ban("key:x")
        .build();
    assertEquals(1, arguments.getFilter().getAllowed().size());
    assertEquals(2, arguments.getFilter().getBanned().size());
  }

  public void testMissingHost() {
    try {
      CheckArguments.builder().mode(Mode.LUN).build();
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertEquals("missing required option --vihost", e.getMessage());
    }
  }

  public void testMissingMode() {
    try {
      CheckArguments.builder().hostName("esx1").build();
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertEquals("missing required option --mode", e.getMessage());
    }
  }

  public void testInvalidPattern() {
    try {
      CheckArguments.builder().hostName("esx1").mode(Mode.LUN).allow("(").build();
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("invalid pattern \"(\""));
    }
  }

  public void testModeParse() throws ConfigurationException {
    assertSame(Mode.ADAPTER, Mode.parse("adapter"));
    assertSame(Mode.LUN, Mode.parse("lun"));
    try {
      Mode.parse("datastore");
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertEquals("invalid mode: datastore, expected adapter or lun", e.getMessage());
    }
  }
}
