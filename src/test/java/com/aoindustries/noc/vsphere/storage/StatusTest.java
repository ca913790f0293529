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

import java.util.Arrays;
import java.util.Collections;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * @author  AO Industries, Inc.
 */
public class StatusTest extends TestCase {

  public StatusTest(String testName) {
    super(testName);
  }

  public static Test suite() {
    return new TestSuite(StatusTest.class);
  }

  public void testExitCodes() {
    assertEquals(0, Status.OK.getExitCode());
    assertEquals(1, Status.WARNING.getExitCode());
    assertEquals(2, Status.CRITICAL.getExitCode());
    assertEquals(3, Status.UNKNOWN.getExitCode());
  }

  public void testCriticalOutranksUnknown() {
    assertEquals(
        Status.CRITICAL,
        StatusUtils.getMaxStatus(Arrays.asList(
            new StatusAndMessage(Status.UNKNOWN, "a"),
            new StatusAndMessage(Status.CRITICAL, "b"),
            new StatusAndMessage(Status.UNKNOWN, "c")
        ))
    );
  }

  public void testUnknownOutranksWarning() {
    assertEquals(
        Status.UNKNOWN,
        StatusUtils.getMaxStatus(Arrays.asList(
            new StatusAndMessage(Status.WARNING, "a"),
            new StatusAndMessage(Status.UNKNOWN, "b"),
            new StatusAndMessage(Status.OK, "c")
        ))
    );
  }

  public void testNoResultsIsOk() {
    assertEquals(Status.OK, StatusUtils.getMaxStatus(Collections.<StatusAndMessage>emptyList()));
  }

  public void testParseIgnoresCase() throws ConfigurationException {
    assertEquals(Status.WARNING, Status.parse("warning"));
    assertEquals(Status.CRITICAL, Status.parse("CRITICAL"));
  }

  public void testParseInvalid() {
    try {
      Status.parse("FATAL");
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("FATAL"));
    }
  }

  public void testDetailLine() {
    assertEquals("[WARNING] disk degraded", new StatusAndMessage(Status.WARNING, "disk degraded").getDetailLine());
  }
}
