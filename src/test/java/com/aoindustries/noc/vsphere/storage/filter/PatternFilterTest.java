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
package com.aoindustries.noc.vsphere.storage.filter;

import com.aoindustries.noc.vsphere.storage.ConfigurationException;
import java.util.Arrays;
import java.util.Collections;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * @author  AO Industries, Inc.
 */
public class PatternFilterTest extends TestCase {

  public PatternFilterTest(String testName) {
    super(testName);
  }

  public static Test suite() {
    return new TestSuite(PatternFilterTest.class);
  }

  public void testAllowAll() {
    assertTrue(PatternFilter.ALLOW_ALL.accepts("anything"));
    assertTrue(PatternFilter.ALLOW_ALL.accepts("device:vmhba0", "model:x", "key:y"));
  }

  public void testEmptyAllowListExcludesNothing() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Collections.emptyList(), Arrays.asList("^tmp"));
    assertTrue(filter.accepts("datastore1"));
    assertTrue(filter.isAllowed("datastore1"));
    assertFalse(filter.accepts("tmp-disk"));
  }

  public void testDenyWinsOverAllow() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("Disk"), Arrays.asList("Disk2"));
    assertTrue(filter.accepts("Disk1"));
    assertFalse(filter.accepts("Disk2"));
  }

  public void testSearchNotFullMatch() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("vmhba"), Collections.emptyList());
    assertTrue(filter.accepts("device:vmhba32"));
    assertFalse(filter.accepts("device:nvme0"));
  }

  public void testCaseSensitive() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("disk"), Collections.emptyList());
    assertFalse(filter.accepts("Disk1"));
  }

  public void testAnyCandidateBanned() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("^device:vmhba"), Arrays.asList("^model:FC.*"));
    assertFalse(filter.accepts("device:vmhba2", "model:FC HBA", "key:k2"));
    assertTrue(filter.accepts("device:vmhba1", "model:SAS HBA", "key:k1"));
  }

  public void testAnyCandidateAllowed() throws ConfigurationException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("^key:k1$"), Collections.emptyList());
    assertTrue(filter.accepts("device:vmhba1", "model:SAS HBA", "key:k1"));
    assertFalse(filter.accepts("device:vmhba2", "model:SAS HBA", "key:k2"));
  }

  public void testInvalidPattern() {
    try {
      PatternFilter.compile(Arrays.asList("ok"), Arrays.asList("[unclosed"));
      fail("ConfigurationException expected");
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("[unclosed"));
      assertNotNull(e.getCause());
    }
  }
}
