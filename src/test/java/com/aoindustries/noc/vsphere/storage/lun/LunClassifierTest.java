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
package com.aoindustries.noc.vsphere.storage.lun;

import static com.aoindustries.noc.vsphere.storage.inventory.Snapshots.lun;
import static com.aoindustries.noc.vsphere.storage.inventory.Snapshots.topology;

import com.aoindustries.noc.vsphere.storage.Classification;
import com.aoindustries.noc.vsphere.storage.ConfigurationException;
import com.aoindustries.noc.vsphere.storage.DataConsistencyException;
import com.aoindustries.noc.vsphere.storage.Status;
import com.aoindustries.noc.vsphere.storage.StatusAndMessage;
import com.aoindustries.noc.vsphere.storage.filter.PatternFilter;
import com.aoindustries.noc.vsphere.storage.inventory.ScsiLun;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * @author  AO Industries, Inc.
 */
public class LunClassifierTest extends TestCase {

  public LunClassifierTest(String testName) {
    super(testName);
  }

  public static Test suite() {
    return new TestSuite(LunClassifierTest.class);
  }

  public void testDegradedAnywhereIsWarning() {
    assertEquals(Status.WARNING, LunClassifier.getStatus(Arrays.asList("degraded")));
    assertEquals(Status.WARNING, LunClassifier.getStatus(Arrays.asList("ok", "degraded")));
    assertEquals(Status.WARNING, LunClassifier.getStatus(Arrays.asList("lostCommunication", "degraded")));
    assertEquals(Status.WARNING, LunClassifier.getStatus(Arrays.asList("error", "degraded", "off")));
  }

  public void testFirstOkIsOk() {
    assertEquals(Status.OK, LunClassifier.getStatus(Arrays.asList("ok")));
    assertEquals(Status.OK, LunClassifier.getStatus(Arrays.asList("ok", "quiesced")));
  }

  public void testOtherwiseCritical() {
    assertEquals(Status.CRITICAL, LunClassifier.getStatus(Arrays.asList("error")));
    assertEquals(Status.CRITICAL, LunClassifier.getStatus(Arrays.asList("off", "ok")));
    assertEquals(Status.CRITICAL, LunClassifier.getStatus(Arrays.asList("OK")));
    assertEquals(Status.CRITICAL, LunClassifier.getStatus(Collections.<String>emptyList()));
  }

  public void testSanitizeDisplayName() {
    assertEquals("Disk1", LunClassifier.sanitizeDisplayName("Disk#1!"));
    assertEquals(
        "Local ATA Disk (t10.ATA_____Samsung_SSD-850) [1]",
        LunClassifier.sanitizeDisplayName("Local ATA Disk (t10.ATA_____Samsung_SSD-850) [1]")
    );
    assertEquals("ab", LunClassifier.sanitizeDisplayName("a\t<b>"));
    assertEquals("Platte", LunClassifier.sanitizeDisplayName("Platte\"';"));
  }

  public void testSanitizedOkLun() throws DataConsistencyException {
    Classification classification = LunClassifier.classify(
        Collections.singletonList(lun("d1", "Disk#1!", "ok")),
        LunIndex.build(topology("d1", 3)),
        PatternFilter.ALLOW_ALL
    );
    assertEquals(1, classification.getResults().size());
    StatusAndMessage result = classification.getResults().get(0);
    assertEquals(Status.OK, result.getStatus());
    assertEquals("OK LUN:003 Disk1 state: ok", result.getMessage());
    assertEquals(1, classification.getTally().get("ok"));
  }

  public void testMessages() throws DataConsistencyException {
    Classification classification = LunClassifier.classify(
        Arrays.asList(
            lun("d1", "First", "ok"),
            lun("d2", "Second", "ok", "degraded"),
            lun("d3", "Third", "lostCommunication", "error")
        ),
        LunIndex.build(topology("d1", 0, "d2", 1, "d3", 12)),
        PatternFilter.ALLOW_ALL
    );
    List<StatusAndMessage> results = classification.getResults();
    assertEquals(new StatusAndMessage(Status.OK, "OK LUN:000 First state: ok"), results.get(0));
    assertEquals(new StatusAndMessage(Status.WARNING, "WARNING LUN:001 Second degraded: ok-degraded"), results.get(1));
    assertEquals(
        new StatusAndMessage(Status.CRITICAL, "CRITICAL LUN:012 Third state: lostCommunication-error"),
        results.get(2)
    );
    assertEquals("critical: 1; ok: 1; warning: 1", classification.getTally().toSummary());
  }

  public void testMissingTopologyEntryFails() {
    try {
      LunClassifier.classify(
          Arrays.asList(lun("d1", "First", "ok"), lun("missing", "Second", "ok")),
          LunIndex.build(topology("d1", 0)),
          PatternFilter.ALLOW_ALL
      );
      fail("DataConsistencyException expected");
    } catch (DataConsistencyException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("missing"));
    }
  }

  public void testIgnoredLunNeedsNoTopology() throws ConfigurationException, DataConsistencyException {
    PatternFilter filter = PatternFilter.compile(Collections.emptyList(), Arrays.asList("^Local"));
    Classification classification = LunClassifier.classify(
        Arrays.asList(lun("gone", "Local USB", "error"), lun("d1", "SAN volume", "ok")),
        LunIndex.build(topology("d1", 5)),
        filter
    );
    assertEquals(2, classification.getTotal());
    assertEquals(1, classification.getResults().size());
    assertEquals("ignored: 1; ok: 1", classification.getTally().toSummary());
  }

  public void testFilterUsesSanitizedName() throws ConfigurationException, DataConsistencyException {
    PatternFilter filter = PatternFilter.compile(Arrays.asList("^Disk1$"), Collections.emptyList());
    Classification classification = LunClassifier.classify(
        Arrays.asList(lun("d1", "Disk#1", "ok"), lun("d2", "Disk2", "ok")),
        LunIndex.build(topology("d1", 1, "d2", 2)),
        filter
    );
    assertEquals(1, classification.getResults().size());
    assertEquals("OK LUN:001 Disk1 state: ok", classification.getResults().get(0).getMessage());
  }

  public void testRepeatable() throws DataConsistencyException {
    List<ScsiLun> luns = Arrays.asList(
        lun("d1", "A", "ok"),
        lun("d2", "B", "degraded"),
        lun("d3", "C", "off")
    );
    LunIndex index = LunIndex.build(topology("d1", 1, "d2", 2, "d3", 3));
    Classification first = LunClassifier.classify(luns, index, PatternFilter.ALLOW_ALL);
    Classification second = LunClassifier.classify(luns, index, PatternFilter.ALLOW_ALL);
    assertEquals(first.getResults(), second.getResults());
    assertEquals(first.getTally().getCounts(), second.getTally().getCounts());
  }
}
