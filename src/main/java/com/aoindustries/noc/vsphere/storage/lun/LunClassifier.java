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

import static com.aoindustries.noc.vsphere.storage.Resources.PACKAGE_RESOURCES;

import com.aoindustries.noc.vsphere.storage.Classification;
import com.aoindustries.noc.vsphere.storage.DataConsistencyException;
import com.aoindustries.noc.vsphere.storage.Status;
import com.aoindustries.noc.vsphere.storage.StatusAndMessage;
import com.aoindustries.noc.vsphere.storage.Tally;
import com.aoindustries.noc.vsphere.storage.filter.PatternFilter;
import com.aoindustries.noc.vsphere.storage.inventory.ScsiLun;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Classifies the SCSI LUNs of a host by their operational state.
 *
 * <ul>
 *   <li><code>degraded</code> anywhere in the state: WARNING</li>
 *   <li>otherwise first token <code>ok</code>: OK</li>
 *   <li>anything else: CRITICAL</li>
 * </ul>
 *
 * @author  AO Industries, Inc.
 */
public final class LunClassifier {

  private static final Logger logger = Logger.getLogger(LunClassifier.class.getName());

  static final String DEGRADED = "degraded";
  static final String OK = "ok";

  /**
   * Everything but word characters, space, brackets, parentheses, underscore, hyphen and period.
   */
  private static final Pattern DISALLOWED_CHARACTERS = Pattern.compile("[^\\]\\[\\w _().-]", Pattern.UNICODE_CHARACTER_CLASS);

  /** Make no instances. */
  private LunClassifier() {
    throw new AssertionError();
  }

  /**
   * Removes all characters that are not safe to display.
   */
  public static String sanitizeDisplayName(String displayName) {
    return DISALLOWED_CHARACTERS.matcher(displayName).replaceAll("");
  }

  /**
   * Gets the status for an operational state.
   */
  public static Status getStatus(List<String> operationalState) {
    if (operationalState.contains(DEGRADED)) {
      return Status.WARNING;
    }
    if (!operationalState.isEmpty() && OK.equals(operationalState.get(0))) {
      return Status.OK;
    }
    return Status.CRITICAL;
  }

  /**
   * Classifies each LUN in order.  Ignored LUNs are only counted.  The tally is
   * keyed by the lower-case status of each LUN.
   *
   * @throws  DataConsistencyException  when a reported LUN has no slot in the index
   */
  public static Classification classify(List<ScsiLun> luns, LunIndex lunIndex, PatternFilter filter) throws DataConsistencyException {
    Tally tally = new Tally(Status.OK.getTallyKey(), Status.WARNING.getTallyKey(), Status.CRITICAL.getTallyKey());
    List<StatusAndMessage> results = new ArrayList<>(luns.size());
    for (ScsiLun lun : luns) {
      String displayName = sanitizeDisplayName(lun.getDisplayName());
      if (!filter.accepts(displayName)) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Ignoring LUN " + displayName);
        }
        tally.ignored();
        continue;
      }
      String slot = lunIndex.getSlot(LunIndex.getDiscKey(lun.getKey()));
      String state = String.join("-", lun.getOperationalState());
      Status status = getStatus(lun.getOperationalState());
      tally.increment(status.getTallyKey());
      results.add(
          new StatusAndMessage(
              status,
              PACKAGE_RESOURCES.getMessage(
                  Locale.ROOT,
                  status == Status.WARNING ? "LunClassifier.message.degraded" : "LunClassifier.message.state",
                  status.name(),
                  slot,
                  displayName,
                  state
              )
          )
      );
    }
    return new Classification(luns.size(), results, tally);
  }
}
