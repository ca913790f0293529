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

import com.aoindustries.noc.vsphere.storage.DataConsistencyException;
import com.aoindustries.noc.vsphere.storage.inventory.ScsiTopology;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the disc key of each LUN to its three-digit slot label, from the SCSI topology.
 *
 * @author  AO Industries, Inc.
 */
public final class LunIndex {

  /**
   * Gets the disc key of a LUN key: the segment after the last <code>-</code>,
   * or the whole key when it has no <code>-</code>.
   */
  public static String getDiscKey(String key) {
    return key.substring(key.lastIndexOf('-') + 1);
  }

  /**
   * Formats a slot number as a zero-padded, three-digit label.
   */
  static String formatSlot(int lun) {
    return String.format(Locale.ROOT, "%03d", lun);
  }

  /**
   * Walks every adapter, target and LUN of the topology.  When two entries have
   * the same disc key, the last one wins.
   */
  public static LunIndex build(ScsiTopology topology) {
    Map<String, String> slots = new HashMap<>();
    for (ScsiTopology.Adapter adapter : topology.getAdapters()) {
      for (ScsiTopology.Target target : adapter.getTargets()) {
        for (ScsiTopology.Lun lun : target.getLuns()) {
          slots.put(getDiscKey(lun.getScsiLun()), formatSlot(lun.getLun()));
        }
      }
    }
    return new LunIndex(slots);
  }

  private final Map<String, String> slots;

  private LunIndex(Map<String, String> slots) {
    this.slots = Collections.unmodifiableMap(slots);
  }

  /**
   * Gets the slot label for a disc key.
   *
   * @throws  DataConsistencyException  when the topology has no LUN with this disc key
   */
  public String getSlot(String discKey) throws DataConsistencyException {
    String slot = slots.get(discKey);
    if (slot == null) {
      throw new DataConsistencyException(
          PACKAGE_RESOURCES.getMessage(Locale.ROOT, "LunIndex.getSlot.notFound", discKey)
      );
    }
    return slot;
  }

  /**
   * Gets all disc keys and their slot labels.
   */
  public Map<String, String> getSlots() {
    return slots;
  }
}
