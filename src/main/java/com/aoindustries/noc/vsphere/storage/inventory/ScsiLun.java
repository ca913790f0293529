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
package com.aoindustries.noc.vsphere.storage.inventory;

import com.aoapps.collections.AoCollections;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One SCSI logical unit from the storage device info.
 *
 * @author  AO Industries, Inc.
 */
public final class ScsiLun {

  private final String canonicalName;
  private final String uuid;
  private final String key;
  private final String displayName;
  private final List<String> operationalState;

  public ScsiLun(String canonicalName, String uuid, String key, String displayName, List<String> operationalState) {
    this.canonicalName = canonicalName;
    this.uuid = uuid;
    this.key = Objects.requireNonNull(key, "key");
    this.displayName = Objects.requireNonNull(displayName, "displayName");
    this.operationalState = AoCollections.optimalUnmodifiableList(new ArrayList<>(Objects.requireNonNull(operationalState, "operationalState")));
  }

  public String getCanonicalName() {
    return canonicalName;
  }

  public String getUuid() {
    return uuid;
  }

  /**
   * The composite key, whose segment after the last <code>-</code> is the disc key.
   */
  public String getKey() {
    return key;
  }

  /**
   * The display name exactly as reported, before any sanitizing.
   */
  public String getDisplayName() {
    return displayName;
  }

  /**
   * The lower-case operational state tokens, such as <code>[ok]</code> or <code>[degraded, ok]</code>.
   */
  public List<String> getOperationalState() {
    return operationalState;
  }

  @Override
  public String toString() {
    return key;
  }
}
