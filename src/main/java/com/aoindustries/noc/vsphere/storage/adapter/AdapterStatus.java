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
package com.aoindustries.noc.vsphere.storage.adapter;

import com.aoindustries.noc.vsphere.storage.Status;
import java.util.HashMap;
import java.util.Map;

/**
 * The status values a host bus adapter reports, with the status each maps to.
 * Any value not in this table is {@link #UNRECOGNIZED}.
 *
 * @author  AO Industries, Inc.
 */
public enum AdapterStatus {
  ONLINE("online", Status.OK),
  UNBOUND("unbound", Status.WARNING),
  UNKNOWN("unknown", Status.CRITICAL),
  OFFLINE("offline", Status.CRITICAL),
  UNRECOGNIZED(null, Status.UNKNOWN);

  private static final Map<String, AdapterStatus> byValue = new HashMap<>();

  static {
    for (AdapterStatus adapterStatus : values()) {
      if (adapterStatus.value != null) {
        byValue.put(adapterStatus.value, adapterStatus);
      }
    }
  }

  /**
   * Gets the adapter status for a raw value.  Matching is exact.
   */
  public static AdapterStatus of(String value) {
    AdapterStatus adapterStatus = byValue.get(value);
    return adapterStatus == null ? UNRECOGNIZED : adapterStatus;
  }

  /**
   * Gets the raw values known to this table, in declaration order.
   */
  static String[] getKnownValues() {
    AdapterStatus[] all = values();
    String[] known = new String[all.length - 1];
    int i = 0;
    for (AdapterStatus adapterStatus : all) {
      if (adapterStatus.value != null) {
        known[i++] = adapterStatus.value;
      }
    }
    return known;
  }

  private final String value;
  private final Status status;

  private AdapterStatus(String value, Status status) {
    this.value = value;
    this.status = status;
  }

  /**
   * Gets the raw value or <code>null</code> for {@link #UNRECOGNIZED}.
   */
  public String getValue() {
    return value;
  }

  public Status getStatus() {
    return status;
  }
}
