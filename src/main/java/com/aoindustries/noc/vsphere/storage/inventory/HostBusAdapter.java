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

import java.util.Objects;

/**
 * One host bus adapter from the storage device info.
 *
 * @author  AO Industries, Inc.
 */
public final class HostBusAdapter {

  private final String device;
  private final String model;
  private final String key;
  private final String status;

  public HostBusAdapter(String device, String model, String key, String status) {
    this.device = Objects.requireNonNull(device, "device");
    this.model = Objects.requireNonNull(model, "model");
    this.key = Objects.requireNonNull(key, "key");
    this.status = Objects.requireNonNull(status, "status");
  }

  /**
   * The device name, such as <code>vmhba0</code>.
   */
  public String getDevice() {
    return device;
  }

  public String getModel() {
    return model;
  }

  public String getKey() {
    return key;
  }

  /**
   * The raw status as reported by the host: <code>online</code>, <code>unbound</code>,
   * <code>unknown</code>, <code>offline</code> or anything else.
   */
  public String getStatus() {
    return status;
  }

  @Override
  public String toString() {
    return model + " " + device + " (" + status + ")";
  }
}
