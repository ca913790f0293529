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
 * A host system as resolved from the inventory root by name.
 *
 * <p>The storage system reference is opaque to the check; it is only passed back
 * to the {@link InventoryClient} that produced it.</p>
 *
 * @author  AO Industries, Inc.
 */
public final class Host {

  private final String name;
  private final boolean inMaintenanceMode;
  private final String storageSystem;

  public Host(String name, boolean inMaintenanceMode, String storageSystem) {
    this.name = Objects.requireNonNull(name, "name");
    this.inMaintenanceMode = inMaintenanceMode;
    this.storageSystem = storageSystem;
  }

  public String getName() {
    return name;
  }

  public boolean isInMaintenanceMode() {
    return inMaintenanceMode;
  }

  /**
   * Gets the reference to the storage system of this host or <code>null</code> when unknown.
   */
  public String getStorageSystem() {
    return storageSystem;
  }

  @Override
  public String toString() {
    return name;
  }
}
