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

import java.io.IOException;
import java.util.Optional;

/**
 * Reads host and storage properties from a virtualization management endpoint.
 *
 * @author  AO Industries, Inc.
 */
public interface InventoryClient extends AutoCloseable {

  /**
   * Finds a host system by its exact name, starting at the inventory root.
   *
   * @return  the host or {@link Optional#empty()} when no host has this name
   */
  Optional<Host> findHost(String name) throws IOException;

  /**
   * Retrieves the storage device info of a host in a single call.
   */
  StorageDeviceInfo getStorageDeviceInfo(Host host) throws IOException;

  @Override
  void close() throws IOException;
}
