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
 * A read-only snapshot of the storage devices of one host, fetched once per run.
 *
 * @author  AO Industries, Inc.
 */
public final class StorageDeviceInfo {

  private final List<HostBusAdapter> hostBusAdapters;
  private final List<ScsiLun> scsiLuns;
  private final ScsiTopology scsiTopology;

  public StorageDeviceInfo(List<HostBusAdapter> hostBusAdapters, List<ScsiLun> scsiLuns, ScsiTopology scsiTopology) {
    this.hostBusAdapters = AoCollections.optimalUnmodifiableList(new ArrayList<>(hostBusAdapters));
    this.scsiLuns = AoCollections.optimalUnmodifiableList(new ArrayList<>(scsiLuns));
    this.scsiTopology = Objects.requireNonNull(scsiTopology, "scsiTopology");
  }

  public List<HostBusAdapter> getHostBusAdapters() {
    return hostBusAdapters;
  }

  public List<ScsiLun> getScsiLuns() {
    return scsiLuns;
  }

  public ScsiTopology getScsiTopology() {
    return scsiTopology;
  }
}
