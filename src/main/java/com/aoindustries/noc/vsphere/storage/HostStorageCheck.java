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
package com.aoindustries.noc.vsphere.storage;

import static com.aoindustries.noc.vsphere.storage.Resources.PACKAGE_RESOURCES;

import com.aoindustries.noc.vsphere.storage.adapter.AdapterClassifier;
import com.aoindustries.noc.vsphere.storage.inventory.Host;
import com.aoindustries.noc.vsphere.storage.inventory.InventoryClient;
import com.aoindustries.noc.vsphere.storage.inventory.StorageDeviceInfo;
import com.aoindustries.noc.vsphere.storage.lun.LunClassifier;
import com.aoindustries.noc.vsphere.storage.lun.LunIndex;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks the storage adapters or LUNs of one host.
 *
 * <ol>
 *   <li>Resolves the host by name, UNKNOWN when not found.</li>
 *   <li>Reports the maintenance status without fetching storage when the host is in maintenance mode.</li>
 *   <li>Fetches the storage device info once and classifies it for the selected mode.</li>
 * </ol>
 *
 * @author  AO Industries, Inc.
 */
public final class HostStorageCheck {

  private static final Logger logger = Logger.getLogger(HostStorageCheck.class.getName());

  private final InventoryClient client;

  public HostStorageCheck(InventoryClient client) {
    this.client = client;
  }

  /**
   * Runs the check.
   *
   * @throws  IOException  when the inventory cannot be read
   * @throws  DataConsistencyException  when a LUN is missing from the SCSI topology
   */
  public CheckResult check(CheckArguments arguments) throws IOException, DataConsistencyException {
    String hostName = arguments.getHostName();
    Optional<Host> found = client.findHost(hostName);
    if (!found.isPresent()) {
      return new CheckResult(
          Status.UNKNOWN,
          PACKAGE_RESOURCES.getMessage(Locale.ROOT, "HostStorageCheck.check.hostNotFound", hostName)
      );
    }
    Host host = found.get();
    if (host.isInMaintenanceMode()) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Host " + hostName + " is in maintenance, skipping storage");
      }
      return new CheckResult(
          arguments.getMaintenanceStatus(),
          PACKAGE_RESOURCES.getMessage(Locale.ROOT, "HostStorageCheck.check.maintenance", hostName)
      );
    }
    StorageDeviceInfo storage = client.getStorageDeviceInfo(host);
    return classify(arguments, storage);
  }

  /**
   * Classifies a storage snapshot for the selected mode.
   *
   * @throws  DataConsistencyException  when a LUN is missing from the SCSI topology
   */
  public static CheckResult classify(CheckArguments arguments, StorageDeviceInfo storage) throws DataConsistencyException {
    Mode mode = arguments.getMode();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Checking " + mode + " of host " + arguments.getHostName());
    }
    switch (mode) {
      case ADAPTER:
        return Reporter.report(
            AdapterClassifier.classify(storage.getHostBusAdapters(), arguments.getFilter()),
            Reporter.ADAPTERS_LABEL
        );
      case LUN:
        return Reporter.report(
            LunClassifier.classify(
                storage.getScsiLuns(),
                LunIndex.build(storage.getScsiTopology()),
                arguments.getFilter()
            ),
            Reporter.LUNS_LABEL
        );
      default:
        throw new AssertionError("Unexpected mode: " + mode);
    }
  }
}
