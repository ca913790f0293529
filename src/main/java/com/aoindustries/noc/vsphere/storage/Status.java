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

import java.util.Locale;

/**
 * The status vocabulary of the monitoring framework.
 *
 * <p>Constants are declared in increasing precedence, so the natural order of the
 * enum is the order used to find the worst status of a run.  CRITICAL outranks
 * UNKNOWN when both are seen.</p>
 *
 * @author  AO Industries, Inc.
 */
public enum Status {
  OK(0),
  WARNING(1),
  UNKNOWN(3),
  CRITICAL(2);

  private final int exitCode;

  private Status(int exitCode) {
    this.exitCode = exitCode;
  }

  /**
   * Gets the process exit code the monitoring framework expects for this status.
   */
  public int getExitCode() {
    return exitCode;
  }

  /**
   * Gets the lower-case name used as a tally key.
   */
  public String getTallyKey() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a status by name, ignoring case.
   *
   * @throws  ConfigurationException when the name is not a status
   */
  public static Status parse(String name) throws ConfigurationException {
    if (name != null) {
      for (Status status : values()) {
        if (status.name().equalsIgnoreCase(name.trim())) {
          return status;
        }
      }
    }
    throw new ConfigurationException(
        Resources.PACKAGE_RESOURCES.getMessage(Locale.ROOT, "Status.parse.invalid", String.valueOf(name))
    );
  }
}
