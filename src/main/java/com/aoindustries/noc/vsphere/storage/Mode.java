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

import java.util.Locale;

/**
 * Which part of the storage subsystem is checked.
 *
 * @author  AO Industries, Inc.
 */
public enum Mode {
  ADAPTER("adapter"),
  LUN("lun");

  /**
   * Parses a mode by its command-line value.
   *
   * @throws  ConfigurationException  when the value is not a mode
   */
  public static Mode parse(String value) throws ConfigurationException {
    for (Mode mode : values()) {
      if (mode.value.equals(value)) {
        return mode;
      }
    }
    throw new ConfigurationException(
        PACKAGE_RESOURCES.getMessage(Locale.ROOT, "Mode.parse.invalid", String.valueOf(value))
    );
  }

  private final String value;

  private Mode(String value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return value;
  }
}
