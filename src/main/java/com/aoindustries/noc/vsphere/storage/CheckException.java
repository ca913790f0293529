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

/**
 * A structural failure that aborts a check before any result is reported.
 *
 * @author  AO Industries, Inc.
 */
public abstract class CheckException extends Exception {

  private static final long serialVersionUID = 1L;

  protected CheckException(String message) {
    super(message);
  }

  protected CheckException(String message, Throwable cause) {
    super(message, cause);
  }
}
