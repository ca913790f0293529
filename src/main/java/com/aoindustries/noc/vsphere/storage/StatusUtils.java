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

import com.aoapps.lang.EnumUtils;

/**
 * Finds the worst status of a run.
 *
 * @author  AO Industries, Inc.
 */
public final class StatusUtils {

  /** Make no instances. */
  private StatusUtils() {
    throw new AssertionError();
  }

  /**
   * Gets the greatest status found in a collection of results and the
   * given starting value.
   */
  public static Status getMaxStatus(Status status, Iterable<? extends StatusAndMessage> results) {
    for (StatusAndMessage result : results) {
      status = EnumUtils.max(status, result.getStatus());
    }
    return status;
  }

  /**
   * Gets the greatest status found in a collection of results.
   * If there are no results, the status is OK.
   */
  public static Status getMaxStatus(Iterable<? extends StatusAndMessage> results) {
    return getMaxStatus(Status.OK, results);
  }
}
