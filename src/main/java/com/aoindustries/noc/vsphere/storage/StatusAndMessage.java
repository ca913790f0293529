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

import java.util.Objects;

/**
 * Stores two return values: the status of one checked item and its message.
 *
 * @author  AO Industries, Inc.
 */
public final class StatusAndMessage {

  private final Status status;
  private final String message;

  public StatusAndMessage(Status status, String message) {
    this.status = Objects.requireNonNull(status, "status");
    this.message = Objects.requireNonNull(message, "message");
  }

  public Status getStatus() {
    return status;
  }

  public String getMessage() {
    return message;
  }

  /**
   * Gets the detail line for this item, prefixed by its status.
   */
  public String getDetailLine() {
    return "[" + status + "] " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StatusAndMessage)) {
      return false;
    }
    StatusAndMessage other = (StatusAndMessage) obj;
    return status == other.status && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return status.hashCode() * 31 + message.hashCode();
  }

  @Override
  public String toString() {
    return getDetailLine();
  }
}
