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

/**
 * Where and how to connect to the management endpoint.
 *
 * @author  AO Industries, Inc.
 */
public final class ConnectionSettings {

  public static final int DEFAULT_PORT = 443;

  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final boolean noSsl;

  public ConnectionSettings(String host, int port, String user, String password, boolean noSsl) {
    this.host = host;
    this.port = port;
    this.user = user;
    this.password = password;
    this.noSsl = noSsl;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  /**
   * Whether to skip certificate verification.
   */
  public boolean isNoSsl() {
    return noSsl;
  }

  @Override
  public String toString() {
    return (user == null ? "" : user + "@") + host + ":" + port;
  }
}
