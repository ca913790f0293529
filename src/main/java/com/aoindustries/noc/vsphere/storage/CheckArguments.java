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

import com.aoindustries.noc.vsphere.storage.filter.PatternFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The configuration of one check run.  Built once and passed to every step of the check.
 *
 * @author  AO Industries, Inc.
 */
public final class CheckArguments {

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String hostName;
    private Mode mode;
    private Status maintenanceStatus = Status.UNKNOWN;
    private final List<String> allowed = new ArrayList<>();
    private final List<String> banned = new ArrayList<>();

    private Builder() {
      // Use CheckArguments.builder()
    }

    public Builder hostName(String hostName) {
      this.hostName = hostName;
      return this;
    }

    public Builder mode(Mode mode) {
      this.mode = mode;
      return this;
    }

    /**
     * The status to report when the host is in maintenance mode, {@link Status#UNKNOWN} by default.
     */
    public Builder maintenanceStatus(Status maintenanceStatus) {
      this.maintenanceStatus = maintenanceStatus;
      return this;
    }

    public Builder allow(String regex) {
      allowed.add(regex);
      return this;
    }

    public Builder allow(Iterable<String> regexes) {
      regexes.forEach(allowed::add);
      return this;
    }

    public Builder ban(String regex) {
      banned.add(regex);
      return this;
    }

    public Builder ban(Iterable<String> regexes) {
      regexes.forEach(banned::add);
      return this;
    }

    /**
     * Validates the settings and compiles the patterns.
     *
     * @throws  ConfigurationException  when a required value is missing or a pattern is invalid
     */
    public CheckArguments build() throws ConfigurationException {
      if (hostName == null || hostName.isEmpty()) {
        throw new ConfigurationException(PACKAGE_RESOURCES.getMessage(Locale.ROOT, "CheckArguments.build.required", "vihost"));
      }
      if (mode == null) {
        throw new ConfigurationException(PACKAGE_RESOURCES.getMessage(Locale.ROOT, "CheckArguments.build.required", "mode"));
      }
      if (maintenanceStatus == null) {
        throw new ConfigurationException(PACKAGE_RESOURCES.getMessage(Locale.ROOT, "CheckArguments.build.required", "maintenance-state"));
      }
      return new CheckArguments(hostName, mode, maintenanceStatus, PatternFilter.compile(allowed, banned));
    }
  }

  private final String hostName;
  private final Mode mode;
  private final Status maintenanceStatus;
  private final PatternFilter filter;

  private CheckArguments(String hostName, Mode mode, Status maintenanceStatus, PatternFilter filter) {
    this.hostName = hostName;
    this.mode = mode;
    this.maintenanceStatus = maintenanceStatus;
    this.filter = filter;
  }

  public String getHostName() {
    return hostName;
  }

  public Mode getMode() {
    return mode;
  }

  public Status getMaintenanceStatus() {
    return maintenanceStatus;
  }

  public PatternFilter getFilter() {
    return filter;
  }
}
