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
 * The adapter to target to LUN associations of a host.
 *
 * @author  AO Industries, Inc.
 */
public final class ScsiTopology {

  /**
   * A LUN reference within a target.
   */
  public static final class Lun {

    private final String scsiLun;
    private final int lun;

    public Lun(String scsiLun, int lun) {
      this.scsiLun = Objects.requireNonNull(scsiLun, "scsiLun");
      this.lun = lun;
    }

    /**
     * The key of the {@link ScsiLun} this entry refers to.
     */
    public String getScsiLun() {
      return scsiLun;
    }

    /**
     * The slot number of the LUN within its target.
     */
    public int getLun() {
      return lun;
    }
  }

  public static final class Target {

    private final List<Lun> luns;

    public Target(List<Lun> luns) {
      this.luns = AoCollections.optimalUnmodifiableList(new ArrayList<>(luns));
    }

    public List<Lun> getLuns() {
      return luns;
    }
  }

  public static final class Adapter {

    private final String adapter;
    private final List<Target> targets;

    public Adapter(String adapter, List<Target> targets) {
      this.adapter = adapter;
      this.targets = AoCollections.optimalUnmodifiableList(new ArrayList<>(targets));
    }

    /**
     * The key of the host bus adapter.
     */
    public String getAdapter() {
      return adapter;
    }

    public List<Target> getTargets() {
      return targets;
    }
  }

  private final List<Adapter> adapters;

  public ScsiTopology(List<Adapter> adapters) {
    this.adapters = AoCollections.optimalUnmodifiableList(new ArrayList<>(adapters));
  }

  public List<Adapter> getAdapters() {
    return adapters;
  }
}
