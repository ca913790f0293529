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

import com.aoapps.collections.AoCollections;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The ordered results and tally produced by classifying every item of one kind.
 *
 * @author  AO Industries, Inc.
 */
public final class Classification {

  private final int total;
  private final List<StatusAndMessage> results;
  private final Tally tally;

  /**
   * @param  total    the number of items in the snapshot, including ignored items
   * @param  results  the results in processing order
   */
  public Classification(int total, List<StatusAndMessage> results, Tally tally) {
    this.total = total;
    this.results = AoCollections.optimalUnmodifiableList(new ArrayList<>(results));
    this.tally = Objects.requireNonNull(tally, "tally");
  }

  public int getTotal() {
    return total;
  }

  public List<StatusAndMessage> getResults() {
    return results;
  }

  public Tally getTally() {
    return tally;
  }
}
