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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counts the outcome of every item seen by a classifier.
 *
 * <p>Known outcome keys and the {@link #IGNORED} bucket start at zero.  Any other
 * key is added on its first increment.  Only non-zero counts are shown in the
 * summary.</p>
 *
 * @author  AO Industries, Inc.
 */
public final class Tally {

  /**
   * The key for items excluded by the allow and deny patterns.
   */
  public static final String IGNORED = "ignored";

  private final Map<String, Integer> counts;

  public Tally(String ... knownKeys) {
    counts = AoCollections.newHashMap(knownKeys.length + 1);
    for (String key : knownKeys) {
      counts.put(key, 0);
    }
    counts.put(IGNORED, 0);
  }

  /**
   * Adds one to the given key.
   */
  public void increment(String key) {
    counts.merge(key, 1, Integer::sum);
  }

  public void ignored() {
    increment(IGNORED);
  }

  /**
   * Gets the count for a key, zero when never seen.
   */
  public int get(String key) {
    Integer count = counts.get(key);
    return count == null ? 0 : count;
  }

  /**
   * Gets the non-zero counts, sorted by key.
   */
  public SortedMap<String, Integer> getCounts() {
    SortedMap<String, Integer> sorted = new TreeMap<>();
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() != 0) {
        sorted.put(entry.getKey(), entry.getValue());
      }
    }
    return Collections.unmodifiableSortedMap(sorted);
  }

  /**
   * Formats the non-zero counts as <code>key: count</code> entries joined by <code>"; "</code>.
   */
  public String toSummary() {
    List<String> entries = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : getCounts().entrySet()) {
      entries.add(entry.getKey() + ": " + entry.getValue());
    }
    return String.join("; ", entries);
  }

  @Override
  public String toString() {
    return getCounts().toString();
  }
}
