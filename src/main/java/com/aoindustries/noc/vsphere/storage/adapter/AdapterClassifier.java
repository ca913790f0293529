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
package com.aoindustries.noc.vsphere.storage.adapter;

import static com.aoindustries.noc.vsphere.storage.Resources.PACKAGE_RESOURCES;

import com.aoindustries.noc.vsphere.storage.Classification;
import com.aoindustries.noc.vsphere.storage.StatusAndMessage;
import com.aoindustries.noc.vsphere.storage.Tally;
import com.aoindustries.noc.vsphere.storage.filter.PatternFilter;
import com.aoindustries.noc.vsphere.storage.inventory.HostBusAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies the host bus adapters of a host by their reported status.
 *
 * @author  AO Industries, Inc.
 */
public final class AdapterClassifier {

  private static final Logger logger = Logger.getLogger(AdapterClassifier.class.getName());

  /** Make no instances. */
  private AdapterClassifier() {
    throw new AssertionError();
  }

  /**
   * Gets the filter candidates of an adapter: <code>device:</code>, <code>model:</code>
   * and <code>key:</code> followed by the matching property.
   */
  static String[] getCandidates(HostBusAdapter adapter) {
    return new String[] {
        "device:" + adapter.getDevice(),
        "model:" + adapter.getModel(),
        "key:" + adapter.getKey()
    };
  }

  /**
   * Classifies each adapter in order.  Ignored adapters are only counted.  The tally
   * is keyed by the raw status of each adapter.
   */
  public static Classification classify(List<HostBusAdapter> adapters, PatternFilter filter) {
    Tally tally = new Tally(AdapterStatus.getKnownValues());
    List<StatusAndMessage> results = new ArrayList<>(adapters.size());
    for (HostBusAdapter adapter : adapters) {
      if (!filter.accepts(getCandidates(adapter))) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Ignoring adapter " + adapter.getDevice());
        }
        tally.ignored();
        continue;
      }
      String rawStatus = adapter.getStatus();
      AdapterStatus adapterStatus = AdapterStatus.of(rawStatus);
      tally.increment(rawStatus);
      results.add(
          new StatusAndMessage(
              adapterStatus.getStatus(),
              PACKAGE_RESOURCES.getMessage(
                  Locale.ROOT,
                  "AdapterClassifier.message",
                  adapter.getModel(),
                  adapter.getDevice(),
                  rawStatus
              )
          )
      );
    }
    return new Classification(adapters.size(), results, tally);
  }
}
