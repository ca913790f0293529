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

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the overall result from a classification: the worst status, a summary line of
 * counts and one detail line per reported item.
 *
 * @author  AO Industries, Inc.
 */
public final class Reporter {

  /**
   * The summary label in adapter mode.
   */
  public static final String ADAPTERS_LABEL = "Adapters";

  /**
   * The summary label in LUN mode.
   */
  public static final String LUNS_LABEL = "LUNs:";

  /** Make no instances. */
  private Reporter() {
    throw new AssertionError();
  }

  /**
   * Gets the summary line: <code>&lt;label&gt; &lt;total&gt;; </code> followed by the
   * non-zero tally counts sorted by key.
   */
  public static String getSummary(Classification classification, String label) {
    return label + " " + classification.getTotal() + "; " + classification.getTally().toSummary();
  }

  /**
   * Gets the detail lines in processing order, joined by newlines.
   */
  public static String getDetail(Classification classification) {
    List<String> lines = new ArrayList<>(classification.getResults().size());
    for (StatusAndMessage result : classification.getResults()) {
      lines.add(result.getDetailLine());
    }
    return String.join("\n", lines);
  }

  /**
   * Reports a classification.  With no reported items the status is OK and the detail
   * is empty.
   */
  public static CheckResult report(Classification classification, String label) {
    return new CheckResult(
        StatusUtils.getMaxStatus(classification.getResults()),
        getSummary(classification, label) + "\n" + getDetail(classification)
    );
  }
}
