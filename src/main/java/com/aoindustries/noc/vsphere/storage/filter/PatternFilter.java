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
package com.aoindustries.noc.vsphere.storage.filter;

import static com.aoindustries.noc.vsphere.storage.Resources.PACKAGE_RESOURCES;

import com.aoapps.collections.AoCollections;
import com.aoindustries.noc.vsphere.storage.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Allow and deny patterns applied to the identifying strings of an item.
 *
 * <p>Patterns are searched for anywhere in a candidate, not matched against the whole
 * string.  A deny match always wins; with no allow patterns every remaining item is
 * allowed.</p>
 *
 * @author  AO Industries, Inc.
 */
public final class PatternFilter {

  /**
   * A filter that allows everything.
   */
  public static final PatternFilter ALLOW_ALL = new PatternFilter(Collections.emptyList(), Collections.emptyList());

  /**
   * Compiles the allow and deny patterns.
   *
   * @throws  ConfigurationException  when any pattern is not a valid regular expression
   */
  public static PatternFilter compile(Collection<String> allowed, Collection<String> banned) throws ConfigurationException {
    return new PatternFilter(compileAll(allowed), compileAll(banned));
  }

  private static List<Pattern> compileAll(Collection<String> regexes) throws ConfigurationException {
    if (regexes == null || regexes.isEmpty()) {
      return Collections.emptyList();
    }
    List<Pattern> patterns = new ArrayList<>(regexes.size());
    for (String regex : regexes) {
      try {
        patterns.add(Pattern.compile(regex));
      } catch (PatternSyntaxException e) {
        throw new ConfigurationException(
            PACKAGE_RESOURCES.getMessage(Locale.ROOT, "PatternFilter.compile.invalid", regex, e.getDescription()),
            e
        );
      }
    }
    return AoCollections.optimalUnmodifiableList(patterns);
  }

  private static boolean anyFind(List<Pattern> patterns, String candidate) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(candidate).find()) {
        return true;
      }
    }
    return false;
  }

  private final List<Pattern> allowed;
  private final List<Pattern> banned;

  private PatternFilter(List<Pattern> allowed, List<Pattern> banned) {
    this.allowed = allowed;
    this.banned = banned;
  }

  /**
   * Checks if a single candidate matches any deny pattern.
   */
  public boolean isBanned(String candidate) {
    return anyFind(banned, candidate);
  }

  /**
   * Checks if a single candidate passes the allow list.  Always true when no
   * allow patterns are configured.
   */
  public boolean isAllowed(String candidate) {
    return allowed.isEmpty() || anyFind(allowed, candidate);
  }

  /**
   * Decides whether an item identified by the given candidates is reported.
   * The item is excluded if any candidate is banned, or if no candidate passes the
   * allow list.
   */
  public boolean accepts(String ... candidates) {
    for (String candidate : candidates) {
      if (isBanned(candidate)) {
        return false;
      }
    }
    for (String candidate : candidates) {
      if (isAllowed(candidate)) {
        return true;
      }
    }
    return false;
  }

  public List<Pattern> getAllowed() {
    return allowed;
  }

  public List<Pattern> getBanned() {
    return banned;
  }
}
