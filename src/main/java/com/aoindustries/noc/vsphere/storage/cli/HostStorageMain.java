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
package com.aoindustries.noc.vsphere.storage.cli;

import static com.aoindustries.noc.vsphere.storage.Resources.PACKAGE_RESOURCES;

import com.aoindustries.noc.vsphere.storage.CheckArguments;
import com.aoindustries.noc.vsphere.storage.CheckResult;
import com.aoindustries.noc.vsphere.storage.ConfigurationException;
import com.aoindustries.noc.vsphere.storage.DataConsistencyException;
import com.aoindustries.noc.vsphere.storage.HostStorageCheck;
import com.aoindustries.noc.vsphere.storage.Mode;
import com.aoindustries.noc.vsphere.storage.Status;
import com.aoindustries.noc.vsphere.storage.inventory.ConnectionSettings;
import com.aoindustries.noc.vsphere.storage.inventory.InventoryClient;
import com.aoindustries.noc.vsphere.storage.inventory.InventoryClientProvider;
import jargs.gnu.CmdLineParser;
import jargs.gnu.CmdLineParser.Option;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point.  Prints one status line followed by the detail and exits
 * with the code of the overall status.
 *
 * @author  AO Industries, Inc.
 */
public final class HostStorageMain {

  private static final Logger logger = Logger.getLogger(HostStorageMain.class.getName());

  /**
   * The prefix of the status line.
   */
  public static final String SHORT_NAME = "VSPHERE-STORAGE";

  /** Make no instances. */
  private HostStorageMain() {
    throw new AssertionError();
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, ServiceLoader.load(InventoryClientProvider.class)));
  }

  /**
   * Writes the status line and returns the exit code for a result.
   */
  static int exit(PrintStream out, CheckResult result) {
    out.println(SHORT_NAME + " " + result.getStatus() + " - " + result.getMessage());
    out.flush();
    return result.getStatus().getExitCode();
  }

  private static CheckResult unknown(String key, Object ... args) {
    return new CheckResult(Status.UNKNOWN, PACKAGE_RESOURCES.getMessage(Locale.ROOT, key, args));
  }

  private static List<String> getStrings(CmdLineParser parser, Option option) {
    List<String> values = new ArrayList<>();
    for (Object value : parser.getOptionValues(option)) {
      values.add((String) value);
    }
    return values;
  }

  /**
   * Closes the client.  A failure to close does not change the result of a check
   * that has already completed.
   */
  private static void close(InventoryClient client) {
    try {
      client.close();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to close inventory client", e);
    }
  }

  /**
   * Parses the arguments, runs the check with the first available inventory client
   * provider and writes the result.
   *
   * @return  the exit code
   */
  static int run(String[] args, PrintStream out, Iterable<InventoryClientProvider> providers) {
    CmdLineParser parser = new CmdLineParser();
    Option hostOption = parser.addStringOption('s', "host");
    Option portOption = parser.addIntegerOption('o', "port");
    Option userOption = parser.addStringOption('u', "user");
    Option passwordOption = parser.addStringOption('p', "password");
    Option noSslOption = parser.addBooleanOption("nossl");
    Option vihostOption = parser.addStringOption("vihost");
    Option modeOption = parser.addStringOption("mode");
    Option maintenanceStateOption = parser.addStringOption("maintenance-state");
    Option allowedOption = parser.addStringOption("allowed");
    Option bannedOption = parser.addStringOption("banned");
    Option helpOption = parser.addBooleanOption('h', "help");
    try {
      parser.parse(args);
    } catch (CmdLineParser.OptionException e) {
      return exit(out, unknown("HostStorageMain.run.usageError", e.getMessage(), PACKAGE_RESOURCES.getMessage(Locale.ROOT, "HostStorageMain.usage")));
    }
    if ((Boolean) parser.getOptionValue(helpOption, Boolean.FALSE)) {
      out.println(PACKAGE_RESOURCES.getMessage(Locale.ROOT, "HostStorageMain.usage"));
      return Status.OK.getExitCode();
    }

    CheckArguments arguments;
    try {
      String modeValue = (String) parser.getOptionValue(modeOption);
      String maintenanceState = (String) parser.getOptionValue(maintenanceStateOption);
      arguments = CheckArguments.builder()
          .hostName((String) parser.getOptionValue(vihostOption))
          .mode(modeValue == null ? null : Mode.parse(modeValue))
          .maintenanceStatus(maintenanceState == null ? Status.UNKNOWN : Status.parse(maintenanceState))
          .allow(getStrings(parser, allowedOption))
          .ban(getStrings(parser, bannedOption))
          .build();
    } catch (ConfigurationException e) {
      return exit(out, unknown("HostStorageMain.run.configurationError", e.getMessage()));
    }
    ConnectionSettings settings = new ConnectionSettings(
        (String) parser.getOptionValue(hostOption),
        (Integer) parser.getOptionValue(portOption, ConnectionSettings.DEFAULT_PORT),
        (String) parser.getOptionValue(userOption),
        (String) parser.getOptionValue(passwordOption),
        (Boolean) parser.getOptionValue(noSslOption, Boolean.FALSE)
    );

    Iterator<InventoryClientProvider> iter = providers.iterator();
    if (!iter.hasNext()) {
      return exit(out, unknown("HostStorageMain.run.noProvider"));
    }
    InventoryClientProvider provider = iter.next();
    CheckResult result;
    try {
      InventoryClient client = provider.connect(settings);
      try {
        result = new HostStorageCheck(client).check(arguments);
      } finally {
        close(client);
      }
    } catch (IOException e) {
      logger.log(Level.FINE, null, e);
      result = unknown("HostStorageMain.run.inventoryError", String.valueOf(e.getMessage()));
    } catch (DataConsistencyException e) {
      result = unknown("HostStorageMain.run.dataConsistencyError", e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, null, e);
      result = unknown("HostStorageMain.run.unexpectedError", e.toString());
    }
    return exit(out, result);
  }
}
