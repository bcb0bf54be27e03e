/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers.tools;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import net.goui.contactnumbers.CountryTag;
import net.goui.contactnumbers.OutputRow;

/**
 * Splits a cleaned contact file into per-channel send lists.
 *
 * <p>Three files are written, each with the input columns plus "FirstName" and "GreetingName":
 *
 * <ul>
 *   <li>the master list, with every row;
 *   <li>the WhatsApp list, with rows whose channel is WhatsApp;
 *   <li>the SMS list, with US and Mexican rows (their channel set to SMS).
 * </ul>
 *
 * <p>Any cleaned-output column (see {@link OutputRow#COLUMNS}) missing from the input is added too,
 * before the greeting columns, so the channel set on SMS rows is always written. Rows with no value
 * for an added column get an empty one.
 *
 * <p>With {@code --all_channels}, every row goes into both channel lists.
 */
public final class SplitChannelLists {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String WHATSAPP = "WhatsApp";
  static final String SMS = "SMS";
  static final String FIRST_NAME = "FirstName";
  static final String GREETING_NAME = "GreetingName";

  static final class Flags {
    @Parameter(names = "--in", description = "Cleaned contact file", required = true)
    String inPath = "";

    @Parameter(names = "--master", description = "Output path for all rows", required = true)
    String masterPath = "";

    @Parameter(names = "--whatsapp", description = "Output path for WhatsApp rows", required = true)
    String whatsAppPath = "";

    @Parameter(names = "--sms", description = "Output path for SMS rows", required = true)
    String smsPath = "";

    @Parameter(
        names = "--fallback_greeting",
        description = "Greeting name for contacts without a usable first name")
    String fallbackGreeting = "amig@";

    @Parameter(
        names = "--all_channels",
        description = "Write every row to both channel lists, regardless of channel and country")
    boolean allChannels = false;

    @Parameter(names = "--log_level", description = "JDK log level name")
    String logLevel = "INFO";
  }

  public static void main(String[] args) throws IOException {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    CleanContacts.setLogging(flags.logLevel);
    split(flags);
  }

  static void split(Flags flags) throws IOException {
    ContactTable table = ContactTable.read(Paths.get(flags.inPath));
    ImmutableList<String> columns = outputColumns(table.header());
    ImmutableList<ImmutableMap<String, String>> master =
        table.rows().stream()
            .map(row -> withGreeting(row, flags.fallbackGreeting))
            .collect(toImmutableList());

    ImmutableList<ImmutableMap<String, String>> whatsApp;
    ImmutableList<ImmutableMap<String, String>> sms;
    if (flags.allChannels) {
      whatsApp = withChannel(master.stream(), WHATSAPP);
      sms = withChannel(master.stream(), SMS);
    } else {
      whatsApp = master.stream().filter(SplitChannelLists::isWhatsApp).collect(toImmutableList());
      sms = withChannel(master.stream().filter(SplitChannelLists::isSmsCountry), SMS);
    }

    write(Paths.get(flags.masterPath), columns, master, "master");
    write(Paths.get(flags.whatsAppPath), columns, whatsApp, WHATSAPP);
    write(Paths.get(flags.smsPath), columns, sms, SMS);
  }

  /** Returns the input columns, followed by any missing output and greeting columns. */
  static ImmutableList<String> outputColumns(ImmutableList<String> header) {
    return Stream.concat(
            header.stream(),
            Stream.concat(OutputRow.COLUMNS.stream(), Stream.of(FIRST_NAME, GREETING_NAME)))
        .distinct()
        .collect(toImmutableList());
  }

  private static ImmutableMap<String, String> withGreeting(
      Map<String, String> row, String fallback) {
    String name = row.getOrDefault("Name", "");
    Map<String, String> out = new LinkedHashMap<>(row);
    out.put(FIRST_NAME, GreetingNames.firstName(name));
    out.put(GREETING_NAME, GreetingNames.greetingName(name, fallback));
    return ImmutableMap.copyOf(out);
  }

  private static ImmutableList<ImmutableMap<String, String>> withChannel(
      Stream<ImmutableMap<String, String>> rows, String channel) {
    return rows.map(
            r -> {
              Map<String, String> out = new LinkedHashMap<>(r);
              out.put(ContactSchema.CHANNEL, channel);
              return ImmutableMap.copyOf(out);
            })
        .collect(toImmutableList());
  }

  private static boolean isWhatsApp(Map<String, String> row) {
    return WHATSAPP.equalsIgnoreCase(row.getOrDefault(ContactSchema.CHANNEL, "").trim());
  }

  private static boolean isSmsCountry(Map<String, String> row) {
    String country = row.getOrDefault("Country", "").trim();
    return country.equalsIgnoreCase(CountryTag.US.name())
        || country.equalsIgnoreCase(CountryTag.MX.name());
  }

  private static void write(
      Path path,
      ImmutableList<String> columns,
      ImmutableList<ImmutableMap<String, String>> rows,
      String list)
      throws IOException {
    ContactTable.write(path, columns, rows);
    logger.atInfo().log("%s: %d rows -> %s", list, rows.size(), path);
  }

  private SplitChannelLists() {}
}
