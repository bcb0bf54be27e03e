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
import com.google.common.base.Splitter;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.goui.contactnumbers.CleaningResult;
import net.goui.contactnumbers.ContactCleaner;
import net.goui.contactnumbers.ContactRecord;
import net.goui.contactnumbers.OutputRow;
import net.goui.contactnumbers.RecoveryConfig;

/**
 * Cleans a contact file (a Google Contacts export or a single phone column file) into a list with
 * one row per distinct phone number, with the columns {@link OutputRow#COLUMNS}.
 *
 * <pre>{@code
 * CleanContacts --in contacts.csv --out contacts_clean.csv --mx_mobile_one
 * }</pre>
 */
public final class CleanContacts {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final class Flags {
    @Parameter(names = "--in", description = "Input contact file (CSV or TSV)", required = true)
    String inPath = "";

    @Parameter(names = "--out", description = "Output CSV file", required = true)
    String outPath = "";

    @Parameter(
        names = "--default_country_code",
        description = "Calling code (with '+') assumed for 10 digit numbers")
    String defaultCountryCode = "+1";

    @Parameter(
        names = "--mx_mobile_one",
        description = "Insert the legacy mobile '1' after +52 for 10 digit Mexican numbers")
    boolean mexicoMobileOne = false;

    @Parameter(
        names = "--mobile_labels",
        description = "Comma separated keywords marking mobile phone labels (optional)")
    String mobileLabels = "";

    @Parameter(names = "--channel", description = "Channel for rows without one")
    String channel = "WhatsApp";

    @Parameter(names = "--opt_in", description = "OptIn value for rows without one")
    String optIn = "";

    @Parameter(names = "--log_level", description = "JDK log level name")
    String logLevel = "INFO";

    RecoveryConfig toConfig() {
      RecoveryConfig.Builder config =
          RecoveryConfig.builder()
              .setDefaultCountryCode(defaultCountryCode)
              .setMexicoMobileDisambiguatorEnabled(mexicoMobileOne);
      if (!mobileLabels.isEmpty()) {
        config.setMobileLabelKeywords(
            Splitter.on(',').trimResults().omitEmptyStrings().split(mobileLabels));
      }
      return config.build();
    }
  }

  static void setLogging(String levelName) {
    Level level = Level.parse(levelName);
    Arrays.stream(Logger.getLogger("").getHandlers()).forEach(h -> h.setLevel(level));
    Logger.getLogger("net.goui.contactnumbers").setLevel(level);
  }

  public static void main(String[] args) throws IOException {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    setLogging(flags.logLevel);
    run(flags);
  }

  static CleaningResult run(Flags flags) throws IOException {
    return clean(
        Paths.get(flags.inPath),
        Paths.get(flags.outPath),
        ContactCleaner.create(flags.toConfig()),
        flags.channel,
        flags.optIn);
  }

  /** Cleans the contacts in one file, writing the result to another. */
  static CleaningResult clean(
      Path inPath, Path outPath, ContactCleaner cleaner, String channel, String optIn)
      throws IOException {
    ContactTable table = ContactTable.read(inPath);
    ContactSchema schema = ContactSchema.detect(table.header());
    logger.atInfo().log("Reading %d contacts from %s (%s)", table.rows().size(), inPath, schema);

    List<ContactRecord> records =
        table.rows().stream()
            .map(row -> schema.toRecord(table.header(), row, channel, optIn))
            .collect(toImmutableList());
    CleaningResult result = cleaner.clean(records);
    for (ContactRecord unresolved : result.unresolved()) {
      logger.atFine().log("No usable number for '%s': %s", unresolved.name(), unresolved.fields());
    }

    ContactTable.write(
        outPath,
        OutputRow.COLUMNS,
        result.rows().stream().map(OutputRow::toMap).collect(toImmutableList()));
    logger.atInfo().log(
        "Wrote %d rows to %s (unresolved: %d, duplicates: %d)",
        result.rows().size(),
        outPath,
        result.unresolved().size(),
        result.duplicateCount());
    return result;
  }

  private CleanContacts() {}
}
