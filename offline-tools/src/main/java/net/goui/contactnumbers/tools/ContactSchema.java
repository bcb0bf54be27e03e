/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers.tools;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import net.goui.contactnumbers.ContactRecord;
import net.goui.contactnumbers.RawField;

/** The column layouts of contact files which can be cleaned. */
enum ContactSchema {
  /** A Google Contacts export, with up to six labelled phone columns. */
  GOOGLE_CONTACTS {
    private final ImmutableList<String> valueColumns = phoneColumns("Value");
    private final ImmutableList<String> labelColumns = phoneColumns("Label");

    @Override
    boolean matches(List<String> header) {
      return header.contains(valueColumns.get(0));
    }

    @Override
    ImmutableSet<String> fieldColumns(List<String> header) {
      return Stream.concat(valueColumns.stream(), labelColumns.stream())
          .filter(header::contains)
          .collect(ImmutableSet.toImmutableSet());
    }

    @Override
    void addFields(Map<String, String> row, ContactRecord.Builder record) {
      for (int i = 0; i < valueColumns.size(); i++) {
        String value = row.getOrDefault(valueColumns.get(i), "");
        if (!value.isBlank()) {
          record.addField(RawField.of(value, row.getOrDefault(labelColumns.get(i), "")));
        }
      }
    }

    @Override
    String nameOf(Map<String, String> row) {
      String fullName =
          SPACE_JOINER.join(
              Stream.of(columnValue(row, "First Name"), columnValue(row, "Last Name"))
                  .filter(s -> !s.isEmpty())
                  .iterator());
      return Stream.of(
              fullName,
              columnValue(row, "Nickname"),
              columnValue(row, "Organization Name"),
              columnValue(row, "E-mail 1 - Value"))
          .filter(s -> !s.isEmpty())
          .findFirst()
          .orElse(UNKNOWN_NAME);
    }
  },

  /**
   * A single phone column, as written by earlier cleaning runs or simple exports. Re-cleaning a
   * previously cleaned file repairs any numbers which were glued together.
   */
  SINGLE_COLUMN {
    private final ImmutableList<String> phoneColumns =
        ImmutableList.of("Phone_E164", "Phone", "Mobile", "Phone Number");

    @Override
    boolean matches(List<String> header) {
      return phoneColumns.stream().anyMatch(header::contains);
    }

    @Override
    ImmutableSet<String> fieldColumns(List<String> header) {
      return ImmutableSet.of(phoneColumn(header));
    }

    @Override
    void addFields(Map<String, String> row, ContactRecord.Builder record) {
      phoneColumns.stream()
          .filter(row::containsKey)
          .findFirst()
          .map(c -> RawField.of(row.get(c), c))
          .filter(RawField::hasValue)
          .ifPresent(record::addField);
    }

    @Override
    String nameOf(Map<String, String> row) {
      String name = columnValue(row, "Name");
      return !name.isEmpty() ? name : UNKNOWN_NAME;
    }

    private String phoneColumn(List<String> header) {
      return phoneColumns.stream().filter(header::contains).findFirst().orElseThrow();
    }
  };

  static final String UNKNOWN_NAME = "Unknown";
  static final String CHANNEL = "Channel";
  static final String OPT_IN = "OptIn";

  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  /**
   * Returns the schema for the given header.
   *
   * @throws IllegalArgumentException if no schema has a phone column in the header.
   */
  static ContactSchema detect(List<String> header) {
    return Stream.of(values())
        .filter(s -> s.matches(header))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "unrecognized contact file header (no phone column): " + header));
  }

  abstract boolean matches(List<String> header);

  /** Returns the header columns which hold phone values or labels. */
  abstract ImmutableSet<String> fieldColumns(List<String> header);

  abstract void addFields(Map<String, String> row, ContactRecord.Builder record);

  abstract String nameOf(Map<String, String> row);

  /**
   * Returns the record for a row of a file with the given header. Non-blank "Channel" and "OptIn"
   * values in the row take precedence over the given defaults, and values of all other non-phone
   * columns are kept as record metadata.
   */
  ContactRecord toRecord(
      List<String> header, Map<String, String> row, String defaultChannel, String defaultOptIn) {
    ContactRecord.Builder record = ContactRecord.builder(nameOf(row));
    addFields(row, record);
    record.setChannel(valueOrDefault(row, CHANNEL, defaultChannel));
    record.setOptIn(valueOrDefault(row, OPT_IN, defaultOptIn));
    ImmutableSet<String> fieldColumns = fieldColumns(header);
    row.forEach(
        (column, value) -> {
          if (!fieldColumns.contains(column) && !column.equals(CHANNEL) && !column.equals(OPT_IN)) {
            record.putMetadata(column, value);
          }
        });
    return record.build();
  }

  private static String columnValue(Map<String, String> row, String column) {
    return row.getOrDefault(column, "").trim();
  }

  private static String valueOrDefault(Map<String, String> row, String column, String fallback) {
    String value = columnValue(row, column);
    return !value.isEmpty() ? value : fallback;
  }

  private static ImmutableList<String> phoneColumns(String suffix) {
    return IntStream.rangeClosed(1, 6)
        .mapToObj(n -> "Phone " + n + " - " + suffix)
        .collect(toImmutableList());
  }
}
