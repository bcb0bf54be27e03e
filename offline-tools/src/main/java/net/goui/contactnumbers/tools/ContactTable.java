/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers.tools;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.opencsv.exceptions.CsvException;
import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A contact file loaded into memory: its header and its rows, each keyed by column name.
 *
 * <p>Files are read as UTF-8 (ignoring any byte order mark). The separator is taken from the header
 * line: a tab if it has one, otherwise a comma. Rows shorter than the header are padded with empty
 * values, and blank lines are skipped. Files are always written as UTF-8 CSV.
 */
@AutoValue
abstract class ContactTable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /** Column names in file order (duplicate names are kept only once). */
  abstract ImmutableList<String> header();

  abstract ImmutableList<ImmutableMap<String, String>> rows();

  static ContactTable read(Path path) throws IOException {
    String text = Files.readString(path, UTF_8);
    if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
      text = text.substring(1);
    }
    char separator = separatorFor(text);
    List<String[]> lines;
    try (CSVReader reader =
        new CSVReaderBuilder(new StringReader(text))
            .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
            .build()) {
      lines = reader.readAll();
    } catch (CsvException e) {
      throw new IOException("cannot parse contact file " + path + ": " + e.getMessage(), e);
    }
    checkArgument(!lines.isEmpty(), "contact file has no header: %s", path);

    ImmutableList<String> header =
        Arrays.stream(lines.get(0))
            .map(String::trim)
            .distinct()
            .collect(ImmutableList.toImmutableList());
    String[] columns = lines.get(0);
    ImmutableList.Builder<ImmutableMap<String, String>> rows = ImmutableList.builder();
    for (String[] line : lines.subList(1, lines.size())) {
      if (Arrays.stream(line).allMatch(String::isBlank)) {
        continue;
      }
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < columns.length; i++) {
        row.putIfAbsent(columns[i].trim(), i < line.length ? line[i] : "");
      }
      rows.add(ImmutableMap.copyOf(row));
    }
    ContactTable table = new AutoValue_ContactTable(header, rows.build());
    logger.atFine().log(
        "Read %d rows from %s (separator=%s)",
        table.rows().size(),
        path,
        separator == '\t' ? "tab" : "comma");
    return table;
  }

  /** Writes the given rows with the given column order (values for missing columns are empty). */
  static void write(Path path, List<String> columns, Iterable<? extends Map<String, String>> rows)
      throws IOException {
    try (Writer out = Files.newBufferedWriter(path, UTF_8);
        ICSVWriter csv =
            new CSVWriterBuilder(out).withLineEnd(CSVWriter.DEFAULT_LINE_END).build()) {
      csv.writeNext(columns.toArray(new String[0]), false);
      int count = 0;
      for (Map<String, String> row : rows) {
        String[] values = columns.stream().map(c -> row.getOrDefault(c, "")).toArray(String[]::new);
        csv.writeNext(values, false);
        count++;
      }
      logger.atFine().log("Wrote %d rows to %s", count, path);
    }
  }

  private static char separatorFor(String text) {
    int end = text.indexOf('\n');
    String headerLine = end != -1 ? text.substring(0, end) : text;
    return headerLine.indexOf('\t') != -1 ? '\t' : ',';
  }
}
