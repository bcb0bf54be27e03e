/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Cleans batches of contact records: selects the best number for each record and removes rows
 * whose number was already seen earlier in the batch.
 *
 * <pre>{@code
 * ContactCleaner cleaner = ContactCleaner.create(RecoveryConfig.defaults());
 * CleaningResult result =
 *     cleaner.clean(ImmutableList.of(
 *         ContactRecord.builder("Ana").addField("(214) 555-1212", "Home").build()));
 * // result.rows() holds one row for +12145551212 (US).
 * }</pre>
 *
 * <p>Cleaning never fails because of bad data: records without a usable number are reported in
 * {@link CleaningResult#unresolved()} and are otherwise ignored.
 */
public final class ContactCleaner {
  private final RecoveryConfig config;
  private final RecordSelector selector;

  public static ContactCleaner create(RecoveryConfig config) {
    return new ContactCleaner(config);
  }

  private ContactCleaner(RecoveryConfig config) {
    this.config = checkNotNull(config);
    this.selector = RecordSelector.create(config);
  }

  public RecoveryConfig getConfig() {
    return config;
  }

  public RecordSelector getSelector() {
    return selector;
  }

  /** Cleans the given records, which are visited exactly once and in order. */
  public CleaningResult clean(Iterable<ContactRecord> records) {
    Deduplicator deduplicator = new Deduplicator();
    ImmutableList.Builder<OutputRow> rows = ImmutableList.builder();
    ImmutableList.Builder<ContactRecord> unresolved = ImmutableList.builder();
    int duplicates = 0;
    for (ContactRecord record : records) {
      Optional<BestNumber> best = selector.select(record);
      if (best.isEmpty()) {
        unresolved.add(record);
        continue;
      }
      OutputRow row = OutputRow.forRecord(record, best.get());
      if (deduplicator.add(row)) {
        rows.add(row);
      } else {
        duplicates++;
      }
    }
    return CleaningResult.of(rows.build(), unresolved.build(), duplicates);
  }
}
