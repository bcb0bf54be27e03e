/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;

/**
 * Removes rows with repeated phone numbers from a batch, keeping the first row for each number.
 *
 * <p>Later rows for a number are dropped entirely (their names, channels etc. are not merged into
 * the kept row). Numbers are compared by their exact E.164 string, so {@code +5215512345678} and
 * {@code +525512345678} are different numbers.
 *
 * <p>A deduplicator holds the numbers seen during one batch and is not thread safe.
 */
public final class Deduplicator {
  private final Set<NormalizedNumber> seen = new HashSet<>();

  /**
   * Records the given row's number, returning whether this is the first row seen with it (i.e.
   * whether the row should be kept).
   */
  @CanIgnoreReturnValue
  public boolean add(OutputRow row) {
    return seen.add(row.phoneE164());
  }

  /** Returns the rows, in order, whose numbers have not been seen before. */
  public ImmutableList<OutputRow> deduplicate(Iterable<OutputRow> rows) {
    ImmutableList.Builder<OutputRow> kept = ImmutableList.builder();
    for (OutputRow row : rows) {
      if (add(row)) {
        kept.add(row);
      }
    }
    return kept.build();
  }

  public boolean contains(NormalizedNumber number) {
    return seen.contains(number);
  }

  /** Returns the number of distinct numbers seen. */
  public int size() {
    return seen.size();
  }

  /** Forgets all numbers seen so far, ready for a new batch. */
  public void clear() {
    seen.clear();
  }
}
