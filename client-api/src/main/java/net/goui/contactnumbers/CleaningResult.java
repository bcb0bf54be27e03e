/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The outcome of cleaning one batch of contact records. */
@AutoValue
public abstract class CleaningResult {
  static CleaningResult of(
      ImmutableList<OutputRow> rows, ImmutableList<ContactRecord> unresolved, int duplicateCount) {
    return new AutoValue_CleaningResult(rows, unresolved, duplicateCount);
  }

  /** Rows with distinct numbers, in input order. */
  public abstract ImmutableList<OutputRow> rows();

  /** Records for which no field held a usable number, in input order. */
  public abstract ImmutableList<ContactRecord> unresolved();

  /** The number of resolved records dropped because an earlier row had the same number. */
  public abstract int duplicateCount();
}
