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
import com.google.common.collect.ImmutableMap;

/** A cleaned contact, reduced to the columns consumed by downstream senders. */
@AutoValue
public abstract class OutputRow {
  /** Output column names, in order. */
  public static final ImmutableList<String> COLUMNS =
      ImmutableList.of("Name", "Phone_E164", "Country", "Channel", "OptIn");

  public static OutputRow of(String name, BestNumber best, String channel, String optIn) {
    return new AutoValue_OutputRow(name, best.number(), best.country(), channel, optIn);
  }

  /** Returns the output row for a record and the number selected for it. */
  static OutputRow forRecord(ContactRecord record, BestNumber best) {
    return of(record.name(), best, record.channel(), record.optIn());
  }

  public abstract String name();

  public abstract NormalizedNumber phoneE164();

  public abstract CountryTag country();

  public abstract String channel();

  public abstract String optIn();

  /** Returns this row keyed by {@link #COLUMNS}, in column order. */
  public final ImmutableMap<String, String> toMap() {
    return ImmutableMap.of(
        "Name", name(),
        "Phone_E164", phoneE164().toString(),
        "Country", country().name(),
        "Channel", channel(),
        "OptIn", optIn());
  }
}
