/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The free text value of one phone column in a contact record, with its (possibly empty) label
 * (e.g. "Mobile" or "Home"). Absent values and labels are held as empty strings.
 */
@AutoValue
public abstract class RawField {
  public static RawField of(@Nullable String value) {
    return of(value, "");
  }

  public static RawField of(@Nullable String value, @Nullable String label) {
    return new AutoValue_RawField(Strings.nullToEmpty(value), Strings.nullToEmpty(label));
  }

  public abstract String value();

  public abstract String label();

  /** Whether the value holds anything other than whitespace. */
  public final boolean hasValue() {
    return !value().isBlank();
  }
}
