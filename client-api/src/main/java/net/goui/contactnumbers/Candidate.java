/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkArgument;
import static net.goui.contactnumbers.Digits.ASCII_DIGIT;

import com.google.auto.value.AutoValue;

/**
 * An unvalidated digit sequence suspected of being (part of) a phone number.
 *
 * <p>A candidate records whether it was written with an explicit international marker (a leading
 * '+' or an international dialing prefix such as "00"). When it was, the marker is not part of the
 * digits, and the digits are expected to start with a country calling code.
 */
@AutoValue
public abstract class Candidate {
  /** Returns a candidate for a sequence of national or otherwise unmarked digits. */
  public static Candidate of(String digits) {
    return create(digits, false);
  }

  /** Returns a candidate for digits which followed an explicit international marker. */
  public static Candidate international(String digits) {
    return create(digits, true);
  }

  private static Candidate create(String digits, boolean international) {
    checkArgument(!digits.isEmpty(), "candidate digits must not be empty");
    checkArgument(
        ASCII_DIGIT.matchesAllOf(digits), "candidates must contain only decimal digits: %s", digits);
    return new AutoValue_Candidate(digits, international);
  }

  /** The ASCII decimal digits of this candidate (never empty). */
  public abstract String digits();

  /** Whether the digits followed an explicit international marker in the source text. */
  public abstract boolean hasInternationalMarker();

  /** Returns the digits, prefixed with '+' if this candidate had an international marker. */
  @Override
  public final String toString() {
    return hasInternationalMarker() ? "+" + digits() : digits();
  }
}
