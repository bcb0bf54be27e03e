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
import static net.goui.contactnumbers.Digits.MAX_E164_DIGITS;
import static net.goui.contactnumbers.Digits.MIN_NUMBER_DIGITS;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;

/**
 * A phone number in canonical E.164 form: a leading {@code '+'} followed by 8 to 15 ASCII digits,
 * with no separators.
 *
 * <p>Instances are only ever created for strings which satisfy this invariant, so two numbers are
 * equal exactly when their E.164 strings are equal. No attempt is made to check that the number is
 * assigned in any numbering plan.
 */
@AutoValue
public abstract class NormalizedNumber implements Comparable<NormalizedNumber> {

  /**
   * Returns a normalized number from the given E.164 string. This method is the exact inverse of
   * {@link #toString()}.
   *
   * @throws IllegalArgumentException if the given string is not a leading '+' followed by 8 to 15
   *     decimal digits.
   */
  public static NormalizedNumber fromE164(String e164) {
    checkArgument(e164.startsWith("+"), "E.164 numbers must start with '+': %s", e164);
    return ofDigits(e164.substring(1));
  }

  /** Returns a normalized number from the digits which follow the leading '+'. */
  static NormalizedNumber ofDigits(String digits) {
    checkArgument(
        digits.length() >= MIN_NUMBER_DIGITS && digits.length() <= MAX_E164_DIGITS,
        "E.164 numbers must have between %s and %s digits: %s",
        MIN_NUMBER_DIGITS,
        MAX_E164_DIGITS,
        digits);
    checkArgument(
        ASCII_DIGIT.matchesAllOf(digits), "E.164 numbers must contain only decimal digits: %s", digits);
    return new AutoValue_NormalizedNumber(digits);
  }

  /** Returns the digits of this number, without the leading '+'. */
  public abstract String getDigits();

  /** Returns the number of digits in this number (not counting the leading '+'). */
  public final int length() {
    return getDigits().length();
  }

  /** Returns the coarse country tag of this number, derived only from its leading digits. */
  public final CountryTag getCountryTag() {
    return CountryTag.classify(this);
  }

  @Override
  public int compareTo(NormalizedNumber other) {
    return getDigits().compareTo(other.getDigits());
  }

  /** Returns the canonical E.164 representation of this number, with a leading {@code '+'}. */
  @Memoized
  @Override
  public String toString() {
    return "+" + getDigits();
  }
}
