/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.common.base.CharMatcher;

/** Digit handling shared by the extraction and normalization stages. */
final class Digits {
  static final CharMatcher ASCII_DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher WIDE_DIGIT = CharMatcher.inRange('０', '９');
  private static final CharMatcher ANY_DIGIT = ASCII_DIGIT.or(WIDE_DIGIT);

  /** The longest digit sequence allowed after the leading '+' of an E.164 number. */
  static final int MAX_E164_DIGITS = 15;

  /** The shortest digit sequence accepted as a plausible phone number. */
  static final int MIN_NUMBER_DIGITS = 8;

  /**
   * Returns the given text with any full-width digits replaced by their ASCII equivalent. All other
   * characters are unchanged, so character offsets are preserved.
   */
  static String normalizeToAscii(String s) {
    if (!WIDE_DIGIT.matchesAnyOf(s)) {
      return s;
    }
    StringBuilder b = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      b.append(WIDE_DIGIT.matches(c) ? (char) ('0' + (c - '０')) : c);
    }
    return b.toString();
  }

  /** Returns only the (ASCII normalized) decimal digits in the given text. */
  static String digitsOf(CharSequence s) {
    return normalizeToAscii(ANY_DIGIT.retainFrom(s));
  }

  /** Returns the leading {@link #MAX_E164_DIGITS} digits of the given sequence. */
  static String truncateToE164(String digits) {
    return digits.length() > MAX_E164_DIGITS ? digits.substring(0, MAX_E164_DIGITS) : digits;
  }

  private Digits() {}
}
