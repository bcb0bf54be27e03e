/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

/**
 * A coarse country classification for normalized numbers.
 *
 * <p>Classification looks only at the calling code prefix of a number. It does not consult any
 * numbering plan data, so an {@link #INTL} number need not be valid in its country, and numbers for
 * other regions which share calling code 1 (e.g. Canada) are classified as {@link #US}.
 */
public enum CountryTag {
  /** Numbers with calling code 1. */
  US,
  /** Numbers with calling code 52. */
  MX,
  /** Any other normalized number. */
  INTL,
  /** Text which is not a normalized number at all. */
  UNKNOWN;

  /** Returns the country tag for the given number. */
  public static CountryTag classify(NormalizedNumber number) {
    String digits = number.getDigits();
    if (digits.startsWith("1")) {
      return US;
    }
    if (digits.startsWith("52")) {
      return MX;
    }
    return INTL;
  }

  /**
   * Returns the country tag for arbitrary E.164 text, or {@link #UNKNOWN} if the text is not a
   * valid normalized number (e.g. it is empty or has separators).
   */
  public static CountryTag classify(String e164) {
    try {
      return classify(NormalizedNumber.fromE164(e164));
    } catch (IllegalArgumentException notNormalized) {
      return UNKNOWN;
    }
  }
}
