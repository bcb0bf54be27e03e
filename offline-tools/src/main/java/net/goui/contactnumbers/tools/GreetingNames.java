/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers.tools;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import java.util.regex.Pattern;

/** Derives a friendly first name, used to greet a contact, from a display name. */
final class GreetingNames {
  // Names which are really phone numbers, e.g. "214-477-7343".
  private static final Pattern PHONE_LIKE = Pattern.compile("[+()\\-.\\s0-9]+");
  private static final Pattern HONORIFIC =
      Pattern.compile(
          "^(?:mr|mrs|ms|dr|ing\\.|sr|sra|srta|ing|lic)\\.?[\\s,]+", Pattern.CASE_INSENSITIVE);
  private static final CharMatcher LETTER =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.anyOf("ÁÉÍÓÚÑáéíóúÜü"));
  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /** Returns the first name in the given display name, or the empty string if there is none. */
  static String firstName(String displayName) {
    String name = displayName.trim();
    if (name.isEmpty() || PHONE_LIKE.matcher(name).matches()) {
      return "";
    }
    name = HONORIFIC.matcher(name).replaceFirst("");
    int comma = name.indexOf(',');
    if (comma != -1) {
      name = name.substring(0, comma);
    }
    String first = Iterables.getFirst(WHITESPACE.split(name), "");
    return LETTER.negate().trimFrom(first);
  }

  /** Returns the first name in the given display name, or the fallback if there is none. */
  static String greetingName(String displayName, String fallback) {
    String first = firstName(displayName);
    return !first.isEmpty() ? first : fallback;
  }

  private GreetingNames() {}
}
