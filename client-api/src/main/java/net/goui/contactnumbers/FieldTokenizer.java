/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Splits a raw phone field into pieces which are each more likely to hold a single number.
 *
 * <p>Fields are split after common separators (comma, pipe, slash, semicolon, colon, tab, the
 * {@code ":::"} marker and runs of two or more whitespace characters). A field with more than one
 * '+' is also split before every '+', which separates international numbers written back to back
 * (e.g. {@code "+5215512345678+12145551212"}).
 *
 * <p>No characters are ever discarded: separators remain at the end of the piece they follow, so
 * joining the returned pieces always reproduces the original field.
 */
public final class FieldTokenizer {
  private static final Pattern SEPARATOR = Pattern.compile(":::|[,|/;:\\t]|\\s{2,}");
  private static final CharMatcher PLUS = CharMatcher.is('+');

  /** Returns the ordered pieces of the given field (empty for a null or empty field). */
  public static ImmutableList<String> tokenize(@Nullable String field) {
    if (field == null || field.isEmpty()) {
      return ImmutableList.of();
    }
    // Bit N is set if a piece starts at offset N (offset zero is implicit).
    BitSet cuts = new BitSet(field.length());
    Matcher m = SEPARATOR.matcher(field);
    while (m.find()) {
      cuts.set(m.end());
    }
    if (PLUS.countIn(field) > 1) {
      for (int i = field.indexOf('+', 1); i != -1; i = field.indexOf('+', i + 1)) {
        cuts.set(i);
      }
    }
    cuts.clear(0);
    cuts.clear(field.length());
    if (cuts.isEmpty()) {
      return ImmutableList.of(field);
    }
    ImmutableList.Builder<String> tokens = ImmutableList.builder();
    int start = 0;
    for (int end = cuts.nextSetBit(0); end != -1; end = cuts.nextSetBit(end + 1)) {
      tokens.add(field.substring(start, end));
      start = end;
    }
    tokens.add(field.substring(start));
    return tokens.build();
  }

  private FieldTokenizer() {}
}
