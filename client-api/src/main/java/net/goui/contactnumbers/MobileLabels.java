/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.Normalizer2;

/**
 * Matches field labels against mobile keywords, ignoring case and accents (so "Móvil", "movil" and
 * "MOVIL" all match the keyword "móvil").
 */
final class MobileLabels {
  private static final Normalizer2 NFD = Normalizer2.getNFDInstance();
  private static final CharMatcher COMBINING_MARK =
      CharMatcher.forPredicate(c -> UCharacter.getType(c) == UCharacter.NON_SPACING_MARK);

  private final ImmutableSet<String> keywords;

  MobileLabels(Iterable<String> keywords) {
    this.keywords =
        ImmutableSet.copyOf(keywords).stream().map(MobileLabels::fold).collect(toImmutableSet());
  }

  /** Whether the label contains any of the keywords. */
  boolean isMobile(String label) {
    if (label.isBlank()) {
      return false;
    }
    String folded = fold(label);
    return keywords.stream().anyMatch(folded::contains);
  }

  /** Case folds the given text and removes combining accents. */
  static String fold(String text) {
    return COMBINING_MARK.removeFrom(NFD.normalize(UCharacter.foldCase(text, true)));
  }
}
