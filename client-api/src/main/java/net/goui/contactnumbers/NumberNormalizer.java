/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static net.goui.contactnumbers.Digits.MAX_E164_DIGITS;
import static net.goui.contactnumbers.Digits.MIN_NUMBER_DIGITS;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps phone number candidates to canonical E.164 numbers.
 *
 * <p>Rules are tried in a fixed order, and the first which applies determines the result:
 *
 * <ol>
 *   <li>Candidates with an international marker keep their digits (which must already start with
 *       a calling code).
 *   <li>Eleven digits starting with '1' are North American numbers with a trunk prefix.
 *   <li>Ten digits are national numbers for the configured default country.
 *   <li>Twelve or thirteen digits starting with "52" are Mexican numbers.
 *   <li>Any other sequence of at least 8 digits is assumed to start with a calling code.
 * </ol>
 *
 * <p>The marked path comes first because the source text explicitly identified the number as
 * international; the remaining rules are guesses biased toward the default country. Numbers longer
 * than 15 digits keep their leading 15 digits, since these identify the country and area. No check
 * is made that the leading digits form an assigned calling code (e.g. "044 55 1234 5678" becomes
 * "+0445512345678").
 *
 * <p>If {@link RecoveryConfig#mexicoMobileDisambiguatorEnabled()} is set, Mexican numbers with a
 * 10-digit national number get a '1' inserted after the calling code (i.e. "+52" becomes "+521").
 * This includes national numbers for a default country code of "+52", so that normalizing a result
 * again never changes it.
 */
public final class NumberNormalizer {
  private static final String CC_MEXICO = "52";
  private static final String MEXICO_MOBILE_TOKEN = "1";
  private static final int MEXICO_NATIONAL_LENGTH = 10;

  private final RecoveryConfig config;
  private final String defaultCallingCode;
  // Longest first, so "011" is tested before "01" if both are configured.
  private final ImmutableList<String> internationalPrefixes;

  /** Returns a normalizer for the given policy. */
  public static NumberNormalizer create(RecoveryConfig config) {
    return new NumberNormalizer(config);
  }

  private NumberNormalizer(RecoveryConfig config) {
    this.config = checkNotNull(config);
    this.defaultCallingCode = config.defaultCountryCode().substring(1);
    this.internationalPrefixes =
        config.internationalPrefixes().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(toImmutableList());
  }

  public RecoveryConfig getConfig() {
    return config;
  }

  /** Normalizes the given candidate, or returns empty if no rule produces a plausible number. */
  public Optional<NormalizedNumber> normalize(Candidate candidate) {
    return Optional.ofNullable(normalizeImpl(candidate)).map(NormalizedNumber::ofDigits);
  }

  /**
   * Normalizes the given candidate.
   *
   * @throws InvalidNumberException if no rule produces a plausible number.
   */
  public NormalizedNumber normalizeStrictly(Candidate candidate) {
    String digits = normalizeImpl(candidate);
    if (digits == null) {
      throw new InvalidNumberException(
          candidate.toString(), "fewer than " + MIN_NUMBER_DIGITS + " digits");
    }
    return NormalizedNumber.ofDigits(digits);
  }

  /**
   * Normalizes arbitrary text as a single number. A leading '+' (or a configured international
   * dialing prefix on a number longer than 10 digits) marks the number as international, and all
   * other non-digit characters are ignored.
   */
  public Optional<NormalizedNumber> normalize(String text) {
    Candidate candidate = toCandidate(text);
    return candidate != null ? normalize(candidate) : Optional.empty();
  }

  /**
   * Normalizes arbitrary text as a single number (see {@link #normalize(String)}).
   *
   * @throws InvalidNumberException if the text has no digits or no rule produces a plausible
   *     number.
   */
  public NormalizedNumber normalizeStrictly(String text) {
    Candidate candidate = toCandidate(text);
    if (candidate == null) {
      throw new InvalidNumberException(text, "no digits");
    }
    return normalizeStrictly(candidate);
  }

  /** Returns the candidate for text which is assumed to hold one number, or null if no digits. */
  @Nullable
  Candidate toCandidate(String text) {
    String digits = Digits.digitsOf(text);
    if (digits.isEmpty()) {
      return null;
    }
    int plus = text.indexOf('+');
    if (plus != -1 && plus < Digits.ASCII_DIGIT.indexIn(Digits.normalizeToAscii(text))) {
      return Candidate.international(digits);
    }
    for (String prefix : internationalPrefixes) {
      if (digits.startsWith(prefix) && isDialedInternationally(prefix.length(), digits.length())) {
        return Candidate.international(digits.substring(prefix.length()));
      }
    }
    return Candidate.of(digits);
  }

  /** Returns the configured international dialing prefixes, longest first. */
  ImmutableList<String> internationalPrefixes() {
    return internationalPrefixes;
  }

  /**
   * Whether a sequence of digits starting with an international dialing prefix should be treated as
   * a dialed international number. The total length must exceed that of a national number, so that
   * 10-digit national numbers are never reinterpreted.
   */
  static boolean isDialedInternationally(int prefixLength, int totalLength) {
    int remaining = totalLength - prefixLength;
    return totalLength > 10 && remaining >= MIN_NUMBER_DIGITS && remaining <= MAX_E164_DIGITS;
  }

  @Nullable
  private String normalizeImpl(Candidate candidate) {
    String digits = candidate.digits();
    if (candidate.hasInternationalMarker()) {
      if (digits.length() < MIN_NUMBER_DIGITS) {
        return null;
      }
      return applyMexicoPolicy(Digits.truncateToE164(digits));
    }
    if (digits.length() == 11 && digits.startsWith("1")) {
      return digits;
    }
    if (digits.length() == 10) {
      return applyMexicoPolicy(defaultCallingCode + digits);
    }
    if (digits.startsWith(CC_MEXICO) && (digits.length() == 12 || digits.length() == 13)) {
      return applyMexicoPolicy(digits);
    }
    if (digits.length() >= MIN_NUMBER_DIGITS) {
      return Digits.truncateToE164(digits);
    }
    return null;
  }

  private String applyMexicoPolicy(String digits) {
    if (config.mexicoMobileDisambiguatorEnabled()
        && digits.startsWith(CC_MEXICO)
        && !digits.startsWith(CC_MEXICO + MEXICO_MOBILE_TOKEN)
        && digits.length() == CC_MEXICO.length() + MEXICO_NATIONAL_LENGTH) {
      return CC_MEXICO + MEXICO_MOBILE_TOKEN + digits.substring(CC_MEXICO.length());
    }
    return digits;
  }
}
