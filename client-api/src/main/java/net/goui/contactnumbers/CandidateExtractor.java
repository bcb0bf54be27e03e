/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.stream.Collectors.joining;
import static net.goui.contactnumbers.Digits.MAX_E164_DIGITS;
import static net.goui.contactnumbers.Digits.MIN_NUMBER_DIGITS;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds phone number candidates in free text.
 *
 * <p>Text is scanned by a list of layered rules, and the results of all rules are combined (rather
 * than stopping at the first rule which matches) so that several numbers hidden in one piece of
 * text are all recovered. In priority order:
 *
 * <ol>
 *   <li>Explicit international numbers: a '+' (or a configured international dialing prefix such
 *       as "00") followed by 8 to 15 digits, optionally grouped by up to two whitespace, dash, dot
 *       or parenthesis characters between digits (e.g. {@code "+52 (55) 1234-5678"}).
 *   <li>Contiguous digit runs of known fixed widths: Mexico ({@code 52} + 10 digits, or {@code 521}
 *       + 10 digits), then the US (10 digits, or 11 starting with '1').
 *   <li>If the text holds more than 15 digits, or nothing was found so far, a sliding window over
 *       all the digits of the text. Every 11-digit window starting '1', 12-digit window starting
 *       "52" and 13-digit window starting "521" is a candidate. This recovers numbers glued
 *       together with no separator at all, at the cost of also returning overlapping windows.
 *   <li>The whole text, normalized as a single number, if it is not already covered by an earlier
 *       candidate. Unlike the other rules, this is not always applied: text with more than 15
 *       digits only gets it when nothing else was found. Such text holds glued numbers, and as a
 *       single number it would only be truncated to a 15-digit prefix which matches none of them.
 * </ol>
 *
 * <p>Candidates are returned in rule order, without duplicate digit sequences.
 */
public final class CandidateExtractor {
  private static final Pattern MEXICO_RUN =
      Pattern.compile("(?<!\\d)(?:521\\d{10}|52\\d{10})(?!\\d)");
  private static final Pattern US_RUN = Pattern.compile("(?<!\\d)(?:1\\d{10}|\\d{10})(?!\\d)");
  // Up to two grouping characters between adjacent digits, as in ") " for "(55) 1234".
  private static final String GROUPED_DIGITS = "\\d(?:[\\s().\\-]{0,2}\\d)*";

  private static final int US_WINDOW = 11;
  private static final int MEXICO_WINDOW = 12;
  private static final int MEXICO_MOBILE_WINDOW = 13;

  private final NumberNormalizer normalizer;
  private final Pattern explicitInternational;

  /** Returns an extractor for the given policy. */
  public static CandidateExtractor create(RecoveryConfig config) {
    return new CandidateExtractor(NumberNormalizer.create(config));
  }

  /** Returns an extractor which shares the given normalizer (and its policy). */
  public static CandidateExtractor create(NumberNormalizer normalizer) {
    return new CandidateExtractor(normalizer);
  }

  private CandidateExtractor(NumberNormalizer normalizer) {
    this.normalizer = checkNotNull(normalizer);
    String dialingPrefixes =
        normalizer.internationalPrefixes().stream().map(Pattern::quote).collect(joining("|"));
    String marker =
        dialingPrefixes.isEmpty()
            ? "\\+\\(?"
            : "\\+\\(?|(?<![\\d+])(?:" + dialingPrefixes + ")[\\s.\\-]?";
    this.explicitInternational = Pattern.compile("(" + marker + ")(" + GROUPED_DIGITS + ")");
  }

  public NumberNormalizer getNormalizer() {
    return normalizer;
  }

  /**
   * Returns the candidates in a whole phone field. The field is split by {@link FieldTokenizer} and
   * each piece is scanned in order. If no piece yields a candidate, the unsplit field is scanned
   * instead (e.g. for {@code "214/555/1212"}, where the separators were part of the number).
   */
  public ImmutableList<Candidate> extractFromField(@Nullable String field) {
    if (field == null || field.isEmpty()) {
      return ImmutableList.of();
    }
    Map<String, Candidate> found = new LinkedHashMap<>();
    for (String token : FieldTokenizer.tokenize(field)) {
      extract(token).forEach(c -> found.putIfAbsent(c.digits(), c));
    }
    return !found.isEmpty() ? ImmutableList.copyOf(found.values()) : extract(field);
  }

  /** Returns the candidates in a single piece of text, in rule priority order. */
  public ImmutableList<Candidate> extract(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return ImmutableList.of();
    }
    text = Digits.normalizeToAscii(text);
    Map<String, Candidate> found = new LinkedHashMap<>();
    addExplicitInternational(text, found);
    addRuns(MEXICO_RUN, text, found);
    addRuns(US_RUN, text, found);

    String digits = Digits.digitsOf(text);
    boolean glued = digits.length() > MAX_E164_DIGITS;
    if (glued || found.isEmpty()) {
      addSlidingWindows(digits, found);
    }
    if (!glued || found.isEmpty()) {
      addWholeText(text, found);
    }
    return ImmutableList.copyOf(found.values());
  }

  private void addExplicitInternational(String text, Map<String, Candidate> found) {
    Matcher m = explicitInternational.matcher(text);
    while (m.find()) {
      String markerDigits = Digits.digitsOf(m.group(1));
      String digits = Digits.digitsOf(m.group(2));
      boolean accepted =
          markerDigits.isEmpty()
              ? digits.length() >= MIN_NUMBER_DIGITS && digits.length() <= MAX_E164_DIGITS
              : NumberNormalizer.isDialedInternationally(
                  markerDigits.length(), markerDigits.length() + digits.length());
      if (accepted) {
        add(Candidate.international(digits), found);
      }
    }
  }

  private static void addRuns(Pattern run, String text, Map<String, Candidate> found) {
    Matcher m = run.matcher(text);
    while (m.find()) {
      add(Candidate.of(m.group()), found);
    }
  }

  private static void addSlidingWindows(String digits, Map<String, Candidate> found) {
    for (int start = 0; start < digits.length(); start++) {
      addWindow(digits, start, US_WINDOW, "1", found);
      addWindow(digits, start, MEXICO_WINDOW, "52", found);
      addWindow(digits, start, MEXICO_MOBILE_WINDOW, "521", found);
    }
  }

  private static void addWindow(
      String digits, int start, int width, String prefix, Map<String, Candidate> found) {
    if (start + width <= digits.length() && digits.startsWith(prefix, start)) {
      add(Candidate.of(digits.substring(start, start + width)), found);
    }
  }

  private void addWholeText(String text, Map<String, Candidate> found) {
    Candidate whole = normalizer.toCandidate(text);
    if (whole == null) {
      return;
    }
    Optional<NormalizedNumber> number = normalizer.normalize(whole);
    if (number.isPresent() && !normalizedValues(found).contains(number.get())) {
      add(whole, found);
    }
  }

  private ImmutableSet<NormalizedNumber> normalizedValues(Map<String, Candidate> found) {
    return found.values().stream()
        .map(normalizer::normalize)
        .flatMap(Optional::stream)
        .collect(toImmutableSet());
  }

  private static void add(Candidate candidate, Map<String, Candidate> found) {
    found.putIfAbsent(candidate.digits(), candidate);
  }
}
