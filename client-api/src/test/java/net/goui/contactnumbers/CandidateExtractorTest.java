/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static net.goui.contactnumbers.Candidate.international;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CandidateExtractorTest {
  private static final CandidateExtractor EXTRACTOR =
      CandidateExtractor.create(RecoveryConfig.defaults());

  @Test
  public void testNoCandidates() {
    assertThat(EXTRACTOR.extract("")).isEmpty();
    assertThat(EXTRACTOR.extract(null)).isEmpty();
    assertThat(EXTRACTOR.extract("N/A")).isEmpty();
    assertThat(EXTRACTOR.extract("ext. 1234")).isEmpty();
    assertThat(EXTRACTOR.extractFromField("N/A")).isEmpty();
  }

  @Test
  public void testExplicitInternational() {
    assertThat(EXTRACTOR.extract("+12145551212")).containsExactly(international("12145551212"));
    assertThat(EXTRACTOR.extract("+52 55 1234 5678"))
        .containsExactly(international("525512345678"));
    assertThat(EXTRACTOR.extract("(+52) 55-1234-5678"))
        .containsExactly(international("525512345678"));
    // Without the explicit rule, the sliding window would find "15123456789" in here.
    assertThat(EXTRACTOR.extract("+49 151 23456789"))
        .containsExactly(international("4915123456789"));
  }

  @Test
  public void testInternationalDialingPrefixes() {
    assertThat(EXTRACTOR.extract("011 52 55 1234 5678"))
        .containsExactly(international("525512345678"));
    assertThat(EXTRACTOR.extract("0052 55 1234 5678"))
        .containsExactly(international("525512345678"));
    // Ten digits in total is a national number, even with a leading "00".
    assertThat(EXTRACTOR.extract("0012345678")).containsExactly(Candidate.of("0012345678"));
  }

  @Test
  public void testFixedWidthRuns() {
    assertThat(EXTRACTOR.extract("12145551212")).containsExactly(Candidate.of("12145551212"));
    assertThat(EXTRACTOR.extract("tel 525512345678 casa"))
        .containsExactly(Candidate.of("525512345678"));
    assertThat(EXTRACTOR.extract("5215512345678")).containsExactly(Candidate.of("5215512345678"));
  }

  @Test
  public void testFormattedNumberUsesWholeText() {
    assertThat(EXTRACTOR.extract("(214) 555-1212")).containsExactly(Candidate.of("2145551212"));
    assertThat(EXTRACTOR.extract("52 55 1234 5678"))
        .containsExactly(Candidate.of("525512345678"));
  }

  @Test
  public void testGluedNumbers() {
    ImmutableList<Candidate> candidates = EXTRACTOR.extract("+18173070515" + "8175648524");
    assertThat(candidates)
        .containsExactly(
            Candidate.of("18173070515"), Candidate.of("17307051581"), Candidate.of("15817564852"))
        .inOrder();

    ImmutableSet<String> normalized =
        candidates.stream()
            .map(EXTRACTOR.getNormalizer()::normalize)
            .flatMap(Optional::stream)
            .map(NormalizedNumber::toString)
            .collect(toImmutableSet());
    assertThat(normalized.size()).isAtLeast(2);
    for (String number : normalized) {
      assertThat(number).startsWith("+1");
      assertThat(number).hasLength(12);
    }
  }

  @Test
  public void testGluedTextHasNoWholeTextCandidate() {
    String glued = "+181730705158175648524";
    // The whole text would be truncated to this.
    assertThat(EXTRACTOR.getNormalizer().normalize(glued).map(NormalizedNumber::toString))
        .hasValue("+181730705158175");
    assertThat(EXTRACTOR.extract(glued)).doesNotContain(international("181730705158175648524"));
    assertThat(EXTRACTOR.extract(glued)).hasSize(3);

    // With nothing else to find, the whole text is still used.
    assertThat(EXTRACTOR.extract("9999999999999999"))
        .containsExactly(Candidate.of("9999999999999999"));
  }

  @Test
  public void testGluedAfterDigits() {
    ImmutableList<Candidate> candidates = EXTRACTOR.extract("2145551212+5215512345678");
    assertThat(candidates)
        .containsAtLeast(international("5215512345678"), Candidate.of("2145551212"))
        .inOrder();
    assertThat(candidates.get(0)).isEqualTo(international("5215512345678"));
  }

  @Test
  public void testSeparatedNumbersInField() {
    assertThat(EXTRACTOR.extractFromField("2145551212, 8175551212 / +52 55 1234 5678"))
        .containsExactly(
            Candidate.of("2145551212"),
            Candidate.of("8175551212"),
            international("525512345678"))
        .inOrder();
    assertThat(EXTRACTOR.extractFromField("+1 214 555 1212 y +52 55 1234 5678"))
        .containsExactly(international("12145551212"), international("525512345678"))
        .inOrder();
  }

  @Test
  public void testFieldFallsBackToWholeText() {
    // Each token is too short on its own.
    assertThat(EXTRACTOR.extractFromField("214/555/1212"))
        .containsExactly(Candidate.of("2145551212"));
  }

  @Test
  public void testWideDigits() {
    assertThat(EXTRACTOR.extract("+１２１４５５５１２１２"))
        .containsExactly(international("12145551212"));
  }
}
