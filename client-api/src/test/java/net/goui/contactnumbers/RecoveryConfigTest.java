/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RecoveryConfigTest {
  @Test
  public void testDefaults() {
    RecoveryConfig config = RecoveryConfig.defaults();
    assertThat(config.defaultCountryCode()).isEqualTo("+1");
    assertThat(config.mexicoMobileDisambiguatorEnabled()).isFalse();
    assertThat(config.mobileLabelKeywords()).containsExactly("mobile", "cell", "móvil");
    assertThat(config.internationalPrefixes()).containsExactly("011", "00");
    assertThat(RecoveryConfig.builder().build()).isEqualTo(config);
  }

  @Test
  public void testToBuilder() {
    RecoveryConfig config =
        RecoveryConfig.defaults().toBuilder().setDefaultCountryCode("+52").build();
    assertThat(config.defaultCountryCode()).isEqualTo("+52");
    assertThat(config.mobileLabelKeywords())
        .isEqualTo(RecoveryConfig.defaults().mobileLabelKeywords());
  }

  @Test
  public void testInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RecoveryConfig.builder().setDefaultCountryCode("52").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> RecoveryConfig.builder().setDefaultCountryCode("+0").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> RecoveryConfig.builder().setDefaultCountryCode("+1234").build());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            RecoveryConfig.builder().setMobileLabelKeywords(ImmutableSet.of("mobile", " ")).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> RecoveryConfig.builder().setInternationalPrefixes(ImmutableSet.of("11")).build());
  }

  @Test
  public void testNoInternationalPrefixes() {
    RecoveryConfig config =
        RecoveryConfig.builder().setInternationalPrefixes(ImmutableSet.of()).build();
    NumberNormalizer normalizer = NumberNormalizer.create(config);
    // "00" is no longer special, so the prefix is kept as part of a generic number.
    assertThat(normalizer.normalize("0044 20 7946 0958"))
        .hasValue(NormalizedNumber.fromE164("+00442079460958"));
    assertThat(CandidateExtractor.create(config).extract("+44 20 7946 0958"))
        .containsExactly(Candidate.international("442079460958"));
  }
}
