/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.truth.Truth.assertThat;
import static net.goui.contactnumbers.CountryTag.INTL;
import static net.goui.contactnumbers.CountryTag.MX;
import static net.goui.contactnumbers.CountryTag.UNKNOWN;
import static net.goui.contactnumbers.CountryTag.US;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NormalizedNumberTest {
  @Test
  public void testFromE164() {
    NormalizedNumber number = NormalizedNumber.fromE164("+12145551212");
    assertThat(number.getDigits()).isEqualTo("12145551212");
    assertThat(number.length()).isEqualTo(11);
    assertThat(number.toString()).isEqualTo("+12145551212");
    assertThat(number).isEqualTo(NormalizedNumber.fromE164("+12145551212"));
    assertThat(number).isNotEqualTo(NormalizedNumber.fromE164("+12145551213"));
  }

  @Test
  public void testFromE164Errors() {
    assertThrows(NullPointerException.class, () -> NormalizedNumber.fromE164(null));
    assertThrows(IllegalArgumentException.class, () -> NormalizedNumber.fromE164("12145551212"));
    assertThrows(IllegalArgumentException.class, () -> NormalizedNumber.fromE164("+1234567"));
    assertThrows(
        IllegalArgumentException.class, () -> NormalizedNumber.fromE164("+1234567890123456"));
    assertThrows(
        IllegalArgumentException.class, () -> NormalizedNumber.fromE164("+1 214 555 1212"));
  }

  @Test
  public void testCountryTag() {
    assertThat(NormalizedNumber.fromE164("+12145551212").getCountryTag()).isEqualTo(US);
    assertThat(NormalizedNumber.fromE164("+525512345678").getCountryTag()).isEqualTo(MX);
    assertThat(NormalizedNumber.fromE164("+5215512345678").getCountryTag()).isEqualTo(MX);
    assertThat(NormalizedNumber.fromE164("+442079460958").getCountryTag()).isEqualTo(INTL);
    // Calling code 5 alone is not Mexico.
    assertThat(NormalizedNumber.fromE164("+5112345678").getCountryTag()).isEqualTo(INTL);
  }

  @Test
  public void testClassifyText() {
    assertThat(CountryTag.classify("+14155551212")).isEqualTo(US);
    assertThat(CountryTag.classify("+525512345678")).isEqualTo(MX);
    assertThat(CountryTag.classify("+4915123456789")).isEqualTo(INTL);
    assertThat(CountryTag.classify("")).isEqualTo(UNKNOWN);
    assertThat(CountryTag.classify("+1 415 555")).isEqualTo(UNKNOWN);
    assertThat(CountryTag.classify("N/A")).isEqualTo(UNKNOWN);
  }
}
