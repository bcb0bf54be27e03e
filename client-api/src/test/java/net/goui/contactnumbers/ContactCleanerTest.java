/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContactCleanerTest {
  private static final ContactCleaner CLEANER = ContactCleaner.create(RecoveryConfig.defaults());

  @Test
  public void testClean() {
    ContactRecord ana =
        ContactRecord.builder("Ana")
            .addField("(214) 555-1212", "Home")
            .addField("+52 55 1234 5678", "Mobile")
            .setChannel("WhatsApp")
            .setOptIn("yes")
            .build();
    ContactRecord beto = ContactRecord.builder("Beto").addField("817.555.1212", "").build();
    ContactRecord nobody = ContactRecord.builder("Nobody").addField("N/A", "Mobile").build();
    ContactRecord anaAgain =
        ContactRecord.builder("Ana M.").addField("5255-1234-5678", "Cell").build();

    CleaningResult result = CLEANER.clean(ImmutableList.of(ana, beto, nobody, anaAgain));

    assertThat(result.rows())
        .containsExactly(
            OutputRow.of(
                "Ana",
                BestNumber.of(NormalizedNumber.fromE164("+525512345678")),
                "WhatsApp",
                "yes"),
            OutputRow.of("Beto", BestNumber.of(NormalizedNumber.fromE164("+18175551212")), "", ""))
        .inOrder();
    assertThat(result.unresolved()).containsExactly(nobody);
    assertThat(result.duplicateCount()).isEqualTo(1);
  }

  @Test
  public void testOutputColumns() {
    CleaningResult result =
        CLEANER.clean(
            ImmutableList.of(
                ContactRecord.builder("Ana")
                    .addField("2145551212", "")
                    .setChannel("SMS")
                    .putMetadata("Notes", "ignored")
                    .build()));
    ImmutableMap<String, String> row = result.rows().get(0).toMap();
    assertThat(row.keySet()).containsExactlyElementsIn(OutputRow.COLUMNS).inOrder();
    assertThat(row)
        .containsExactly(
            "Name", "Ana",
            "Phone_E164", "+12145551212",
            "Country", "US",
            "Channel", "SMS",
            "OptIn", "");
  }

  @Test
  public void testBatchesAreIndependent() {
    ImmutableList<ContactRecord> batch =
        ImmutableList.of(ContactRecord.builder("Ana").addField("2145551212", "").build());
    assertThat(CLEANER.clean(batch).rows()).hasSize(1);
    assertThat(CLEANER.clean(batch).rows()).hasSize(1);
  }

  @Test
  public void testMexicoMobileDisambiguator() {
    ContactCleaner cleaner =
        ContactCleaner.create(
            RecoveryConfig.builder().setMexicoMobileDisambiguatorEnabled(true).build());
    CleaningResult result =
        cleaner.clean(
            ImmutableList.of(
                ContactRecord.builder("A").addField("+52 55 1234 5678", "").build(),
                ContactRecord.builder("B").addField("+521 55 1234 5678", "").build()));
    // Both spellings map to the same number, so the second row is a duplicate.
    assertThat(result.rows().stream().map(r -> r.phoneE164().toString()).collect(toImmutableList()))
        .containsExactly("+5215512345678");
    assertThat(result.duplicateCount()).isEqualTo(1);
  }
}
