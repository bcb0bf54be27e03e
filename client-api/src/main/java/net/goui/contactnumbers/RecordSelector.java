/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Picks the single best phone number for a contact.
 *
 * <p>Fields are examined in order. The first valid number from a field whose label contains a
 * mobile keyword (see {@link RecoveryConfig#mobileLabelKeywords()}) is selected immediately, since
 * messages are reliably delivered only to mobile numbers. Otherwise the first valid number from any
 * field is selected. Invalid candidates are skipped, and a contact with no valid number at all has
 * no selection.
 *
 * <p>This works equally for simple single-column exports and for labelled multi-column exports,
 * since both are presented as an ordered list of {@link RawField}s.
 */
public final class RecordSelector {
  private final CandidateExtractor extractor;
  private final MobileLabels mobileLabels;

  /** Returns a selector for the given policy. */
  public static RecordSelector create(RecoveryConfig config) {
    return new RecordSelector(CandidateExtractor.create(config), config);
  }

  private RecordSelector(CandidateExtractor extractor, RecoveryConfig config) {
    this.extractor = checkNotNull(extractor);
    this.mobileLabels = new MobileLabels(config.mobileLabelKeywords());
  }

  /** Returns the best number for the given record, or empty if no field has a valid number. */
  public Optional<BestNumber> select(ContactRecord record) {
    return select(record.fields());
  }

  /** Returns the best number from the given fields, or empty if no field has a valid number. */
  public Optional<BestNumber> select(Iterable<RawField> fields) {
    NormalizedNumber fallback = null;
    for (RawField field : fields) {
      if (!field.hasValue()) {
        continue;
      }
      Optional<NormalizedNumber> first = firstNumberIn(field);
      if (first.isEmpty()) {
        continue;
      }
      if (mobileLabels.isMobile(field.label())) {
        return first.map(BestNumber::of);
      }
      if (fallback == null) {
        fallback = first.get();
      }
    }
    return Optional.ofNullable(fallback).map(BestNumber::of);
  }

  /** Whether the given label marks a field as holding a mobile number. A missing label does not. */
  public boolean isMobileLabel(@Nullable String label) {
    return mobileLabels.isMobile(Strings.nullToEmpty(label));
  }

  /** Returns all distinct valid numbers in the given field, in the order they were found. */
  public ImmutableList<NormalizedNumber> numbersIn(RawField field) {
    Set<NormalizedNumber> numbers = new LinkedHashSet<>();
    for (Candidate candidate : extractor.extractFromField(field.value())) {
      extractor.getNormalizer().normalize(candidate).ifPresent(numbers::add);
    }
    return ImmutableList.copyOf(numbers);
  }

  private Optional<NormalizedNumber> firstNumberIn(RawField field) {
    NumberNormalizer normalizer = extractor.getNormalizer();
    return extractor.extractFromField(field.value()).stream()
        .map(normalizer::normalize)
        .flatMap(Optional::stream)
        .findFirst();
  }
}
