/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;

/**
 * Policy options for number recovery. Instances are immutable and are passed explicitly to the
 * engine, so batches with different policies can be processed side by side.
 */
@AutoValue
public abstract class RecoveryConfig {
  private static final Pattern CALLING_CODE = Pattern.compile("\\+[1-9][0-9]{0,2}");
  private static final Pattern DIALING_PREFIX = Pattern.compile("0[0-9]{1,3}");

  private static final RecoveryConfig DEFAULTS = builder().build();

  /** Returns the default policy (see {@link #builder()} for the default values). */
  public static RecoveryConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a builder with the default policy:
   *
   * <ul>
   *   <li>default country code {@code "+1"}
   *   <li>Mexico mobile disambiguator disabled
   *   <li>mobile label keywords {@code {"mobile", "cell", "móvil"}}
   *   <li>international dialing prefixes {@code {"011", "00"}}
   * </ul>
   */
  public static Builder builder() {
    return new AutoValue_RecoveryConfig.Builder()
        .setDefaultCountryCode("+1")
        .setMexicoMobileDisambiguatorEnabled(false)
        .setMobileLabelKeywords(ImmutableSet.of("mobile", "cell", "móvil"))
        .setInternationalPrefixes(ImmutableSet.of("011", "00"));
  }

  /**
   * The calling code (with leading '+') assumed for bare 10-digit numbers. This is a deliberate
   * bias toward the expected population of contacts, and should be changed for other locales.
   */
  public abstract String defaultCountryCode();

  /**
   * Whether to insert the legacy mobile digit '1' after calling code 52 for Mexican numbers with a
   * 10-digit national number (e.g. {@code +52 55 1234 5678 -> +521 55 1234 5678}).
   */
  public abstract boolean mexicoMobileDisambiguatorEnabled();

  /** Keywords which, when found in a field label, mark the field as a mobile number. */
  public abstract ImmutableSet<String> mobileLabelKeywords();

  /** Dialing prefixes which act like a leading '+' when they start a sufficiently long number. */
  public abstract ImmutableSet<String> internationalPrefixes();

  public abstract Builder toBuilder();

  /** Builder for {@link RecoveryConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDefaultCountryCode(String callingCode);

    public abstract Builder setMexicoMobileDisambiguatorEnabled(boolean enabled);

    public abstract Builder setMobileLabelKeywords(Iterable<String> keywords);

    public abstract Builder setInternationalPrefixes(Iterable<String> prefixes);

    abstract RecoveryConfig autoBuild();

    public RecoveryConfig build() {
      RecoveryConfig config = autoBuild();
      checkArgument(
          CALLING_CODE.matcher(config.defaultCountryCode()).matches(),
          "invalid default country code (expected '+' and 1-3 digits): %s",
          config.defaultCountryCode());
      checkArgument(
          config.mobileLabelKeywords().stream().noneMatch(String::isBlank),
          "mobile label keywords must not be blank: %s",
          config.mobileLabelKeywords());
      checkArgument(
          config.internationalPrefixes().stream().allMatch(p -> DIALING_PREFIX.matcher(p).matches()),
          "international prefixes must be 2-4 digits starting with '0': %s",
          config.internationalPrefixes());
      return config;
    }
  }
}
