/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;

/**
 * One contact to be cleaned: a display name, its phone fields in source order and values which are
 * passed through to the output unchanged.
 *
 * <p>Records are created by whatever reads the source data, which is responsible for mapping its
 * own column layout onto an ordered list of {@link RawField}s.
 */
@AutoValue
public abstract class ContactRecord {
  public static Builder builder(String name) {
    return new AutoValue_ContactRecord.Builder().setName(name).setChannel("").setOptIn("");
  }

  public abstract String name();

  /** Phone fields in source order. */
  public abstract ImmutableList<RawField> fields();

  /** Free-text channel hint (e.g. "WhatsApp"), copied to the output row. */
  public abstract String channel();

  /** Opt-in marker, copied to the output row. */
  public abstract String optIn();

  /** Any other source values, which the engine ignores. */
  public abstract ImmutableMap<String, String> metadata();

  /** Builder for {@link ContactRecord}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    public abstract Builder setChannel(String channel);

    public abstract Builder setOptIn(String optIn);

    abstract ImmutableList.Builder<RawField> fieldsBuilder();

    abstract ImmutableMap.Builder<String, String> metadataBuilder();

    @CanIgnoreReturnValue
    public Builder addField(RawField field) {
      fieldsBuilder().add(checkNotNull(field));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addField(String value, String label) {
      return addField(RawField.of(value, label));
    }

    @CanIgnoreReturnValue
    public Builder putMetadata(String key, String value) {
      metadataBuilder().put(key, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putAllMetadata(Map<String, String> values) {
      metadataBuilder().putAll(values);
      return this;
    }

    public abstract ContactRecord build();
  }
}
