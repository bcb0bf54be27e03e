/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.contactnumbers;

import com.google.auto.value.AutoValue;

/** The number selected for a contact, together with its country tag. */
@AutoValue
public abstract class BestNumber {
  public static BestNumber of(NormalizedNumber number) {
    return new AutoValue_BestNumber(number, number.getCountryTag());
  }

  public abstract NormalizedNumber number();

  public abstract CountryTag country();

  @Override
  public final String toString() {
    return number() + " (" + country() + ")";
  }
}
