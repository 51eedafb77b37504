/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.mosaicdb.datum;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.math.BigDecimal;

/**
 * Arbitrary precision <code>numeric</code>. Besides every finite decimal it can hold NaN.
 *
 * <p>The digit array returned by {@link #getDigits()} groups the decimal digits of the
 * absolute value in base 10000, aligned at the decimal point, with leading and trailing zero
 * groups removed. Values which differ only in scale (<code>1.5</code> and <code>1.50</code>)
 * share the same digits.
 */
public class NumericDatum extends Datum {
  public static final int NBASE = 10000;
  public static final int DEC_DIGITS = 4;

  private static final NumericDatum NAN = new NumericDatum(null);
  private static final short[] NO_DIGITS = new short[0];

  private final BigDecimal val;
  private short[] digits;

  private NumericDatum(BigDecimal val) {
    super(Type.NUMERIC);
    this.val = val;
  }

  public static NumericDatum nan() {
    return NAN;
  }

  public static NumericDatum of(BigDecimal val) {
    Preconditions.checkNotNull(val);
    return new NumericDatum(val);
  }

  public boolean isNaN() {
    return val == null;
  }

  public BigDecimal getValue() {
    Preconditions.checkState(val != null, "NaN has no decimal value");
    return val;
  }

  public short[] getDigits() {
    if (digits == null) {
      digits = isNaN() ? NO_DIGITS : toDigits(val);
    }
    return digits;
  }

  static short[] toDigits(BigDecimal value) {
    if (value.signum() == 0) {
      return NO_DIGITS;
    }

    String plain = value.abs().toPlainString();
    int point = plain.indexOf('.');
    String intPart = point < 0 ? plain : plain.substring(0, point);
    String fracPart = point < 0 ? "" : plain.substring(point + 1);

    int intLen = ((intPart.length() + DEC_DIGITS - 1) / DEC_DIGITS) * DEC_DIGITS;
    int fracLen = ((fracPart.length() + DEC_DIGITS - 1) / DEC_DIGITS) * DEC_DIGITS;
    String aligned = Strings.padStart(intPart, intLen, '0') + Strings.padEnd(fracPart, fracLen, '0');

    int numGroups = aligned.length() / DEC_DIGITS;
    int first = 0;
    int last = numGroups - 1;
    while (first <= last && isZeroGroup(aligned, first)) {
      first++;
    }
    while (last >= first && isZeroGroup(aligned, last)) {
      last--;
    }

    short[] result = new short[last - first + 1];
    for (int i = first; i <= last; i++) {
      result[i - first] = Short.parseShort(aligned.substring(i * DEC_DIGITS, (i + 1) * DEC_DIGITS));
    }
    return result;
  }

  private static boolean isZeroGroup(String aligned, int group) {
    for (int i = group * DEC_DIGITS; i < (group + 1) * DEC_DIGITS; i++) {
      if (aligned.charAt(i) != '0') {
        return false;
      }
    }
    return true;
  }

  @Override
  public double asFloat8() {
    return isNaN() ? Double.NaN : val.doubleValue();
  }

  @Override
  public String asChars() {
    return isNaN() ? "NaN" : val.toPlainString();
  }

  @Override
  public int size() {
    return isNaN() ? 0 : getDigits().length * 2;
  }

  @Override
  public int hashCode() {
    return isNaN() ? 0 : val.stripTrailingZeros().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof NumericDatum) {
      NumericDatum other = (NumericDatum) obj;
      if (isNaN() || other.isNaN()) {
        return isNaN() && other.isNaN();
      }
      return val.compareTo(other.val) == 0;
    }
    return false;
  }
}
