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

import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.*;

public class TestNumericDatum {

  @Test
  public final void testDigits() {
    assertArrayEquals(new short[] {1, 2345, 6789},
        NumericDatum.of(new BigDecimal("12345.6789")).getDigits());
    assertArrayEquals(new short[] {1, 5000}, NumericDatum.of(new BigDecimal("1.5")).getDigits());
    assertArrayEquals(new short[] {1}, NumericDatum.of(new BigDecimal("0.0001")).getDigits());
    assertArrayEquals(new short[] {42}, NumericDatum.of(new BigDecimal("42")).getDigits());
  }

  @Test
  public final void testDigitsIgnoreScale() {
    short[] expected = NumericDatum.of(new BigDecimal("1.5")).getDigits();
    assertArrayEquals(expected, NumericDatum.of(new BigDecimal("1.50")).getDigits());
    assertArrayEquals(expected, NumericDatum.of(new BigDecimal("1.5000000")).getDigits());
    assertEquals(NumericDatum.of(new BigDecimal("1.5")), NumericDatum.of(new BigDecimal("1.500")));
  }

  @Test
  public final void testZero() {
    assertEquals(0, NumericDatum.of(BigDecimal.ZERO).getDigits().length);
    assertEquals(0, NumericDatum.of(new BigDecimal("0.000")).getDigits().length);
  }

  @Test
  public final void testSignNotInDigits() {
    assertArrayEquals(NumericDatum.of(new BigDecimal("7.25")).getDigits(),
        NumericDatum.of(new BigDecimal("-7.25")).getDigits());
  }

  @Test
  public final void testNaN() {
    NumericDatum nan = NumericDatum.nan();
    assertTrue(nan.isNaN());
    assertEquals(0, nan.getDigits().length);
    assertEquals("NaN", nan.asChars());
    assertTrue(Double.isNaN(nan.asFloat8()));
    assertEquals(nan, DatumFactory.createNumeric("nan"));
    assertFalse(nan.equals(NumericDatum.of(BigDecimal.ZERO)));
  }

  @Test(expected = IllegalStateException.class)
  public final void testNaNHasNoValue() {
    NumericDatum.nan().getValue();
  }
}
