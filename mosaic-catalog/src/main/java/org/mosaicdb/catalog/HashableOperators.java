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

package org.mosaicdb.catalog;

import com.google.common.collect.ImmutableSet;

/**
 * Equality operators whose two sides hash to the same value whenever the operator returns true.
 * A join or grouping on such an operator can be executed locally once both sides are
 * distributed by the compared columns.
 */
public class HashableOperators {

  // same type equality
  public static final int BOOL_EQ = 91;
  public static final int CHAR_EQ = 92;
  public static final int NAME_EQ = 93;
  public static final int INT2_EQ = 94;
  public static final int INT4_EQ = 96;
  public static final int TEXT_EQ = 98;
  public static final int TID_EQ = 387;
  public static final int INT8_EQ = 410;
  public static final int ABSTIME_EQ = 560;
  public static final int RELTIME_EQ = 566;
  public static final int OID_EQ = 607;
  public static final int FLOAT4_EQ = 620;
  public static final int OIDVECTOR_EQ = 649;
  public static final int FLOAT8_EQ = 670;
  public static final int TINTERVAL_EQ = 811;
  public static final int CASH_EQ = 900;
  public static final int BPCHAR_EQ = 1054;
  public static final int DATE_EQ = 1093;
  public static final int TIME_EQ = 1108;
  public static final int INET_EQ = 1201;
  public static final int MACADDR_EQ = 1220;
  public static final int TIMESTAMPTZ_EQ = 1320;
  public static final int INTERVAL_EQ = 1330;
  public static final int TIMETZ_EQ = 1550;
  public static final int NUMERIC_EQ = 1752;
  public static final int BIT_EQ = 1784;
  public static final int VARBIT_EQ = 1804;
  public static final int BYTEA_EQ = 1955;
  public static final int TIMESTAMP_EQ = 2060;
  public static final int UUID_EQ = 2972;
  public static final int COMPLEX_EQ = 3469;

  // cross width integer equality
  public static final int INT24_EQ = 532;
  public static final int INT42_EQ = 533;
  public static final int INT48_EQ = 15;
  public static final int INT84_EQ = 416;
  public static final int INT28_EQ = 1862;
  public static final int INT82_EQ = 1868;

  // equality operators which are not redistributable
  public static final int ARRAY_EQ = 1070;
  public static final int FLOAT48_EQ = 1120;
  public static final int FLOAT84_EQ = 1130;

  private static final ImmutableSet<Integer> REDISTRIBUTABLE = ImmutableSet.of(
      INT2_EQ, INT4_EQ, INT8_EQ, INT24_EQ, INT28_EQ, INT42_EQ, INT48_EQ, INT82_EQ, INT84_EQ,
      FLOAT4_EQ, FLOAT8_EQ, NUMERIC_EQ,
      CHAR_EQ, BPCHAR_EQ, TEXT_EQ, BYTEA_EQ, NAME_EQ,
      OID_EQ, TID_EQ,
      TIMESTAMP_EQ, TIMESTAMPTZ_EQ, DATE_EQ, TIME_EQ, TIMETZ_EQ, INTERVAL_EQ,
      ABSTIME_EQ, RELTIME_EQ, TINTERVAL_EQ,
      INET_EQ, MACADDR_EQ, BIT_EQ, VARBIT_EQ,
      BOOL_EQ, OIDVECTOR_EQ, CASH_EQ, UUID_EQ, COMPLEX_EQ);

  private HashableOperators() {
  }

  /**
   * @param operatorOid oid of an equality operator
   * @return true if values compared equal by the operator always land on the same segment.
   *         <code>float4 = float8</code> is excluded because the two sides are encoded with
   *         different widths, and array equality because element types may differ.
   */
  public static boolean isRedistributable(int operatorOid) {
    return REDISTRIBUTABLE.contains(operatorOid);
  }
}
