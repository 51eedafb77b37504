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

import org.junit.Test;

import static org.junit.Assert.*;

public class TestHashableOperators {

  @Test
  public final void testRedistributable() {
    assertTrue(HashableOperators.isRedistributable(HashableOperators.INT4_EQ));
    // cross width integer comparisons hash the same because every width is widened
    assertTrue(HashableOperators.isRedistributable(HashableOperators.INT28_EQ));
    assertTrue(HashableOperators.isRedistributable(HashableOperators.BPCHAR_EQ));
    assertTrue(HashableOperators.isRedistributable(HashableOperators.NUMERIC_EQ));
    assertTrue(HashableOperators.isRedistributable(HashableOperators.INET_EQ));
  }

  @Test
  public final void testNotRedistributable() {
    assertFalse(HashableOperators.isRedistributable(HashableOperators.FLOAT48_EQ));
    assertFalse(HashableOperators.isRedistributable(HashableOperators.FLOAT84_EQ));
    assertFalse(HashableOperators.isRedistributable(HashableOperators.ARRAY_EQ));
    assertFalse(HashableOperators.isRedistributable(0));
  }
}
