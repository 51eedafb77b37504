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
import org.mosaicdb.catalog.TypeDesc.TypeKind;
import org.mosaicdb.common.MosaicDataTypes.Type;

import static org.junit.Assert.*;

public class TestTypeDesc {

  @Test
  public final void testBaseType() {
    TypeDesc desc = TypeDesc.of(Type.BPCHAR, 3);
    assertEquals(TypeKind.BASE, desc.getKind());
    assertEquals(Type.BPCHAR, desc.resolveHashType());
    assertEquals("bpchar(3)", desc.toString());
  }

  @Test
  public final void testDomainResolvesToBase() {
    TypeDesc zip = TypeDesc.domain("zipcode", TypeDesc.of(Type.VARCHAR, 10));
    assertEquals(TypeKind.DOMAIN, zip.getKind());
    assertEquals("zipcode", zip.getTypeName());
    assertEquals(Type.VARCHAR, zip.resolveHashType());

    TypeDesc nested = TypeDesc.domain("us_zipcode", zip);
    assertEquals(Type.VARCHAR, nested.resolveHashType());
  }

  @Test
  public final void testEnumAndArray() {
    TypeDesc mood = TypeDesc.enumType("mood");
    assertEquals(Type.ANYENUM, mood.resolveHashType());

    TypeDesc ints = TypeDesc.arrayOf(TypeDesc.of(Type.INT4));
    assertEquals(Type.ANYARRAY, ints.resolveHashType());
    assertEquals("int4[]", ints.getTypeName());
    assertEquals(Type.ANYARRAY, TypeDesc.arrayOf(mood).resolveHashType());
  }

  @Test
  public final void testUserDefined() {
    TypeDesc desc = TypeDesc.userDefined("hstore");
    assertEquals(Type.USER_DEFINED, desc.resolveHashType());
    assertEquals("hstore", desc.getTypeName());
  }

  @Test
  public final void testTypeByOid() {
    assertEquals(Type.INT4, Type.valueOf(23));
    assertEquals(Type.NUMERIC, Type.valueOf(Type.NUMERIC.getOid()));
    assertEquals(Type.USER_DEFINED, Type.valueOf(16385));
  }

  @Test
  public final void testEquals() {
    assertEquals(TypeDesc.of(Type.INT8), TypeDesc.of(Type.INT8));
    assertNotEquals(TypeDesc.of(Type.INT8), TypeDesc.domain("id", TypeDesc.of(Type.INT8)));
    assertEquals(TypeDesc.enumType("mood").hashCode(), TypeDesc.enumType("mood").hashCode());
  }
}
