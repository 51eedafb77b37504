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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.gson.annotations.Expose;
import org.mosaicdb.common.MosaicDataTypes.Type;

/**
 * Type Description for a column. Besides built-in base types a column can be declared with a
 * domain over another type, an enum type or an array type.
 */
public class TypeDesc {
  public enum TypeKind {
    BASE,
    DOMAIN,
    ENUM,
    ARRAY
  }

  @Expose protected Type type;
  @Expose protected TypeKind kind;
  @Expose protected String typeName;
  @Expose protected int length;
  /** the underlying type of a domain, or the element type of an array */
  @Expose protected TypeDesc baseType;

  private TypeDesc(Type type, TypeKind kind, String typeName, int length, TypeDesc baseType) {
    this.type = type;
    this.kind = kind;
    this.typeName = typeName;
    this.length = length;
    this.baseType = baseType;
  }

  public static TypeDesc of(Type type) {
    return new TypeDesc(type, TypeKind.BASE, type.name().toLowerCase(), 0, null);
  }

  /**
   * @param length the declared length, e.g., 3 for <code>char(3)</code>
   */
  public static TypeDesc of(Type type, int length) {
    Preconditions.checkArgument(length >= 0, "negative length: %s", length);
    return new TypeDesc(type, TypeKind.BASE, type.name().toLowerCase(), length, null);
  }

  public static TypeDesc domain(String name, TypeDesc baseType) {
    Preconditions.checkNotNull(baseType);
    return new TypeDesc(baseType.type, TypeKind.DOMAIN, name, baseType.length, baseType);
  }

  public static TypeDesc enumType(String name) {
    return new TypeDesc(Type.ANYENUM, TypeKind.ENUM, name, 0, null);
  }

  public static TypeDesc arrayOf(TypeDesc elementType) {
    Preconditions.checkNotNull(elementType);
    return new TypeDesc(Type.ANYARRAY, TypeKind.ARRAY, elementType.typeName + "[]", 0, elementType);
  }

  /**
   * A type defined by an extension, which the engine knows nothing about.
   */
  public static TypeDesc userDefined(String name) {
    return new TypeDesc(Type.USER_DEFINED, TypeKind.BASE, name, 0, null);
  }

  public Type getType() {
    return type;
  }

  public TypeKind getKind() {
    return kind;
  }

  public String getTypeName() {
    return typeName;
  }

  public int getLength() {
    return length;
  }

  public TypeDesc getBaseType() {
    return baseType;
  }

  /**
   * Collapses this description to the type whose encoding is used for hashing. Domains are
   * replaced by their base type, any enum type by {@link Type#ANYENUM} and any array type by
   * {@link Type#ANYARRAY}.
   */
  public Type resolveHashType() {
    switch (kind) {
      case DOMAIN:
        return baseType.resolveHashType();
      case ENUM:
        return Type.ANYENUM;
      case ARRAY:
        return Type.ANYARRAY;
      default:
        return type;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TypeDesc) {
      TypeDesc other = (TypeDesc) obj;
      return type == other.type && kind == other.kind && length == other.length
          && Objects.equal(typeName, other.typeName) && Objects.equal(baseType, other.baseType);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, kind, typeName, length, baseType);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(typeName);
    if (kind == TypeKind.BASE && length > 0) {
      sb.append("(").append(length).append(")");
    }
    return sb.toString();
  }
}
