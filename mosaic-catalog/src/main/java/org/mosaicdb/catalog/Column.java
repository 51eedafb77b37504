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
import com.google.gson.annotations.Expose;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.json.CommonGsonHelper;
import org.mosaicdb.json.GsonObject;

/**
 * Describes a column. It is an immutable object.
 */
public class Column implements GsonObject {
  @Expose protected String name;
  @Expose protected TypeDesc typeDesc;

  /**
   * @param name field name
   * @param typeDesc Type description
   */
  public Column(String name, TypeDesc typeDesc) {
    this.name = name.toLowerCase();
    this.typeDesc = typeDesc;
  }

  public Column(String name, Type type) {
    this(name, TypeDesc.of(type));
  }

  public String getSimpleName() {
    return name;
  }

  public TypeDesc getTypeDesc() {
    return typeDesc;
  }

  public Type getType() {
    return typeDesc.getType();
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof Column) {
      Column another = (Column) o;
      return name.equals(another.name) && typeDesc.equals(another.typeDesc);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, typeDesc);
  }

  @Override
  public String toString() {
    return name + " (" + typeDesc + ")";
  }

  @Override
  public String toJson() {
    return CommonGsonHelper.toJson(this, Column.class);
  }
}
