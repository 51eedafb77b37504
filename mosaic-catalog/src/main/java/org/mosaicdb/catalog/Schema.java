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

import com.google.common.base.Preconditions;
import com.google.gson.annotations.Expose;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.exception.UndefinedColumnException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered physical columns of a relation. Column ids are 0-based; attribute numbers used
 * by distribution policies are 1-based.
 */
public class Schema {
  @Expose protected List<Column> fields = new ArrayList<>();
  @Expose protected Map<String, Integer> fieldsByName = new HashMap<>();

  public Schema() {
  }

  public Schema(Column... columns) {
    for (Column c : columns) {
      addColumn(c);
    }
  }

  public Schema addColumn(String name, Type type) {
    return addColumn(new Column(name, type));
  }

  public Schema addColumn(String name, TypeDesc typeDesc) {
    return addColumn(new Column(name, typeDesc));
  }

  public Schema addColumn(Column column) {
    Preconditions.checkArgument(!fieldsByName.containsKey(column.getSimpleName()),
        "Column \"%s\" already exists", column.getSimpleName());
    fields.add(column);
    fieldsByName.put(column.getSimpleName(), fields.size() - 1);
    return this;
  }

  public int size() {
    return fields.size();
  }

  public Column getColumn(int id) {
    return fields.get(id);
  }

  /**
   * @param attrNum 1-based attribute number
   */
  public Column getColumnByAttrNum(int attrNum) {
    return fields.get(attrNum - 1);
  }

  public Column getColumn(String name) {
    Integer cid = fieldsByName.get(name.toLowerCase());
    return cid != null ? fields.get(cid) : null;
  }

  public boolean contains(String name) {
    return fieldsByName.containsKey(name.toLowerCase());
  }

  public int getColumnId(String name) throws UndefinedColumnException {
    Integer cid = fieldsByName.get(name.toLowerCase());
    if (cid == null) {
      throw new UndefinedColumnException(name);
    }
    return cid;
  }

  /**
   * @return the 1-based attribute number of a column
   */
  public int getAttrNum(String name) throws UndefinedColumnException {
    return getColumnId(name) + 1;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema && fields.equals(((Schema) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{(").append(size()).append(") ");
    int i = 0;
    for (Column col : fields) {
      sb.append(col);
      if (i < fields.size() - 1) {
        sb.append(", ");
      }
      i++;
    }
    sb.append("}");
    return sb.toString();
  }
}
