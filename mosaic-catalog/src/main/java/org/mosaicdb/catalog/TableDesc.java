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
import org.mosaicdb.json.CommonGsonHelper;
import org.mosaicdb.json.GsonObject;

public class TableDesc implements GsonObject {
  @Expose protected int relationId;                          // required
  @Expose protected String tableName;                        // required
  @Expose protected Schema schema;                           // required
  @Expose protected DistributionPolicy policy;               // required
  /** the description of table partitioning */
  @Expose protected PartitionDesc partitionDesc;             // optional

  public TableDesc(int relationId, String tableName, Schema schema, DistributionPolicy policy) {
    this(relationId, tableName, schema, policy, null);
  }

  public TableDesc(int relationId, String tableName, Schema schema, DistributionPolicy policy,
                   PartitionDesc partitionDesc) {
    Preconditions.checkNotNull(tableName);
    Preconditions.checkNotNull(schema);
    Preconditions.checkNotNull(policy);
    this.relationId = relationId;
    this.tableName = tableName;
    this.schema = schema;
    this.policy = policy;
    this.partitionDesc = partitionDesc;
  }

  public int getRelationId() {
    return relationId;
  }

  public String getName() {
    return tableName;
  }

  public Schema getSchema() {
    return schema;
  }

  public DistributionPolicy getPolicy() {
    return policy;
  }

  public boolean hasPartition() {
    return partitionDesc != null;
  }

  public PartitionDesc getPartitionDesc() {
    return partitionDesc;
  }

  @Override
  public boolean equals(Object object) {
    if (object instanceof TableDesc) {
      TableDesc other = (TableDesc) object;
      return relationId == other.relationId
          && tableName.equals(other.tableName)
          && schema.equals(other.schema)
          && policy.equals(other.policy)
          && Objects.equal(partitionDesc, other.partitionDesc);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(relationId, tableName, schema, policy, partitionDesc);
  }

  @Override
  public String toString() {
    return tableName + " (" + relationId + ") " + schema + " " + policy
        + (hasPartition() ? " " + partitionDesc : "");
  }

  @Override
  public String toJson() {
    return CommonGsonHelper.toJson(this, TableDesc.class);
  }
}
