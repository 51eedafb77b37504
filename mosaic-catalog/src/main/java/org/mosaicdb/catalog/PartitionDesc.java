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
import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.Expose;

import java.util.Arrays;
import java.util.List;

/**
 * The partitioning of a root relation: the columns the partition key is computed from and the
 * ids of its leaf partitions. Choosing the leaf for a row is not done here.
 */
public class PartitionDesc {
  @Expose private final int[] partitionKeyAttrs;
  @Expose private final List<Integer> childRelationIds;

  /**
   * @param partitionKeyAttrs 1-based attribute numbers of the partition key
   * @param childRelationIds ids of the leaf partitions
   */
  public PartitionDesc(int[] partitionKeyAttrs, List<Integer> childRelationIds) {
    Preconditions.checkArgument(partitionKeyAttrs.length > 0, "A partition key needs at least one column");
    this.partitionKeyAttrs = partitionKeyAttrs.clone();
    this.childRelationIds = ImmutableList.copyOf(childRelationIds);
  }

  public int[] getPartitionKeyAttrs() {
    return partitionKeyAttrs.clone();
  }

  public int getMaxPartitionKeyAttr() {
    int max = 0;
    for (int attr : partitionKeyAttrs) {
      max = Math.max(max, attr);
    }
    return max;
  }

  public List<Integer> getChildRelationIds() {
    return childRelationIds;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof PartitionDesc) {
      PartitionDesc other = (PartitionDesc) obj;
      return Arrays.equals(partitionKeyAttrs, other.partitionKeyAttrs)
          && childRelationIds.equals(other.childRelationIds);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(partitionKeyAttrs) * 31 + childRelationIds.hashCode();
  }

  @Override
  public String toString() {
    return "PARTITION BY " + Arrays.toString(partitionKeyAttrs) + " " + childRelationIds;
  }
}
