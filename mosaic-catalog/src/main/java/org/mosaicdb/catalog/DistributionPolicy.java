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
import org.mosaicdb.exception.InvalidPolicyException;
import org.mosaicdb.json.CommonGsonHelper;
import org.mosaicdb.json.GsonObject;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Describes how the rows of a relation are spread over segments. A <code>PARTITIONED</code>
 * policy hashes the listed attributes; with no attributes rows are spread round robin.
 * An <code>ENTRY</code> policy keeps every row on the single entry node.
 *
 * <p>Attribute numbers are 1-based positions in the relation's schema. It is an immutable object.
 */
public class DistributionPolicy implements GsonObject {
  public enum PolicyType {
    PARTITIONED,
    ENTRY
  }

  private static final int[] NO_ATTRS = new int[0];

  @Expose private final PolicyType policyType;
  @Expose private final int[] attrs;

  private DistributionPolicy(PolicyType policyType, int[] attrs) {
    this.policyType = policyType;
    this.attrs = attrs;
  }

  /**
   * @param attrs 1-based attribute numbers of the distribution key, in key order
   */
  public static DistributionPolicy partitioned(int... attrs) {
    for (int attr : attrs) {
      Preconditions.checkArgument(attr > 0, "attribute numbers are 1-based: %s", attr);
    }
    return new DistributionPolicy(PolicyType.PARTITIONED, attrs.clone());
  }

  /**
   * @return a policy without a distribution key
   */
  public static DistributionPolicy randomly() {
    return new DistributionPolicy(PolicyType.PARTITIONED, NO_ATTRS);
  }

  public static DistributionPolicy entry() {
    return new DistributionPolicy(PolicyType.ENTRY, NO_ATTRS);
  }

  public PolicyType getPolicyType() {
    return policyType;
  }

  public boolean isPartitioned() {
    return policyType == PolicyType.PARTITIONED;
  }

  public int getNumAttrs() {
    return attrs.length;
  }

  /**
   * @param i the index in the key
   * @return the 1-based attribute number
   */
  public int getAttr(int i) {
    return attrs[i];
  }

  public int[] getAttrs() {
    return attrs.clone();
  }

  public boolean hasDistributionKey() {
    return attrs.length > 0;
  }

  /**
   * Two policies are equivalent if they place every row on the same segment.
   */
  public boolean isEquivalent(DistributionPolicy other) {
    if (other == null) {
      return false;
    }
    return policyType == other.policyType && Arrays.equals(attrs, other.attrs);
  }

  /**
   * Checks that every attribute exists in a relation with <code>numColumns</code> columns and
   * appears at most once.
   */
  public void validate(String relationName, int numColumns) throws InvalidPolicyException {
    BitSet seen = new BitSet(numColumns + 1);
    for (int attr : attrs) {
      if (attr < 1 || attr > numColumns) {
        throw new InvalidPolicyException(relationName,
            "attribute number " + attr + " is out of range 1.." + numColumns);
      }
      if (seen.get(attr)) {
        throw new InvalidPolicyException(relationName, "attribute number " + attr + " appears twice");
      }
      seen.set(attr);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof DistributionPolicy) {
      return isEquivalent((DistributionPolicy) obj);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return policyType.hashCode() * 31 + Arrays.hashCode(attrs);
  }

  @Override
  public String toString() {
    if (policyType == PolicyType.ENTRY) {
      return "ENTRY";
    }
    return attrs.length == 0 ? "DISTRIBUTED RANDOMLY" : "DISTRIBUTED BY " + Arrays.toString(attrs);
  }

  @Override
  public String toJson() {
    return CommonGsonHelper.toJson(this, DistributionPolicy.class);
  }

  public static DistributionPolicy fromJson(String json) {
    DistributionPolicy policy = CommonGsonHelper.fromJson(json, DistributionPolicy.class);
    return policy.attrs == null ? new DistributionPolicy(policy.policyType, NO_ATTRS) : policy;
  }
}
