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

package org.mosaicdb.engine.router;

import org.mosaicdb.catalog.Column;
import org.mosaicdb.catalog.DistributionPolicy;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.engine.hash.CdbHash;
import org.mosaicdb.engine.hash.DatumHasher;
import org.mosaicdb.exception.InvalidPolicyException;
import org.mosaicdb.exception.NotHashableException;

/**
 * A distribution policy bound to a relation: the hash type of every key column, resolved once,
 * and the {@link CdbHash} the rows are hashed with.
 */
public class DistributionData {
  private final int relationId;
  private final DistributionPolicy policy;
  private final Type[] hashTypes;
  private final CdbHash cdbHash;

  DistributionData(int relationId, DistributionPolicy policy, Type[] hashTypes, CdbHash cdbHash) {
    this.relationId = relationId;
    this.policy = policy;
    this.hashTypes = hashTypes;
    this.cdbHash = cdbHash;
  }

  /**
   * Binds the declared policy of a relation.
   *
   * @throws InvalidPolicyException if the policy is not a hash policy or refers to a missing column
   * @throws NotHashableException if a key column has a type which cannot be hashed
   */
  public static DistributionData bind(TableDesc table, RouterContext context)
      throws InvalidPolicyException, NotHashableException {
    DistributionPolicy policy = table.getPolicy();
    return new DistributionData(table.getRelationId(), policy, resolveHashTypes(table, policy),
        context.newCdbHash());
  }

  static Type[] resolveHashTypes(TableDesc table, DistributionPolicy policy)
      throws InvalidPolicyException, NotHashableException {
    if (!policy.isPartitioned()) {
      throw new InvalidPolicyException(table.getName(), "rows of an entry relation are not distributed");
    }
    policy.validate(table.getName(), table.getSchema().size());

    Type[] hashTypes = new Type[policy.getNumAttrs()];
    for (int i = 0; i < hashTypes.length; i++) {
      Column column = table.getSchema().getColumnByAttrNum(policy.getAttr(i));
      Type type = column.getTypeDesc().resolveHashType();
      if (!DatumHasher.isHashable(type)) {
        throw new NotHashableException(column.getTypeDesc().getTypeName());
      }
      hashTypes[i] = type;
    }
    return hashTypes;
  }

  public int getRelationId() {
    return relationId;
  }

  public DistributionPolicy getPolicy() {
    return policy;
  }

  /**
   * @param i the index in the distribution key
   */
  public Type getHashType(int i) {
    return hashTypes[i];
  }

  public CdbHash getCdbHash() {
    return cdbHash;
  }
}
