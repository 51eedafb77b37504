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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.catalog.CatalogService;
import org.mosaicdb.catalog.DistributionPolicy;
import org.mosaicdb.catalog.PartitionDesc;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.datum.Datum;
import org.mosaicdb.engine.hash.CdbHash;
import org.mosaicdb.exception.DistributionKeyViolationException;
import org.mosaicdb.exception.InvalidPolicyException;
import org.mosaicdb.exception.MosaicException;
import org.mosaicdb.exception.NotHashableException;
import org.mosaicdb.exception.UndefinedTableException;
import org.mosaicdb.storage.Tuple;

import java.util.BitSet;
import java.util.OptionalInt;

/**
 * Decides which segment each row of a relation is stored on.
 *
 * <p>The policy of the relation is bound when the router is created. For a partitioned relation
 * the policies of all leaf partitions are compared with the root's; if any differs, each row is
 * hashed with the policy of the leaf partition it belongs to.
 *
 * <p>A router belongs to one statement and is not thread safe.
 */
public class RowRouter {
  private static final Log LOG = LogFactory.getLog(RowRouter.class);

  private final TableDesc table;
  private final RouterContext context;
  private final DistributionData rootData;
  private final PartitionDesc partitionDesc;
  private final PartitionSelector partitionSelector;
  private final boolean partitionPoliciesEqual;
  private final PartitionPolicyCache policyCache;
  /** 1-based attribute numbers that must be known to route a row */
  private final BitSet neededAttrs = new BitSet();

  public RowRouter(CatalogService catalog, int relationId, RouterContext context)
      throws MosaicException {
    this(catalog, relationId, context, null);
  }

  /**
   * @param partitionSelector chooses the leaf partition of a row. It may be null unless the relation
   *                          is partitioned and its partitions have their own policies.
   * @throws UndefinedTableException if the relation does not exist
   * @throws InvalidPolicyException if a policy cannot be bound
   * @throws NotHashableException if a key column of any policy has a type which cannot be hashed
   */
  public RowRouter(CatalogService catalog, int relationId, RouterContext context,
                   PartitionSelector partitionSelector) throws MosaicException {
    this.table = catalog.getTableDesc(relationId);
    this.context = context;
    this.rootData = DistributionData.bind(table, context);
    this.partitionDesc = table.getPartitionDesc();
    this.partitionSelector = partitionSelector;

    if (partitionDesc == null) {
      partitionPoliciesEqual = true;
      addNeededAttrs(rootData.getPolicy());
    } else {
      boolean equal = true;
      BitSet childAttrs = new BitSet();
      for (int childId : partitionDesc.getChildRelationIds()) {
        TableDesc child;
        try {
          child = catalog.getTableDesc(childId);
        } catch (UndefinedTableException e) {
          throw new InvalidPolicyException(table.getName(),
              "partition " + childId + " cannot be resolved: " + e.getMessage());
        }
        DistributionPolicy childPolicy = child.getPolicy();
        // fails early if any partition can never be routed
        DistributionData.resolveHashTypes(child, childPolicy);
        if (!childPolicy.isEquivalent(rootData.getPolicy())) {
          equal = false;
        }
        for (int attr : childPolicy.getAttrs()) {
          childAttrs.set(attr);
        }
      }
      partitionPoliciesEqual = equal;

      if (partitionPoliciesEqual) {
        addNeededAttrs(rootData.getPolicy());
      } else {
        neededAttrs.or(childAttrs);
        Preconditions.checkArgument(partitionSelector != null,
            "Partitions of %s have their own distribution policies; a partition selector is required",
            table.getName());
      }
      for (int attr : partitionDesc.getPartitionKeyAttrs()) {
        neededAttrs.set(attr);
      }
    }
    this.policyCache = partitionPoliciesEqual ? null : new PartitionPolicyCache(catalog, context);

    if (LOG.isDebugEnabled()) {
      LOG.debug("Created a row router for " + table.getName() + " over " + context.getNumSegments()
          + " segments: policy=" + rootData.getPolicy()
          + (partitionDesc == null ? "" : ", partitions=" + partitionDesc.getChildRelationIds().size()
          + ", partition policies equal=" + partitionPoliciesEqual));
    }
  }

  private void addNeededAttrs(DistributionPolicy policy) {
    for (int attr : policy.getAttrs()) {
      neededAttrs.set(attr);
    }
  }

  /**
   * Hashes a row with the given distribution data.
   *
   * @param row a row of the relation, indexed by 0-based column id
   * @return the segment of the row
   */
  public int route(Tuple row, DistributionData data) throws NotHashableException {
    CdbHash cdbHash = data.getCdbHash();
    DistributionPolicy policy = data.getPolicy();

    cdbHash.init();
    if (policy.getNumAttrs() == 0) {
      cdbHash.hashNoKey();
    } else {
      for (int i = 0; i < policy.getNumAttrs(); i++) {
        Datum datum = row.asDatum(policy.getAttr(i) - 1);
        if (datum.isNull()) {
          cdbHash.hashNull();
        } else {
          cdbHash.hash(datum, data.getHashType(i));
        }
      }
    }
    return cdbHash.reduce();
  }

  /**
   * Routes a row of the relation, first choosing its leaf partition if the partitions have
   * their own policies.
   *
   * @return the segment of the row
   */
  public int routeRow(Tuple row) throws MosaicException {
    return route(row, getDistributionData(row));
  }

  /**
   * @return the distribution data a row is hashed with
   */
  public DistributionData getDistributionData(Tuple row) throws MosaicException {
    if (partitionPoliciesEqual) {
      return rootData;
    }
    int childId = partitionSelector.selectPartition(row);
    if (!partitionDesc.getChildRelationIds().contains(childId)) {
      throw new InvalidPolicyException(table.getName(), "relation " + childId + " is not one of its partitions");
    }
    return policyCache.resolve(childId);
  }

  /**
   * Verifies that a row loaded directly on a segment belongs there.
   *
   * @param row a row of the relation
   * @param localSegment the segment the row is loaded on
   * @throws DistributionKeyViolationException if the row belongs to another segment
   * @throws InvalidPolicyException if the partitions of the relation have their own policies
   */
  public void checkSegment(Tuple row, int localSegment) throws MosaicException {
    if (!context.isSegmentCheckEnabled() || !rootData.getPolicy().hasDistributionKey()) {
      return;
    }
    if (!partitionPoliciesEqual) {
      throw new InvalidPolicyException(table.getName(),
          "loading on segment is not supported when partitions have their own distribution policies");
    }

    int target = route(row, rootData);
    if (target != localSegment) {
      throw new DistributionKeyViolationException(localSegment, target);
    }
  }

  /**
   * @return the 1-based position of the last input column which has to be parsed to route a row
   *         read in schema order, or empty if no column has to be parsed
   */
  public OptionalInt lastNeededColumn() {
    return lastNeededColumn(null);
  }

  /**
   * @param inputAttrs 1-based attribute numbers of the input columns in input order, or null if
   *                   the input holds every column in schema order
   * @return the 1-based position in the input of the last column which has to be parsed to route
   *         a row, or empty if no column has to be parsed
   */
  public OptionalInt lastNeededColumn(int[] inputAttrs) {
    int last = 0;
    if (inputAttrs == null) {
      last = neededAttrs.length() - 1;
    } else {
      for (int i = 0; i < inputAttrs.length; i++) {
        if (neededAttrs.get(inputAttrs[i])) {
          last = i + 1;
        }
      }
    }
    return last > 0 ? OptionalInt.of(last) : OptionalInt.empty();
  }

  /**
   * @return true if the column is used by any distribution or partition key
   */
  public boolean isNeeded(int attrNum) {
    return neededAttrs.get(attrNum);
  }

  public boolean isPartitionPoliciesEqual() {
    return partitionPoliciesEqual;
  }

  public TableDesc getTableDesc() {
    return table;
  }

  public DistributionData getRootDistributionData() {
    return rootData;
  }

  @VisibleForTesting
  PartitionPolicyCache getPolicyCache() {
    return policyCache;
  }
}
