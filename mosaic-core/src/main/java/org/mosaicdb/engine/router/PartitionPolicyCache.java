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

import com.google.common.collect.Maps;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.catalog.CatalogService;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.exception.InvalidPolicyException;
import org.mosaicdb.exception.NotHashableException;
import org.mosaicdb.exception.UndefinedTableException;

import java.util.Map;

/**
 * Distribution data of the leaf partitions of one partitioned relation, looked up from the
 * catalog the first time a row is routed into each partition.
 */
public class PartitionPolicyCache {
  private static final Log LOG = LogFactory.getLog(PartitionPolicyCache.class);

  private final CatalogService catalog;
  private final RouterContext context;
  private final Map<Integer, DistributionData> cache = Maps.newHashMap();

  public PartitionPolicyCache(CatalogService catalog, RouterContext context) {
    this.catalog = catalog;
    this.context = context;
  }

  /**
   * @param childRelationId the relation id of a leaf partition
   * @return the distribution data of the partition
   * @throws InvalidPolicyException if the partition does not exist or its policy is invalid
   */
  public DistributionData resolve(int childRelationId) throws InvalidPolicyException, NotHashableException {
    DistributionData data = cache.get(childRelationId);
    if (data != null) {
      return data;
    }

    TableDesc child;
    try {
      child = catalog.getTableDesc(childRelationId);
    } catch (UndefinedTableException e) {
      throw new InvalidPolicyException(Integer.toString(childRelationId),
          "distribution policy of the partition cannot be resolved: " + e.getMessage());
    }
    data = DistributionData.bind(child, context);
    cache.put(childRelationId, data);

    if (LOG.isDebugEnabled()) {
      LOG.debug("Bound distribution policy " + data.getPolicy() + " of partition " + child.getName());
    }
    return data;
  }

  public boolean contains(int childRelationId) {
    return cache.containsKey(childRelationId);
  }

  public int size() {
    return cache.size();
  }
}
