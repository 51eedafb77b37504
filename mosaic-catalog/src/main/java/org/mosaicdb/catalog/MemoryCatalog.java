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

import com.google.common.collect.Maps;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.exception.DuplicateTableException;
import org.mosaicdb.exception.UndefinedTableException;

import java.util.Map;

/**
 * A {@link CatalogService} that keeps all relations in memory.
 */
public class MemoryCatalog implements CatalogService {
  private static final Log LOG = LogFactory.getLog(MemoryCatalog.class);

  private final Map<Integer, TableDesc> tables = Maps.newHashMap();

  public void createTable(TableDesc desc) throws DuplicateTableException {
    synchronized (tables) {
      if (tables.containsKey(desc.getRelationId())) {
        throw new DuplicateTableException(desc.getName());
      }
      tables.put(desc.getRelationId(), desc);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Created table " + desc);
    }
  }

  public void dropTable(int relationId) throws UndefinedTableException {
    synchronized (tables) {
      if (tables.remove(relationId) == null) {
        throw new UndefinedTableException(relationId);
      }
    }
  }

  @Override
  public boolean existsTable(int relationId) {
    synchronized (tables) {
      return tables.containsKey(relationId);
    }
  }

  @Override
  public TableDesc getTableDesc(int relationId) throws UndefinedTableException {
    TableDesc desc;
    synchronized (tables) {
      desc = tables.get(relationId);
    }
    if (desc == null) {
      throw new UndefinedTableException(relationId);
    }
    return desc;
  }

  @Override
  public DistributionPolicy getDistributionPolicy(int relationId) throws UndefinedTableException {
    return getTableDesc(relationId).getPolicy();
  }

  @Override
  public PartitionDesc getPartitionDesc(int relationId) throws UndefinedTableException {
    return getTableDesc(relationId).getPartitionDesc();
  }
}
