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

import org.mosaicdb.exception.UndefinedTableException;

/**
 * Read-only view of the relation metadata used while routing rows.
 */
public interface CatalogService {

  /**
   * Get a table description by relation id
   *
   * @param relationId relation id
   * @return a table description
   * @see TableDesc
   * @throws UndefinedTableException if the relation does not exist
   */
  TableDesc getTableDesc(int relationId) throws UndefinedTableException;

  /**
   * @return the distribution policy declared for a relation
   * @throws UndefinedTableException if the relation does not exist
   */
  DistributionPolicy getDistributionPolicy(int relationId) throws UndefinedTableException;

  /**
   * @return the partitioning of a relation, or null if it is not partitioned
   * @throws UndefinedTableException if the relation does not exist
   */
  PartitionDesc getPartitionDesc(int relationId) throws UndefinedTableException;

  boolean existsTable(int relationId);
}
