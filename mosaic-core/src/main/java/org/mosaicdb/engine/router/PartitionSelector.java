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

import org.mosaicdb.exception.MosaicException;
import org.mosaicdb.storage.Tuple;

/**
 * Chooses the leaf partition of a row from its partition key columns.
 */
public interface PartitionSelector {

  /**
   * @param row a row of the root relation; only its partition key columns need to be present
   * @return the relation id of the leaf partition the row belongs to
   * @throws MosaicException if no partition accepts the row
   */
  int selectPartition(Tuple row) throws MosaicException;
}
