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

package org.mosaicdb.exception;

import org.mosaicdb.common.MosaicDataTypes.Type;

/**
 * A distribution key column has a type without a hash encoding.
 */
public class NotHashableException extends MosaicException {
  private static final long serialVersionUID = 4175935238149826117L;

  public NotHashableException(Type type) {
    super(ResultCode.NOT_HASHABLE, type.name() + " (oid " + type.getOid() + ")");
  }

  public NotHashableException(String typeName) {
    super(ResultCode.NOT_HASHABLE, typeName);
  }
}
