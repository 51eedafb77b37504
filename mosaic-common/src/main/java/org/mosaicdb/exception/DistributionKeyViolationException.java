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

/**
 * A row loaded directly on a segment hashes to another segment.
 */
public class DistributionKeyViolationException extends MosaicException {
  private static final long serialVersionUID = -6328157431004257615L;

  private final int localSegment;
  private final int targetSegment;

  public DistributionKeyViolationException(int localSegment, int targetSegment) {
    super(ResultCode.DISTRIBUTION_KEY_VIOLATION, Integer.toString(localSegment), Integer.toString(targetSegment));
    this.localSegment = localSegment;
    this.targetSegment = targetSegment;
  }

  public int getLocalSegment() {
    return localSegment;
  }

  public int getTargetSegment() {
    return targetSegment;
  }
}
