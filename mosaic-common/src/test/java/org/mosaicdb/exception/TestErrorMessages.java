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

import org.junit.Test;

import static org.junit.Assert.*;

public class TestErrorMessages {

  @Test
  public final void testEveryCodeHasMessage() {
    for (ResultCode code : ResultCode.values()) {
      if (code != ResultCode.OK) {
        assertTrue(code.name(), ErrorMessages.MESSAGES.containsKey(code));
      }
    }
  }

  @Test
  public final void testGetMessage() {
    assertEquals("relation 'lineitem' does not exist",
        ErrorMessages.getMessage(ResultCode.UNDEFINED_TABLE, "lineitem"));
    assertEquals("value of distribution key doesn't belong to segment with ID 0, it belongs to segment with ID 3",
        ErrorMessages.getMessage(ResultCode.DISTRIBUTION_KEY_VIOLATION, "0", "3"));
  }

  @Test(expected = MosaicInternalError.class)
  public final void testArgumentMismatch() {
    ErrorMessages.getMessage(ResultCode.INVALID_POLICY, "t1");
  }

  @Test
  public final void testExceptionCodes() {
    DistributionKeyViolationException e = new DistributionKeyViolationException(1, 2);
    assertEquals(ResultCode.DISTRIBUTION_KEY_VIOLATION, e.getErrorCode());
    assertEquals(1, e.getLocalSegment());
    assertEquals(2, e.getTargetSegment());

    NotHashableException notHashable = new NotHashableException("point");
    assertEquals(ResultCode.NOT_HASHABLE, notHashable.getErrorCode());
    assertEquals("type point is not hashable", notHashable.getMessage());

    MosaicRuntimeException wrapped = new MosaicRuntimeException(new UndefinedTableException("t1"));
    assertEquals(ResultCode.UNDEFINED_TABLE, wrapped.getErrorCode());
    assertTrue(wrapped.getCause() instanceof UndefinedTableException);
  }
}
