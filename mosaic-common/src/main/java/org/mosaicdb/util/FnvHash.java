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

package org.mosaicdb.util;

/**
 * 32 bit FNV-1 hash (multiply, then xor) as described at
 * http://www.isthe.com/chongo/tech/comp/fnv/index.html
 *
 * Note that this is FNV-1, not FNV-1a. Changing the order of the two steps changes every
 * hash value and therefore the placement of every stored row.
 */
public class FnvHash {
  public static final int FNV1_32_INIT = 0x811c9dc5;
  public static final int FNV_32_PRIME = 0x01000193;

  public static int hash(byte[] input) {
    return hash(input, 0, input.length, FNV1_32_INIT);
  }

  /**
   * Continues a running hash over <code>len</code> bytes of <code>data</code>.
   */
  public static int hash(byte[] data, int offset, int len, int hval) {
    final int end = offset + len;
    for (int i = offset; i < end; i++) {
      hval *= FNV_32_PRIME;
      hval ^= (data[i] & 0xff);
    }
    return hval;
  }
}
