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

package org.mosaicdb.datum;

import org.mosaicdb.common.MosaicDataTypes.Type;

import java.time.Instant;

/**
 * Legacy <code>abstime</code>: seconds since 1970-01-01 in 32 bits.
 */
public class AbsTimeDatum extends Datum {
  private final int seconds;

  public AbsTimeDatum(int seconds) {
    super(Type.ABSTIME);
    this.seconds = seconds;
  }

  public boolean isValid() {
    return seconds != DateTimeConstants.INVALID_ABSTIME;
  }

  @Override
  public int asInt4() {
    return seconds;
  }

  @Override
  public String asChars() {
    return isValid() ? Instant.ofEpochSecond(seconds).toString() : "invalid";
  }

  @Override
  public int size() {
    return 4;
  }

  @Override
  public int hashCode() {
    return seconds;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof AbsTimeDatum && ((AbsTimeDatum) obj).seconds == seconds;
  }
}
