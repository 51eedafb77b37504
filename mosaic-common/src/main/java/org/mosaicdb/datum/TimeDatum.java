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

import java.time.LocalTime;

public class TimeDatum extends Datum {
  private final long micros;

  public TimeDatum(long micros) {
    super(Type.TIME);
    this.micros = micros;
  }

  @Override
  public long asInt8() {
    return micros;
  }

  @Override
  public String asChars() {
    return LocalTime.ofNanoOfDay(micros * DateTimeConstants.NANOS_PER_USEC).toString();
  }

  @Override
  public int size() {
    return 8;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(micros);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TimeDatum && ((TimeDatum) obj).micros == micros;
  }
}
