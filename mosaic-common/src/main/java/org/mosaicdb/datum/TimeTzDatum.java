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

/**
 * Time of day with a zone offset. The zone is stored in seconds west of UTC, so
 * <code>+09:00</code> is <code>-32400</code>.
 */
public class TimeTzDatum extends Datum {
  private final long micros;
  private final int zone;

  public TimeTzDatum(long micros, int zone) {
    super(Type.TIMETZ);
    this.micros = micros;
    this.zone = zone;
  }

  public long getTime() {
    return micros;
  }

  public int getZone() {
    return zone;
  }

  @Override
  public String asChars() {
    int east = -zone;
    return LocalTime.ofNanoOfDay(micros * DateTimeConstants.NANOS_PER_USEC).toString()
        + (east >= 0 ? "+" : "-") + String.format("%02d:%02d", Math.abs(east) / 3600, (Math.abs(east) % 3600) / 60);
  }

  @Override
  public int size() {
    return 12;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(micros) * 31 + zone;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TimeTzDatum) {
      TimeTzDatum other = (TimeTzDatum) obj;
      return micros == other.micros && zone == other.zone;
    }
    return false;
  }
}
