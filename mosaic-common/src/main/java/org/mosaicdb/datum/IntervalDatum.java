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

/**
 * An interval made of three independent fields: microseconds, days and months.
 */
public class IntervalDatum extends Datum {
  private final long time;
  private final int day;
  private final int month;

  public IntervalDatum(long time, int day, int month) {
    super(Type.INTERVAL);
    this.time = time;
    this.day = day;
    this.month = month;
  }

  public long getTime() {
    return time;
  }

  public int getDay() {
    return day;
  }

  public int getMonth() {
    return month;
  }

  @Override
  public String asChars() {
    StringBuilder sb = new StringBuilder();
    if (month != 0) {
      sb.append(month).append(" mons ");
    }
    if (day != 0) {
      sb.append(day).append(" days ");
    }
    sb.append(time / DateTimeConstants.USECS_PER_SEC).append(" secs");
    return sb.toString();
  }

  @Override
  public int size() {
    return 16;
  }

  @Override
  public int hashCode() {
    return (Long.hashCode(time) * 31 + day) * 31 + month;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof IntervalDatum) {
      IntervalDatum other = (IntervalDatum) obj;
      return time == other.time && day == other.day && month == other.month;
    }
    return false;
  }
}
