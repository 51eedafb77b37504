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
 * Legacy <code>tinterval</code>: a status word and two <code>abstime</code> endpoints.
 * A status of 0 marks an invalid interval.
 */
public class TIntervalDatum extends Datum {
  public static final int T_INTERVAL_INVAL = 0;
  public static final int T_INTERVAL_VALID = 1;

  private final int status;
  private final int start;
  private final int end;

  public TIntervalDatum(int status, int start, int end) {
    super(Type.TINTERVAL);
    this.status = status;
    this.start = start;
    this.end = end;
  }

  public TIntervalDatum(int start, int end) {
    this(start == DateTimeConstants.INVALID_ABSTIME || end == DateTimeConstants.INVALID_ABSTIME ?
        T_INTERVAL_INVAL : T_INTERVAL_VALID, start, end);
  }

  public int getStatus() {
    return status;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public boolean isValid() {
    return status != T_INTERVAL_INVAL
        && start != DateTimeConstants.INVALID_ABSTIME
        && end != DateTimeConstants.INVALID_ABSTIME;
  }

  @Override
  public String asChars() {
    return "[\"" + new AbsTimeDatum(start).asChars() + "\" \"" + new AbsTimeDatum(end).asChars() + "\"]";
  }

  @Override
  public int size() {
    return 12;
  }

  @Override
  public int hashCode() {
    return (status * 31 + start) * 31 + end;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TIntervalDatum) {
      TIntervalDatum other = (TIntervalDatum) obj;
      return status == other.status && start == other.start && end == other.end;
    }
    return false;
  }
}
