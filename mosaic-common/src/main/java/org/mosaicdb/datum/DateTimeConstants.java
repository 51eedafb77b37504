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

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Dates and times count from the 2000-01-01 epoch. Timestamps and times are in microseconds.
 */
public class DateTimeConstants {
  public static final LocalDate POSTGRES_EPOCH_DATE = LocalDate.of(2000, 1, 1);
  public static final LocalDateTime POSTGRES_EPOCH = POSTGRES_EPOCH_DATE.atStartOfDay();

  public static final long USECS_PER_SEC = 1000000L;
  public static final long USECS_PER_DAY = 86400000000L;
  public static final long NANOS_PER_USEC = 1000L;

  /** reserved value of an invalid <code>abstime</code> or <code>reltime</code> */
  public static final int INVALID_ABSTIME = 0x7FFFFFFE;
  public static final int INVALID_RELTIME = 0x7FFFFFFE;

  private DateTimeConstants() {
  }
}
