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

public class DateDatum extends Datum {
  private final int days;

  public DateDatum(int days) {
    super(Type.DATE);
    this.days = days;
  }

  @Override
  public int asInt4() {
    return days;
  }

  @Override
  public long asInt8() {
    return days;
  }

  @Override
  public String asChars() {
    return DateTimeConstants.POSTGRES_EPOCH_DATE.plusDays(days).toString();
  }

  @Override
  public int size() {
    return 4;
  }

  @Override
  public int hashCode() {
    return days;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DateDatum && ((DateDatum) obj).days == days;
  }
}
