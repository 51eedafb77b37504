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

import com.google.common.base.Joiner;
import com.google.common.primitives.UnsignedInts;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class OidVectorDatum extends Datum {
  private final int[] oids;

  public OidVectorDatum(int[] oids) {
    super(Type.OIDVECTOR);
    this.oids = oids;
  }

  public int[] getOids() {
    return oids;
  }

  @Override
  public String asChars() {
    List<String> strings = new ArrayList<>(oids.length);
    for (int oid : oids) {
      strings.add(UnsignedInts.toString(oid));
    }
    return Joiner.on(' ').join(strings);
  }

  @Override
  public int size() {
    return oids.length * 4;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(oids);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof OidVectorDatum && Arrays.equals(oids, ((OidVectorDatum) obj).oids);
  }
}
