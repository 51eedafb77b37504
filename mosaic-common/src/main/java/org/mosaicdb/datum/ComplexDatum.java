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

public class ComplexDatum extends Datum {
  private final double re;
  private final double im;

  public ComplexDatum(double re, double im) {
    super(Type.COMPLEX);
    this.re = re;
    this.im = im;
  }

  public double getReal() {
    return re;
  }

  public double getImaginary() {
    return im;
  }

  @Override
  public String asChars() {
    return re + (im < 0 ? " - " : " + ") + Math.abs(im) + "i";
  }

  @Override
  public int size() {
    return 16;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(re) * 31 + Double.hashCode(im);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof ComplexDatum) {
      ComplexDatum other = (ComplexDatum) obj;
      return Double.compare(re, other.re) == 0 && Double.compare(im, other.im) == 0;
    }
    return false;
  }
}
