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

import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;
import org.mosaicdb.common.MosaicDataTypes.Type;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * <code>inet</code> and <code>cidr</code>: an address family, a netmask length and the address.
 */
public class InetDatum extends Datum {
  public static final byte PGSQL_AF_INET = 2;
  public static final byte PGSQL_AF_INET6 = 3;

  private final byte family;
  private final byte bits;
  private final byte[] address;

  public InetDatum(Type type, byte family, byte bits, byte[] address) {
    super(type);
    Preconditions.checkArgument(type == Type.INET || type == Type.CIDR, "Not a network type: %s", type);
    int expected = addressSize(family);
    Preconditions.checkArgument(expected < 0 || address.length == expected,
        "%s bytes given for an address of family %s, which has %s", address.length, family, expected);
    this.family = family;
    this.bits = bits;
    this.address = address;
  }

  public InetDatum(Type type, InetAddress address, int bits) {
    this(type, address instanceof Inet4Address ? PGSQL_AF_INET : PGSQL_AF_INET6, (byte) bits,
        address.getAddress());
  }

  public boolean isCidr() {
    return type == Type.CIDR;
  }

  public byte getFamily() {
    return family;
  }

  public byte getBits() {
    return bits;
  }

  public byte[] getAddress() {
    return address;
  }

  /**
   * @return the number of address bytes for the family, or -1 for an unknown family
   */
  public static int addressSize(byte family) {
    switch (family) {
      case PGSQL_AF_INET:
        return 4;
      case PGSQL_AF_INET6:
        return 16;
      default:
        return -1;
    }
  }

  @Override
  public byte[] asByteArray() {
    return address;
  }

  @Override
  public String asChars() {
    int maxBits = family == PGSQL_AF_INET ? 32 : 128;
    String host;
    try {
      host = InetAddresses.toAddrString(InetAddress.getByAddress(address));
    } catch (UnknownHostException e) {
      host = "?";
    }
    return (bits & 0xff) == maxBits && !isCidr() ? host : host + "/" + (bits & 0xff);
  }

  @Override
  public int size() {
    return 2 + address.length;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(address) * 31 + bits;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof InetDatum) {
      InetDatum other = (InetDatum) obj;
      return type == other.type && family == other.family && bits == other.bits
          && Arrays.equals(address, other.address);
    }
    return false;
  }
}
