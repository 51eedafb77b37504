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

package org.mosaicdb.engine.hash;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Maps;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.datum.*;
import org.mosaicdb.exception.InvalidValueForCastException;
import org.mosaicdb.exception.MosaicRuntimeException;
import org.mosaicdb.exception.NotHashableException;
import org.mosaicdb.util.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Map;

/**
 * Encodes values into the canonical byte strings fed to the distribution hash. Values which are
 * equal in SQL produce identical bytes: every integer width is widened to 8 bytes, negative zero
 * becomes positive zero, trailing blanks of character strings are ignored, and numerics ignore
 * their display scale. Multi-byte quantities are written little-endian.
 *
 * <p>NULL of any type is encoded as the same 4 byte sentinel.
 *
 * <p>A hasher keeps scratch space and is not thread safe; each statement owns one.
 */
public class DatumHasher {
  private static final Log LOG = LogFactory.getLog(DatumHasher.class);

  /** the hash of NULL, for every type */
  public static final int NULL_VAL = 0xF0F0F0F1;
  /** the hash of numeric NaN */
  public static final int NAN_VAL = 0xE0E0E0E1;
  /** the hash of an invalid abstime, reltime or tinterval */
  public static final int INVALID_VAL = 0xD0D0D0D1;

  /** the buffer size of a <code>name</code>, including its terminating NUL */
  public static final int NAMEDATALEN = 64;

  private static final Map<Type, HashEncoding> ENCODINGS = Maps.newEnumMap(Type.class);

  static {
    for (Type type : Type.values()) {
      HashEncoding encoding = encodingOf(type);
      if (encoding != null) {
        ENCODINGS.put(type, encoding);
      }
    }
  }

  private final ByteBuffer scratch = ByteBuffer.allocate(NAMEDATALEN).order(ByteOrder.LITTLE_ENDIAN);
  private long badAddressFamilyCount = 0;

  /**
   * @return the encoding of a type, or null if values of the type cannot be hashed
   */
  private static HashEncoding encodingOf(Type type) {
    switch (type) {
      case INT2:
      case INT4:
      case INT8:
        return HashEncoding.INT8;
      case OID:
      case REGPROC:
      case REGPROCEDURE:
      case REGOPER:
      case REGOPERATOR:
      case REGCLASS:
      case REGTYPE:
      case ANYENUM:
        return HashEncoding.OID;
      case FLOAT4:
        return HashEncoding.FLOAT4;
      case FLOAT8:
        return HashEncoding.FLOAT8;
      case COMPLEX:
        return HashEncoding.COMPLEX;
      case NUMERIC:
        return HashEncoding.NUMERIC;
      case CHAR:
        return HashEncoding.CHAR;
      case BPCHAR:
      case TEXT:
      case VARCHAR:
        return HashEncoding.TEXT;
      case NAME:
        return HashEncoding.NAME;
      case BYTEA:
      case BIT:
      case VARBIT:
      case ANYARRAY:
        return HashEncoding.BYTES;
      case TID:
        return HashEncoding.TID;
      case TIMESTAMP:
      case TIMESTAMPTZ:
      case TIME:
        return HashEncoding.INT8_TIME;
      case DATE:
        return HashEncoding.DATE;
      case TIMETZ:
        return HashEncoding.TIMETZ;
      case INTERVAL:
        return HashEncoding.INTERVAL;
      case ABSTIME:
        return HashEncoding.ABSTIME;
      case RELTIME:
        return HashEncoding.RELTIME;
      case TINTERVAL:
        return HashEncoding.TINTERVAL;
      case INET:
      case CIDR:
        return HashEncoding.INET;
      case MACADDR:
        return HashEncoding.MACADDR;
      case BOOL:
        return HashEncoding.BOOL;
      case OIDVECTOR:
        return HashEncoding.OIDVECTOR;
      case CASH:
        return HashEncoding.CASH;
      case UUID:
        return HashEncoding.UUID;
      default:
        return null;
    }
  }

  /**
   * @return true if values of the type can be part of a distribution key
   */
  public static boolean isHashable(Type type) {
    return ENCODINGS.containsKey(type);
  }

  /**
   * Feeds the canonical bytes of a value to <code>fn</code>.
   *
   * @param datum the value; {@link NullDatum} is allowed
   * @param type the type the value is hashed as, already resolved from domains, enums and arrays
   * @throws NotHashableException if the type has no encoding
   */
  public void hashDatum(Datum datum, Type type, DatumHashFunction fn) throws NotHashableException {
    HashEncoding encoding = ENCODINGS.get(type);
    if (encoding == null) {
      throw new NotHashableException(type);
    }

    if (datum.isNull()) {
      hashNull(fn);
      return;
    }

    scratch.clear();
    switch (encoding) {
      case INT8:
      case INT8_TIME:
      case OID:
      case CASH:
        // OidDatum.asInt8() is zero-extended
        scratch.putLong(datum.asInt8());
        break;

      case FLOAT4: {
        float f = datum.asFloat4();
        if (f == 0.0f) {
          f = 0.0f; // -0.0 and 0.0 are equal
        }
        scratch.putFloat(f);
        break;
      }

      case FLOAT8:
        scratch.putDouble(normalizeZero(datum.asFloat8()));
        break;

      case COMPLEX: {
        ComplexDatum complex = cast(datum, ComplexDatum.class, type);
        scratch.putDouble(normalizeZero(complex.getReal()));
        scratch.putDouble(normalizeZero(complex.getImaginary()));
        break;
      }

      case NUMERIC: {
        NumericDatum numeric = cast(datum, NumericDatum.class, type);
        if (numeric.isNaN()) {
          scratch.putInt(NAN_VAL);
          break;
        }
        short[] digits = numeric.getDigits();
        if (digits.length * 2 > scratch.capacity()) {
          ByteBuffer buf = ByteBuffer.allocate(digits.length * 2).order(ByteOrder.LITTLE_ENDIAN);
          for (short digit : digits) {
            buf.putShort(digit);
          }
          fn.add(buf.array(), 0, buf.position());
          return;
        }
        for (short digit : digits) {
          scratch.putShort(digit);
        }
        break;
      }

      case CHAR:
      case BOOL:
        scratch.put(datum.asByte());
        break;

      case TEXT: {
        byte[] bytes = datum.asTextBytes();
        fn.add(bytes, 0, BytesUtils.lengthIgnoringTrailingBlanks(bytes, 0, bytes.length));
        return;
      }

      case NAME: {
        byte[] bytes = datum.asTextBytes();
        int len = nameLength(bytes);
        scratch.put(bytes, 0, len);
        while (scratch.hasRemaining()) {
          scratch.put((byte) 0);
        }
        fn.add(scratch.array(), 0, BytesUtils.lengthIgnoringTrailingBlanks(scratch.array(), 0, NAMEDATALEN));
        return;
      }

      case BYTES: {
        byte[] bytes = datum.asByteArray();
        fn.add(bytes, 0, bytes.length);
        return;
      }

      case MACADDR: {
        byte[] bytes = cast(datum, MacAddrDatum.class, type).asByteArray();
        fn.add(bytes, 0, MacAddrDatum.SIZE);
        return;
      }

      case UUID: {
        byte[] bytes = cast(datum, UuidDatum.class, type).asByteArray();
        fn.add(bytes, 0, bytes.length);
        return;
      }

      case TID: {
        TidDatum tid = cast(datum, TidDatum.class, type);
        scratch.putShort(tid.getBlockHi());
        scratch.putShort(tid.getBlockLo());
        scratch.putShort(tid.getOffset());
        break;
      }

      case DATE:
        scratch.putInt(datum.asInt4());
        break;

      case TIMETZ: {
        TimeTzDatum timetz = cast(datum, TimeTzDatum.class, type);
        scratch.putLong(timetz.getTime());
        scratch.putInt(timetz.getZone());
        break;
      }

      case INTERVAL: {
        // the month field is not part of the hash
        IntervalDatum interval = cast(datum, IntervalDatum.class, type);
        scratch.putLong(interval.getTime());
        scratch.putInt(interval.getDay());
        break;
      }

      case ABSTIME: {
        AbsTimeDatum abstime = cast(datum, AbsTimeDatum.class, type);
        scratch.putInt(abstime.isValid() ? abstime.asInt4() : INVALID_VAL);
        break;
      }

      case RELTIME: {
        RelTimeDatum reltime = cast(datum, RelTimeDatum.class, type);
        scratch.putInt(reltime.isValid() ? reltime.asInt4() : INVALID_VAL);
        break;
      }

      case TINTERVAL: {
        TIntervalDatum tinterval = cast(datum, TIntervalDatum.class, type);
        scratch.putInt(tinterval.isValid() ? tinterval.getEnd() - tinterval.getStart() : INVALID_VAL);
        break;
      }

      case INET: {
        InetDatum inet = cast(datum, InetDatum.class, type);
        int addressSize = InetDatum.addressSize(inet.getFamily());
        if (addressSize < 0) {
          badAddressFamilyCount++;
          LOG.warn("Hashing a network address of unknown family " + inet.getFamily()
              + " as an empty address");
          addressSize = 0;
        }
        scratch.put(inet.getFamily());
        scratch.put(inet.getBits());
        scratch.put(inet.getAddress(), 0, addressSize);
        break;
      }

      case OIDVECTOR: {
        int[] oids = cast(datum, OidVectorDatum.class, type).getOids();
        ByteBuffer buf = oids.length * 4 > scratch.capacity() ?
            ByteBuffer.allocate(oids.length * 4).order(ByteOrder.LITTLE_ENDIAN) : scratch;
        for (int oid : oids) {
          buf.putInt(oid);
        }
        fn.add(buf.array(), 0, buf.position());
        return;
      }

      default:
        throw new NotHashableException(type);
    }

    fn.add(scratch.array(), 0, scratch.position());
  }

  /**
   * Feeds the NULL sentinel to <code>fn</code>.
   */
  public void hashNull(DatumHashFunction fn) {
    scratch.clear();
    scratch.putInt(NULL_VAL);
    fn.add(scratch.array(), 0, scratch.position());
  }

  /**
   * @return the canonical bytes of a value
   */
  public byte[] encode(Datum datum, Type type) throws NotHashableException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    hashDatum(datum, type, new DatumHashFunction() {
      @Override
      public void add(byte[] buf, int off, int len) {
        out.write(buf, off, len);
      }
    });
    return out.toByteArray();
  }

  /**
   * @return how many network addresses of an unknown family have been hashed as empty addresses
   */
  public long badAddressFamilyCount() {
    return badAddressFamilyCount;
  }

  private static double normalizeZero(double d) {
    return d == 0.0 ? 0.0 : d;
  }

  /**
   * @return the number of leading bytes of a name that fit in a name buffer, cut at a UTF-8
   *         character boundary
   */
  @VisibleForTesting
  static int nameLength(byte[] bytes) {
    int len = Math.min(bytes.length, NAMEDATALEN - 1);
    if (len < bytes.length) {
      while (len > 0 && (bytes[len] & 0xC0) == 0x80) {
        len--;
      }
    }
    return len;
  }

  private static <T extends Datum> T cast(Datum datum, Class<T> clazz, Type type) {
    if (clazz.isInstance(datum)) {
      return clazz.cast(datum);
    }
    throw new MosaicRuntimeException(new InvalidValueForCastException(datum.type(), type));
  }
}
