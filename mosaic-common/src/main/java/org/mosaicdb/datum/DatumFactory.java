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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.InetAddresses;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.mosaicdb.common.MosaicDataTypes.Type;
import org.mosaicdb.exception.MosaicRuntimeException;
import org.mosaicdb.exception.ResultCode;
import org.mosaicdb.exception.UnsupportedDataTypeException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DatumFactory {

  private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendLiteral('T').optionalEnd()
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart().appendOffset("+HH:mm", "Z").optionalEnd()
      .optionalStart().appendOffset("+HH", "Z").optionalEnd()
      .toFormatter();

  private static final DateTimeFormatter TIME_TZ_FORMAT = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendOffset("+HH:mm", "Z").optionalEnd()
      .optionalStart().appendOffset("+HH", "Z").optionalEnd()
      .toFormatter();

  private static final Pattern INTERVAL_TIME = Pattern.compile("([+-]?)(\\d+):(\\d+)(?::(\\d+(?:\\.\\d+)?))?");
  private static final Pattern TINTERVAL_FORMAT = Pattern.compile("\\[\\s*\"([^\"]*)\"\\s*\"([^\"]*)\"\\s*\\]");
  private static final Pattern TID_FORMAT = Pattern.compile("\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");
  private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private static final BigDecimal USECS_PER_SEC = BigDecimal.valueOf(DateTimeConstants.USECS_PER_SEC);
  private static final BigDecimal USECS_PER_DAY = BigDecimal.valueOf(DateTimeConstants.USECS_PER_DAY);
  private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);

  /** interval units: months per unit for month based units, microseconds per unit otherwise */
  private static final Map<String, BigDecimal> MONTH_UNITS = ImmutableMap.<String, BigDecimal>builder()
      .put("mon", BigDecimal.ONE).put("mons", BigDecimal.ONE)
      .put("month", BigDecimal.ONE).put("months", BigDecimal.ONE)
      .put("y", BigDecimal.valueOf(12)).put("yr", BigDecimal.valueOf(12)).put("yrs", BigDecimal.valueOf(12))
      .put("year", BigDecimal.valueOf(12)).put("years", BigDecimal.valueOf(12))
      .put("decade", BigDecimal.valueOf(120)).put("decades", BigDecimal.valueOf(120))
      .put("century", BigDecimal.valueOf(1200)).put("centuries", BigDecimal.valueOf(1200))
      .put("millennium", BigDecimal.valueOf(12000)).put("millennia", BigDecimal.valueOf(12000))
      .build();
  private static final Map<String, BigDecimal> DAY_UNITS = ImmutableMap.<String, BigDecimal>builder()
      .put("d", BigDecimal.ONE).put("day", BigDecimal.ONE).put("days", BigDecimal.ONE)
      .put("w", BigDecimal.valueOf(7)).put("week", BigDecimal.valueOf(7)).put("weeks", BigDecimal.valueOf(7))
      .build();
  private static final Map<String, BigDecimal> TIME_UNITS = ImmutableMap.<String, BigDecimal>builder()
      .put("us", BigDecimal.ONE).put("usec", BigDecimal.ONE).put("usecs", BigDecimal.ONE)
      .put("microsecond", BigDecimal.ONE).put("microseconds", BigDecimal.ONE)
      .put("ms", BigDecimal.valueOf(1000L)).put("msec", BigDecimal.valueOf(1000L))
      .put("msecs", BigDecimal.valueOf(1000L)).put("millisecond", BigDecimal.valueOf(1000L))
      .put("milliseconds", BigDecimal.valueOf(1000L))
      .put("s", USECS_PER_SEC).put("sec", USECS_PER_SEC).put("secs", USECS_PER_SEC)
      .put("second", USECS_PER_SEC).put("seconds", USECS_PER_SEC)
      .put("m", BigDecimal.valueOf(60000000L)).put("min", BigDecimal.valueOf(60000000L))
      .put("mins", BigDecimal.valueOf(60000000L)).put("minute", BigDecimal.valueOf(60000000L))
      .put("minutes", BigDecimal.valueOf(60000000L))
      .put("h", BigDecimal.valueOf(3600000000L)).put("hr", BigDecimal.valueOf(3600000000L))
      .put("hrs", BigDecimal.valueOf(3600000000L)).put("hour", BigDecimal.valueOf(3600000000L))
      .put("hours", BigDecimal.valueOf(3600000000L))
      .build();

  public static Class<? extends Datum> getDatumClass(Type type) {
    switch (type) {
      case BOOL:
        return BooleanDatum.class;
      case CHAR:
        return CharDatum.class;
      case INT2:
        return Int2Datum.class;
      case INT4:
        return Int4Datum.class;
      case INT8:
        return Int8Datum.class;
      case FLOAT4:
        return Float4Datum.class;
      case FLOAT8:
        return Float8Datum.class;
      case NUMERIC:
        return NumericDatum.class;
      case TEXT:
      case VARCHAR:
      case BPCHAR:
      case NAME:
        return TextDatum.class;
      case BYTEA:
        return BlobDatum.class;
      case OID:
      case REGPROC:
      case REGPROCEDURE:
      case REGOPER:
      case REGOPERATOR:
      case REGCLASS:
      case REGTYPE:
      case ANYENUM:
        return OidDatum.class;
      case TID:
        return TidDatum.class;
      case TIMESTAMP:
      case TIMESTAMPTZ:
        return TimestampDatum.class;
      case DATE:
        return DateDatum.class;
      case TIME:
        return TimeDatum.class;
      case TIMETZ:
        return TimeTzDatum.class;
      case INTERVAL:
        return IntervalDatum.class;
      case ABSTIME:
        return AbsTimeDatum.class;
      case RELTIME:
        return RelTimeDatum.class;
      case TINTERVAL:
        return TIntervalDatum.class;
      case INET:
      case CIDR:
        return InetDatum.class;
      case MACADDR:
        return MacAddrDatum.class;
      case BIT:
      case VARBIT:
        return BitDatum.class;
      case ANYARRAY:
        return ArrayDatum.class;
      case OIDVECTOR:
        return OidVectorDatum.class;
      case CASH:
        return CashDatum.class;
      case UUID:
        return UuidDatum.class;
      case COMPLEX:
        return ComplexDatum.class;
      case NULL_TYPE:
        return NullDatum.class;
      default:
        throw new MosaicRuntimeException(new UnsupportedDataTypeException(type.name()));
    }
  }

  /**
   * Parses the text input form of a value.
   *
   * @throws MosaicRuntimeException if the type has no text input routine here, or the text is
   *         not a valid value of the type
   */
  public static Datum createFromString(Type type, String value) {
    try {
      switch (type) {
        case BOOL:
          return createBool(value);
        case CHAR:
          return createChar(value);
        case INT2:
          return createInt2(Short.parseShort(value.trim()));
        case INT4:
          return createInt4(Integer.parseInt(value.trim()));
        case INT8:
          return createInt8(Long.parseLong(value.trim()));
        case FLOAT4:
          return createFloat4(Float.parseFloat(value.trim()));
        case FLOAT8:
          return createFloat8(Double.parseDouble(value.trim()));
        case NUMERIC:
          return createNumeric(value.trim());
        case TEXT:
        case VARCHAR:
        case BPCHAR:
        case NAME:
          return createText(type, value);
        case BYTEA:
          return createBlob(value);
        case OID:
        case REGPROC:
        case REGPROCEDURE:
        case REGOPER:
        case REGOPERATOR:
        case REGCLASS:
        case REGTYPE:
          return createOid(type, Integer.parseUnsignedInt(value.trim()));
        case DATE:
          return createDate(LocalDate.parse(value.trim()));
        case TIME:
          return createTime(LocalTime.parse(value.trim()));
        case TIMESTAMP:
        case TIMESTAMPTZ:
          return createTimestamp(type, value.trim());
        case INET:
        case CIDR:
          return createInet(type, value.trim());
        case MACADDR:
          return createMacAddr(value.trim());
        case BIT:
        case VARBIT:
          return createBit(type, value.trim());
        case UUID:
          return createUuid(UUID.fromString(value.trim()));
        case CASH:
          return createCash(value.trim());
        case TIMETZ:
          return createTimeTz(value.trim());
        case INTERVAL:
          return createInterval(value.trim());
        case ABSTIME:
          return createAbsTime(value.trim());
        case RELTIME:
          return createRelTime(value.trim());
        case TINTERVAL:
          return createTInterval(value.trim());
        case TID:
          return createTid(value.trim());
        case OIDVECTOR:
          return createOidVector(value);
        case COMPLEX:
          return createComplex(value);
        default:
          throw new MosaicRuntimeException(new UnsupportedDataTypeException(type.name()));
      }
    } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
      throw new MosaicRuntimeException(ResultCode.INVALID_DATATYPE,
          "invalid input syntax for " + type.name() + ": \"" + value + "\"");
    }
  }

  /**
   * @return true if {@link #createFromString(Type, String)} can parse values of the type
   */
  public static boolean hasTextInput(Type type) {
    switch (type) {
      case JSON:
      case XML:
      case POINT:
      case ANYENUM:
      case ANYARRAY:
      case USER_DEFINED:
      case NULL_TYPE:
        return false;
      default:
        return true;
    }
  }

  public static BooleanDatum createBool(boolean val) {
    return val ? BooleanDatum.TRUE : BooleanDatum.FALSE;
  }

  public static BooleanDatum createBool(String val) {
    String s = val.trim().toLowerCase();
    switch (s) {
      case "t": case "true": case "y": case "yes": case "on": case "1":
        return BooleanDatum.TRUE;
      case "f": case "false": case "n": case "no": case "off": case "0":
        return BooleanDatum.FALSE;
      default:
        throw new IllegalArgumentException(val);
    }
  }

  public static CharDatum createChar(byte val) {
    return new CharDatum(val);
  }

  public static CharDatum createChar(String val) {
    byte[] bytes = val.getBytes(TextDatum.DEFAULT_CHARSET);
    return new CharDatum(bytes.length == 0 ? 0 : bytes[0]);
  }

  public static Int2Datum createInt2(short val) {
    return new Int2Datum(val);
  }

  public static Int4Datum createInt4(int val) {
    return new Int4Datum(val);
  }

  public static Int8Datum createInt8(long val) {
    return new Int8Datum(val);
  }

  public static Float4Datum createFloat4(float val) {
    return new Float4Datum(val);
  }

  public static Float8Datum createFloat8(double val) {
    return new Float8Datum(val);
  }

  public static NumericDatum createNumeric(BigDecimal val) {
    return NumericDatum.of(val);
  }

  public static NumericDatum createNumeric(String val) {
    if (val.equalsIgnoreCase("NaN")) {
      return NumericDatum.nan();
    }
    return NumericDatum.of(new BigDecimal(val));
  }

  public static TextDatum createText(String val) {
    return new TextDatum(val);
  }

  public static TextDatum createText(Type type, String val) {
    return new TextDatum(type, val.getBytes(TextDatum.DEFAULT_CHARSET));
  }

  public static BlobDatum createBlob(byte[] val) {
    return new BlobDatum(val);
  }

  /**
   * Accepts the hex format (<code>\x0a0b</code>); anything else is taken as raw bytes.
   */
  public static BlobDatum createBlob(String val) {
    if (val.startsWith("\\x")) {
      try {
        return new BlobDatum(Hex.decodeHex(val.substring(2)));
      } catch (DecoderException e) {
        throw new IllegalArgumentException(e);
      }
    }
    return new BlobDatum(val.getBytes(TextDatum.DEFAULT_CHARSET));
  }

  public static OidDatum createOid(int oid) {
    return new OidDatum(oid);
  }

  public static OidDatum createOid(Type type, int oid) {
    return new OidDatum(type, oid);
  }

  /**
   * @param labelOid the oid of the enum label
   */
  public static OidDatum createEnum(int labelOid) {
    return new OidDatum(Type.ANYENUM, labelOid);
  }

  public static OidVectorDatum createOidVector(int... oids) {
    return new OidVectorDatum(oids);
  }

  /**
   * @param val space separated unsigned oids
   */
  public static OidVectorDatum createOidVector(String val) {
    List<String> tokens = WHITESPACE.splitToList(val);
    int[] oids = new int[tokens.size()];
    for (int i = 0; i < oids.length; i++) {
      oids[i] = Integer.parseUnsignedInt(tokens.get(i));
    }
    return new OidVectorDatum(oids);
  }

  public static TidDatum createTid(int blockNumber, short offset) {
    return new TidDatum(blockNumber, offset);
  }

  /**
   * @param val <code>(block,offset)</code>
   */
  public static TidDatum createTid(String val) {
    Matcher m = TID_FORMAT.matcher(val);
    if (!m.matches()) {
      throw new IllegalArgumentException(val);
    }
    int offset = Integer.parseInt(m.group(2));
    if (offset > 0xffff) {
      throw new IllegalArgumentException("tuple offset out of range: " + offset);
    }
    return new TidDatum(Integer.parseUnsignedInt(m.group(1)), (short) offset);
  }

  public static DateDatum createDate(LocalDate date) {
    return new DateDatum((int) ChronoUnit.DAYS.between(DateTimeConstants.POSTGRES_EPOCH_DATE, date));
  }

  public static TimeDatum createTime(LocalTime time) {
    return new TimeDatum(time.toNanoOfDay() / DateTimeConstants.NANOS_PER_USEC);
  }

  public static TimeTzDatum createTimeTz(LocalTime time, ZoneOffset offset) {
    return new TimeTzDatum(time.toNanoOfDay() / DateTimeConstants.NANOS_PER_USEC, -offset.getTotalSeconds());
  }

  /**
   * A time without a zone offset is taken as UTC.
   */
  public static TimeTzDatum createTimeTz(String val) {
    TemporalAccessor parsed = TIME_TZ_FORMAT.parse(val);
    ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS) ?
        ZoneOffset.from(parsed) : ZoneOffset.UTC;
    return createTimeTz(LocalTime.from(parsed), offset);
  }

  public static TimestampDatum createTimestamp(LocalDateTime dateTime) {
    return new TimestampDatum(Type.TIMESTAMP, ChronoUnit.MICROS.between(DateTimeConstants.POSTGRES_EPOCH, dateTime));
  }

  public static TimestampDatum createTimestampTz(OffsetDateTime dateTime) {
    LocalDateTime utc = dateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    return new TimestampDatum(Type.TIMESTAMPTZ, ChronoUnit.MICROS.between(DateTimeConstants.POSTGRES_EPOCH, utc));
  }

  private static TimestampDatum createTimestamp(Type type, String val) {
    TemporalAccessor parsed = TIMESTAMP_FORMAT.parse(val);
    LocalDateTime local = LocalDateTime.from(parsed);
    if (type == Type.TIMESTAMP) {
      return createTimestamp(local);
    }
    ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS) ?
        ZoneOffset.from(parsed) : ZoneOffset.UTC;
    return createTimestampTz(OffsetDateTime.of(local, offset));
  }

  public static IntervalDatum createInterval(long micros, int days, int months) {
    return new IntervalDatum(micros, days, months);
  }

  /**
   * Accepts the postgres style, such as <code>1 year 2 mons -3 days 04:05:06.5</code> or
   * <code>@ 3 hours ago</code>, and ISO 8601 durations such as <code>P1Y2M3DT4H</code>. A month
   * is 30 days when a fraction of it has to be carried down.
   */
  public static IntervalDatum createInterval(String val) {
    if (val.startsWith("P") || val.startsWith("-P")) {
      return createIsoInterval(val);
    }

    BigDecimal months = BigDecimal.ZERO;
    BigDecimal days = BigDecimal.ZERO;
    BigDecimal micros = BigDecimal.ZERO;
    boolean ago = false;

    List<String> tokens = WHITESPACE.splitToList(val.toLowerCase());
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("empty interval");
    }
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (token.equals("@")) {
        continue;
      }
      if (token.equals("ago") && i == tokens.size() - 1) {
        ago = true;
        continue;
      }
      Matcher time = INTERVAL_TIME.matcher(token);
      if (time.matches()) {
        BigDecimal seconds = BigDecimal.valueOf(Long.parseLong(time.group(2)) * 3600 + Long.parseLong(time.group(3)) * 60);
        if (time.group(4) != null) {
          seconds = seconds.add(new BigDecimal(time.group(4)));
        }
        BigDecimal value = seconds.multiply(USECS_PER_SEC);
        micros = time.group(1).equals("-") ? micros.subtract(value) : micros.add(value);
        continue;
      }

      BigDecimal number = new BigDecimal(token);
      String unit = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
      if (unit != null && MONTH_UNITS.containsKey(unit)) {
        months = months.add(number.multiply(MONTH_UNITS.get(unit)));
      } else if (unit != null && DAY_UNITS.containsKey(unit)) {
        days = days.add(number.multiply(DAY_UNITS.get(unit)));
      } else if (unit != null && TIME_UNITS.containsKey(unit)) {
        micros = micros.add(number.multiply(TIME_UNITS.get(unit)));
      } else {
        // a number without a unit is in seconds
        micros = micros.add(number.multiply(USECS_PER_SEC));
        continue;
      }
      i++;
    }

    // carry fractions down to the next field
    BigDecimal wholeMonths = months.setScale(0, RoundingMode.DOWN);
    days = days.add(months.subtract(wholeMonths).multiply(DAYS_PER_MONTH));
    BigDecimal wholeDays = days.setScale(0, RoundingMode.DOWN);
    micros = micros.add(days.subtract(wholeDays).multiply(USECS_PER_DAY));

    IntervalDatum interval = new IntervalDatum(micros.setScale(0, RoundingMode.HALF_EVEN).longValueExact(),
        wholeDays.intValueExact(), wholeMonths.intValueExact());
    if (ago) {
      interval = new IntervalDatum(-interval.getTime(), -interval.getDay(), -interval.getMonth());
    }
    return interval;
  }

  private static IntervalDatum createIsoInterval(String val) {
    boolean negative = val.startsWith("-");
    String body = negative ? val.substring(1) : val;
    int t = body.indexOf('T');
    String datePart = t < 0 ? body : body.substring(0, t);
    Period period = datePart.equals("P") ? Period.ZERO : Period.parse(datePart);
    Duration duration = t < 0 ? Duration.ZERO : Duration.parse("PT" + body.substring(t + 1));
    long micros = Math.addExact(Math.multiplyExact(duration.getSeconds(), DateTimeConstants.USECS_PER_SEC),
        duration.getNano() / DateTimeConstants.NANOS_PER_USEC);
    int days = period.getDays();
    int months = Math.toIntExact(period.toTotalMonths());
    if (negative) {
      return new IntervalDatum(-micros, -days, -months);
    }
    return new IntervalDatum(micros, days, months);
  }

  public static AbsTimeDatum createAbsTime(int seconds) {
    return new AbsTimeDatum(seconds);
  }

  /**
   * Accepts a timestamp, taken as UTC without a zone offset, <code>epoch</code> or
   * <code>invalid</code>.
   */
  public static AbsTimeDatum createAbsTime(String val) {
    if (val.equalsIgnoreCase("invalid")) {
      return new AbsTimeDatum(DateTimeConstants.INVALID_ABSTIME);
    }
    if (val.equalsIgnoreCase("epoch")) {
      return new AbsTimeDatum(0);
    }
    TemporalAccessor parsed = TIMESTAMP_FORMAT.parse(val);
    ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS) ?
        ZoneOffset.from(parsed) : ZoneOffset.UTC;
    long seconds = LocalDateTime.from(parsed).toEpochSecond(offset);
    if (seconds >= DateTimeConstants.INVALID_ABSTIME || seconds <= Integer.MIN_VALUE) {
      throw new ArithmeticException("abstime out of range: " + val);
    }
    return new AbsTimeDatum((int) seconds);
  }

  public static RelTimeDatum createRelTime(int seconds) {
    return new RelTimeDatum(seconds);
  }

  /**
   * Accepts the interval input forms or <code>invalid</code>. A month counts as 30 days.
   */
  public static RelTimeDatum createRelTime(String val) {
    if (val.equalsIgnoreCase("invalid")) {
      return new RelTimeDatum(DateTimeConstants.INVALID_RELTIME);
    }
    IntervalDatum interval = createInterval(val);
    long seconds = (interval.getMonth() * 30L + interval.getDay()) * 86400L
        + interval.getTime() / DateTimeConstants.USECS_PER_SEC;
    if (seconds >= DateTimeConstants.INVALID_RELTIME || seconds <= Integer.MIN_VALUE) {
      throw new ArithmeticException("reltime out of range: " + val);
    }
    return new RelTimeDatum((int) seconds);
  }

  public static TIntervalDatum createTInterval(int start, int end) {
    return new TIntervalDatum(start, end);
  }

  /**
   * @param val <code>["start" "end"]</code> where both ends are in the abstime input form
   */
  public static TIntervalDatum createTInterval(String val) {
    Matcher m = TINTERVAL_FORMAT.matcher(val);
    if (!m.matches()) {
      throw new IllegalArgumentException(val);
    }
    return new TIntervalDatum(createAbsTime(m.group(1).trim()).asInt4(), createAbsTime(m.group(2).trim()).asInt4());
  }

  public static InetDatum createInet(Type type, String val) {
    int slash = val.indexOf('/');
    InetAddress address = InetAddresses.forString(slash < 0 ? val : val.substring(0, slash));
    int maxBits = address instanceof Inet4Address ? 32 : 128;
    int bits = slash < 0 ? maxBits : Integer.parseInt(val.substring(slash + 1));
    if (bits < 0 || bits > maxBits) {
      throw new IllegalArgumentException("invalid netmask length: " + bits);
    }
    return new InetDatum(type, address, bits);
  }

  public static MacAddrDatum createMacAddr(String val) {
    String hex = val.replace(":", "").replace("-", "").replace(".", "");
    try {
      return new MacAddrDatum(Hex.decodeHex(hex));
    } catch (DecoderException e) {
      throw new IllegalArgumentException(e);
    }
  }

  public static BitDatum createBit(Type type, String val) {
    byte[] bits = new byte[(val.length() + 7) / 8];
    for (int i = 0; i < val.length(); i++) {
      char c = val.charAt(i);
      if (c == '1') {
        bits[i / 8] |= (byte) (0x80 >>> (i % 8));
      } else if (c != '0') {
        throw new IllegalArgumentException("\"" + c + "\" is not a valid binary digit");
      }
    }
    return new BitDatum(type, val.length(), bits);
  }

  public static ArrayDatum createArray(Type elementType, byte[] payload) {
    return new ArrayDatum(elementType, payload);
  }

  public static ComplexDatum createComplex(double re, double im) {
    return new ComplexDatum(re, im);
  }

  /**
   * Accepts <code>re</code>, <code>imi</code> and <code>re + imi</code> where the parts are
   * floating point numbers, as in <code>1.5 - 2i</code>.
   */
  public static ComplexDatum createComplex(String val) {
    String s = CharMatcher.whitespace().removeFrom(val);
    if (!s.endsWith("i")) {
      return new ComplexDatum(Double.parseDouble(s), 0);
    }
    s = s.substring(0, s.length() - 1);
    int split = -1;
    for (int i = s.length() - 1; i > 0; i--) {
      char c = s.charAt(i);
      char prev = s.charAt(i - 1);
      if ((c == '+' || c == '-') && prev != 'e' && prev != 'E') {
        split = i;
        break;
      }
    }
    if (split < 0) {
      return new ComplexDatum(0, parseImaginary(s));
    }
    return new ComplexDatum(Double.parseDouble(s.substring(0, split)), parseImaginary(s.substring(split)));
  }

  private static double parseImaginary(String s) {
    if (s.isEmpty() || s.equals("+")) {
      return 1;
    } else if (s.equals("-")) {
      return -1;
    }
    return Double.parseDouble(s);
  }

  public static CashDatum createCash(long cents) {
    return new CashDatum(cents);
  }

  public static CashDatum createCash(String val) {
    String digits = val.replace("$", "").replace(",", "");
    return new CashDatum(new BigDecimal(digits).movePointRight(2).longValueExact());
  }

  public static UuidDatum createUuid(UUID uuid) {
    return new UuidDatum(uuid);
  }
}
