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

package org.mosaicdb.util;

import java.util.Arrays;

/**
 * Extra utilities for bytes
 */
public class BytesUtils {
  public static final int NO_ESCAPE = Integer.MIN_VALUE;

  /**
   * Splits a delimited line into all of its fields.
   *
   * @param line the line to split
   * @param delimiter the ascii delimiter
   * @param escape the escape byte, or {@link #NO_ESCAPE}
   * @return the fields; an empty line yields a single empty field
   */
  public static byte[][] splitPreserveAllTokens(byte[] line, byte[] delimiter, int escape) {
    int numFields = countFields(line, 0, line.length, delimiter, escape);
    return splitPreserveAllTokens(line, delimiter, escape, numFields);
  }

  /**
   * Splits only the leading <code>numColumns</code> fields of a delimited line. Scanning stops
   * as soon as the last wanted field has been found; the rest of the line is never looked at.
   *
   * @param line the line to split
   * @param delimiter the ascii delimiter
   * @param escape the escape byte, or {@link #NO_ESCAPE}
   * @param numColumns number of leading fields to be retrieved
   * @return an array of exactly <code>numColumns</code> fields. Fields missing from a short line are
   *         <code>null</code>.
   */
  public static byte[][] splitPreserveAllTokens(byte[] line, byte[] delimiter, int escape, int numColumns) {
    int[][] indices = split(line, 0, line.length, delimiter, escape, new int[numColumns][]);
    byte[][] result = new byte[numColumns][];
    for (int i = 0; i < numColumns; i++) {
      int[] index = indices[i];
      result[i] = index == null ? null : Arrays.copyOfRange(line, index[0], index[1]);
    }
    return result;
  }

  /**
   * Finds the start and end offsets of up to <code>indices.length</code> leading fields.
   *
   * @return the given <code>indices</code>; slots of fields not present are left null
   */
  public static int[][] split(byte[] str, int offset, int length, byte[] separator, int[][] indices) {
    return split(str, offset, length, separator, NO_ESCAPE, indices);
  }

  /**
   * Same as {@link #split(byte[], int, int, byte[], int[][])}, but a byte following
   * <code>escape</code> never starts a delimiter.
   *
   * @param escape the escape byte, or {@link #NO_ESCAPE}
   */
  public static int[][] split(byte[] str, int offset, int length, byte[] separator, int escape, int[][] indices) {
    if (indices.length == 0) {
      return indices;
    }
    final int limit = offset + length;

    int start = offset;
    int colIndex = 0;
    for (int index = offset; index < limit;) {
      if (str[index] == escape) {
        index += 2;
      } else if (onDelimiter(str, index, limit, separator)) {
        indices[colIndex++] = new int[] {start, index};
        if (colIndex >= indices.length) {
          return indices;
        }
        index += separator.length;
        start = index;
      } else {
        index++;
      }
    }
    indices[colIndex] = new int[]{start, limit};
    return indices;
  }

  public static int countFields(byte[] str, int offset, int length, byte[] separator, int escape) {
    final int limit = offset + length;
    int count = 1;
    for (int index = offset; index < limit;) {
      if (str[index] == escape) {
        index += 2;
      } else if (onDelimiter(str, index, limit, separator)) {
        count++;
        index += separator.length;
      } else {
        index++;
      }
    }
    return count;
  }

  private static boolean onDelimiter(byte[] input, int offset, int limit, byte[] delimiter) {
    for (int i = 0; i < delimiter.length; i++) {
      if (offset + i >= limit || input[offset + i] != delimiter[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the length of <code>bytes</code> once trailing blanks are removed, never less than one
   *         when <code>length</code> is positive
   */
  public static int lengthIgnoringTrailingBlanks(byte[] bytes, int offset, int length) {
    int len = length;
    while (len > 1 && bytes[offset + len - 1] == ' ') {
      len--;
    }
    return len;
  }
}
