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

package org.mosaicdb.exception;

import com.google.common.collect.Maps;
import org.mosaicdb.util.Pair;

import java.util.Map;

import static org.mosaicdb.exception.ResultCode.*;

public class ErrorMessages {
  public static final Map<ResultCode, Pair<String, Integer>> MESSAGES;

  static {
    MESSAGES = Maps.newHashMap();

    // General Errors
    ADD_MESSAGE(INTERNAL_ERROR, "internal error: %s", 1);
    ADD_MESSAGE(NOT_IMPLEMENTED, "not implemented feature: %s", 1);
    ADD_MESSAGE(FEATURE_NOT_SUPPORTED, "unsupported feature: %s", 1);

    // Catalog
    ADD_MESSAGE(UNDEFINED_TABLE, "relation '%s' does not exist", 1);
    ADD_MESSAGE(UNDEFINED_COLUMN, "column '%s' does not exist", 1);
    ADD_MESSAGE(DUPLICATE_TABLE, "table '%s' already exists", 1);

    // Data types and values
    ADD_MESSAGE(INVALID_VALUE_FOR_CAST, "%s value cannot be casted to %s", 2);
    ADD_MESSAGE(UNSUPPORTED_DATATYPE, "unsupported data type: '%s'", 1);
    ADD_MESSAGE(INVALID_DATATYPE, "invalid data type: %s", 1);
    ADD_MESSAGE(NOT_HASHABLE, "type %s is not hashable", 1);

    // Distribution
    ADD_MESSAGE(INVALID_POLICY, "invalid distribution policy for relation '%s': %s", 2);
    ADD_MESSAGE(DISTRIBUTION_KEY_VIOLATION,
        "value of distribution key doesn't belong to segment with ID %s, it belongs to segment with ID %s", 2);
  }

  private static void ADD_MESSAGE(ResultCode code, String msgFormat) {
    ADD_MESSAGE(code, msgFormat, 0);
  }

  private static void ADD_MESSAGE(ResultCode code, String msgFormat, int argNum) {
    MESSAGES.put(code, new Pair<String, Integer>(msgFormat, argNum));
  }

  public static String concat(String[] args) {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (String s : args) {
      if (!first) {
        sb.append(",");
      }
      sb.append(s);
      first = false;
    }
    return sb.toString();
  }

  public static String getMessage(ResultCode code, String...args) {
    if (!MESSAGES.containsKey(code)) {
      throw new MosaicInternalError("no error message for " + code);
    } else {

      Pair<String, Integer> messageFormat = MESSAGES.get(code);

      if (messageFormat.getSecond() == args.length) { // if arguments are matched

        if (args.length == 0) { // no argument
          return messageFormat.getFirst();
        } else {
          return String.format(messageFormat.getFirst(), (Object[]) args);
        }

      } else {
        throw new MosaicInternalError(
            "Error message arguments are invalid: code=" + code.name() + ", args=" + concat(args));
      }
    }
  }
}
