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

package org.mosaicdb.storage;

import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.datum.TextDatum;
import org.mosaicdb.util.BytesUtils;

/**
 * Turns delimited text lines into {@link LazyTuple}s. Only the leading fields that are asked for
 * are split out of the line; the remaining bytes are left untouched.
 */
public class TextLineParser {
  private static final Log LOG = LogFactory.getLog(TextLineParser.class);

  public static final int ALL_COLUMNS = -1;

  private final Schema schema;
  private final byte[] delimiter;
  private final byte[] nullBytes;
  private final SerializerDeserializer serde;

  public TextLineParser(Schema schema, byte[] delimiter, byte[] nullBytes) {
    Preconditions.checkArgument(delimiter.length > 0, "empty delimiter");
    this.schema = schema;
    this.delimiter = delimiter;
    this.nullBytes = nullBytes;
    this.serde = new TextSerializerDeserializer(delimiter[0]);

    if (LOG.isDebugEnabled()) {
      LOG.debug("Parsing lines of " + schema.size() + " fields delimited by '"
          + new String(delimiter, TextDatum.DEFAULT_CHARSET) + "', null marker '"
          + new String(nullBytes, TextDatum.DEFAULT_CHARSET) + "'");
    }
  }

  /**
   * @param line one line without its line terminator
   * @param lineNo the line number, kept as the tuple offset
   * @param numColumns the number of leading fields to split, or {@link #ALL_COLUMNS}
   */
  public LazyTuple parse(byte[] line, long lineNo, int numColumns) {
    byte[][] fields;
    if (numColumns == ALL_COLUMNS) {
      fields = BytesUtils.splitPreserveAllTokens(line, delimiter, TextSerializerDeserializer.ESCAPE);
    } else {
      Preconditions.checkArgument(numColumns >= 0 && numColumns <= schema.size(),
          "%s columns requested from a relation of %s columns", numColumns, schema.size());
      fields = BytesUtils.splitPreserveAllTokens(line, delimiter, TextSerializerDeserializer.ESCAPE, numColumns);
    }
    return new LazyTuple(schema, fields, lineNo, nullBytes, serde);
  }

  public Schema getSchema() {
    return schema;
  }
}
