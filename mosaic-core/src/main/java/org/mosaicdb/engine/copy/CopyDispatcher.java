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

package org.mosaicdb.engine.copy;

import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.mosaicdb.catalog.Column;
import org.mosaicdb.catalog.Schema;
import org.mosaicdb.catalog.TableDesc;
import org.mosaicdb.conf.MosaicConf;
import org.mosaicdb.conf.MosaicConf.ConfVars;
import org.mosaicdb.datum.DatumFactory;
import org.mosaicdb.datum.TextDatum;
import org.mosaicdb.engine.router.RowRouter;
import org.mosaicdb.exception.MosaicException;
import org.mosaicdb.storage.LazyTuple;
import org.mosaicdb.storage.TextLineParser;
import org.mosaicdb.storage.VTuple;

import java.io.IOException;
import java.util.Iterator;
import java.util.OptionalInt;

/**
 * Reads the delimited text lines of a COPY FROM and forwards each line, unchanged, to the segment
 * that owns the row.
 *
 * <p>Only the fields needed to route a row are parsed: a line is split up to the last needed
 * field and only needed fields are converted to values. When the rows are also inserted
 * locally (<code>fullParse</code>), every field is parsed; a field the router does not need and
 * whose type has no text input is kept as text.
 *
 * <p>When {@link ConfVars#SEGMENT_ID} is set the dispatcher loads rows on that segment instead:
 * every line goes to the local segment after checking that it belongs there. The number of fields
 * of a line is not validated here.
 */
public class CopyDispatcher {
  private static final Log LOG = LogFactory.getLog(CopyDispatcher.class);

  private final RowRouter router;
  private final TableDesc table;
  private final int[] inputAttrs;
  /** false for input fields whose type has no text input; such fields are kept as text */
  private final boolean[] convertible;
  private final SegmentSink sink;
  private final TextLineParser parser;
  private final boolean fullParse;
  private final int localSegment;
  /** the number of leading fields split from each line, or {@link TextLineParser#ALL_COLUMNS} */
  private final int numColumnsToSplit;

  private final long[] rowsPerSegment;
  private long lineNo = 0;

  /**
   * @param router the router of the target relation
   * @param conf the delimiter, the null marker and the local segment are read from it
   * @param inputAttrs 1-based attribute numbers of the input fields in input order, or null if
   *                   every column is given in schema order
   * @param sink where lines are sent
   * @param fullParse true if every field has to be parsed
   */
  public CopyDispatcher(RowRouter router, MosaicConf conf, int[] inputAttrs, SegmentSink sink,
                        boolean fullParse) {
    this.router = router;
    this.table = router.getTableDesc();
    this.sink = sink;
    this.localSegment = conf.getIntVar(ConfVars.SEGMENT_ID);
    this.fullParse = fullParse || localSegment >= 0;

    Schema schema = table.getSchema();
    if (inputAttrs == null) {
      inputAttrs = new int[schema.size()];
      for (int i = 0; i < inputAttrs.length; i++) {
        inputAttrs[i] = i + 1;
      }
    }
    Schema inputSchema = new Schema();
    this.convertible = new boolean[inputAttrs.length];
    for (int i = 0; i < inputAttrs.length; i++) {
      int attr = inputAttrs[i];
      Preconditions.checkArgument(attr >= 1 && attr <= schema.size(),
          "attribute number %s is out of range 1..%s", attr, schema.size());
      Column column = schema.getColumnByAttrNum(attr);
      inputSchema.addColumn(column);
      convertible[i] = DatumFactory.hasTextInput(column.getTypeDesc().resolveHashType());
    }
    this.inputAttrs = inputAttrs;

    byte[] delimiter = conf.getVar(ConfVars.COPY_DELIMITER).getBytes(TextDatum.DEFAULT_CHARSET);
    byte[] nullBytes = conf.getVar(ConfVars.COPY_NULL).getBytes(TextDatum.DEFAULT_CHARSET);
    this.parser = new TextLineParser(inputSchema, delimiter, nullBytes);

    if (this.fullParse) {
      numColumnsToSplit = TextLineParser.ALL_COLUMNS;
    } else {
      OptionalInt lastNeeded = router.lastNeededColumn(inputAttrs);
      numColumnsToSplit = lastNeeded.isPresent() ? lastNeeded.getAsInt() : 0;
    }
    this.rowsPerSegment = new long[router.getRootDistributionData().getCdbHash().getNumSegments()];

    if (LOG.isDebugEnabled()) {
      LOG.debug("COPY " + table.getName() + ": " + (this.fullParse ? "all" : numColumnsToSplit)
          + " of " + inputAttrs.length + " input fields are parsed"
          + (localSegment >= 0 ? ", loading on segment " + localSegment : ""));
    }
  }

  /**
   * Routes one line and sends it to its segment.
   *
   * @param line one line without its line terminator
   * @return the segment the line was sent to
   */
  public int dispatch(byte[] line) throws MosaicException, IOException {
    lineNo++;
    LazyTuple fields = parser.parse(line, lineNo, numColumnsToSplit);

    VTuple row = new VTuple(table.getSchema().size());
    row.setOffset(lineNo);
    for (int i = 0; i < inputAttrs.length; i++) {
      int attr = inputAttrs[i];
      if (router.isNeeded(attr)) {
        row.put(attr - 1, fields.asDatum(i));
      } else if (fullParse) {
        row.put(attr - 1, convertible[i] ? fields.asDatum(i) : fields.asTextDatum(i));
      }
    }

    int segment;
    if (localSegment >= 0) {
      router.checkSegment(row, localSegment);
      segment = localSegment;
    } else {
      segment = router.routeRow(row);
    }

    sink.send(segment, line);
    rowsPerSegment[segment]++;
    return segment;
  }

  /**
   * Dispatches every line.
   *
   * @return the number of lines dispatched
   */
  public long dispatchAll(Iterator<byte[]> lines) throws MosaicException, IOException {
    long count = 0;
    while (lines.hasNext()) {
      dispatch(lines.next());
      count++;
    }
    return count;
  }

  /**
   * Logs the number of rows sent to each segment.
   */
  public void finish() {
    if (LOG.isInfoEnabled()) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < rowsPerSegment.length; i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(i).append('=').append(rowsPerSegment[i]);
      }
      LOG.info("COPY " + table.getName() + ": " + getTotalRows() + " rows dispatched (" + sb + ")");
    }
  }

  public long[] getRowsPerSegment() {
    return rowsPerSegment.clone();
  }

  public long getTotalRows() {
    long total = 0;
    for (long rows : rowsPerSegment) {
      total += rows;
    }
    return total;
  }

  public int getNumColumnsToSplit() {
    return numColumnsToSplit;
  }

  public boolean isFullParse() {
    return fullParse;
  }
}
