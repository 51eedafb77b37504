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

package org.mosaicdb.conf;

import com.google.common.base.Preconditions;
import org.apache.hadoop.conf.Configuration;
import org.mosaicdb.ConfigKey;

import java.util.HashMap;
import java.util.Map;

public class MosaicConf extends Configuration {
  private static final Map<String, ConfVars> vars = new HashMap<>();

  static {
    Configuration.addDefaultResource("mosaic-default.xml");
    Configuration.addDefaultResource("mosaic-site.xml");

    for (ConfVars confVars : ConfVars.values()) {
      vars.put(confVars.keyname(), confVars);
    }
  }

  public MosaicConf() {
    super();
  }

  public MosaicConf(Configuration conf) {
    super(conf);
  }

  public enum ConfVars implements ConfigKey {

    ///////////////////////////////////////////////////////////////////////////////////////
    // Cluster topology
    ///////////////////////////////////////////////////////////////////////////////////////

    // the number of primary segments data is spread over
    CLUSTER_SEGMENTS("mosaic.cluster.segments", 1),
    // the content id of this process, -1 on the dispatcher
    SEGMENT_ID("mosaic.segment.id", -1),

    ///////////////////////////////////////////////////////////////////////////////////////
    // Row router
    ///////////////////////////////////////////////////////////////////////////////////////

    // a negative seed draws the first round robin index at random
    ROUND_ROBIN_SEED("mosaic.router.round-robin.seed", -1L),

    ///////////////////////////////////////////////////////////////////////////////////////
    // COPY FROM
    ///////////////////////////////////////////////////////////////////////////////////////
    COPY_DELIMITER("mosaic.copy.delimiter", "|"),
    COPY_NULL("mosaic.copy.null", "\\N"),
    COPY_SEGMENT_CHECK_ENABLED("mosaic.copy.segment-check.enabled", true),
    ;

    public final String varname;
    public final String defaultVal;
    public final int defaultIntVal;
    public final long defaultLongVal;
    public final boolean defaultBoolVal;
    public final Class<?> valClass;

    ConfVars(String varname, String defaultVal) {
      this.varname = varname;
      this.valClass = String.class;
      this.defaultVal = defaultVal;
      this.defaultIntVal = -1;
      this.defaultLongVal = -1;
      this.defaultBoolVal = false;
    }

    ConfVars(String varname, int defaultIntVal) {
      this.varname = varname;
      this.valClass = Integer.class;
      this.defaultVal = Integer.toString(defaultIntVal);
      this.defaultIntVal = defaultIntVal;
      this.defaultLongVal = -1;
      this.defaultBoolVal = false;
    }

    ConfVars(String varname, long defaultLongVal) {
      this.varname = varname;
      this.valClass = Long.class;
      this.defaultVal = Long.toString(defaultLongVal);
      this.defaultIntVal = -1;
      this.defaultLongVal = defaultLongVal;
      this.defaultBoolVal = false;
    }

    ConfVars(String varname, boolean defaultBoolVal) {
      this.varname = varname;
      this.valClass = Boolean.class;
      this.defaultVal = Boolean.toString(defaultBoolVal);
      this.defaultIntVal = -1;
      this.defaultLongVal = -1;
      this.defaultBoolVal = defaultBoolVal;
    }

    @Override
    public String keyname() {
      return varname;
    }

    @Override
    public ConfigType type() {
      return ConfigType.SYSTEM;
    }

    @Override
    public Class<?> valueClass() {
      return valClass;
    }
  }

  public static ConfVars findVar(String keyname) {
    return vars.get(keyname);
  }

  public static int getIntVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Integer.class);
    return conf.getInt(var.varname, var.defaultIntVal);
  }

  public static void setIntVar(Configuration conf, ConfVars var, int val) {
    assert (var.valClass == Integer.class);
    conf.setInt(var.varname, val);
  }

  public int getIntVar(ConfVars var) {
    return getIntVar(this, var);
  }

  public void setIntVar(ConfVars var, int val) {
    setIntVar(this, var, val);
  }

  public static long getLongVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Long.class || var.valClass == Integer.class);
    if (var.valClass == Integer.class) {
      return conf.getInt(var.varname, var.defaultIntVal);
    } else {
      return conf.getLong(var.varname, var.defaultLongVal);
    }
  }

  public static void setLongVar(Configuration conf, ConfVars var, long val) {
    assert (var.valClass == Long.class);
    conf.setLong(var.varname, val);
  }

  public long getLongVar(ConfVars var) {
    return getLongVar(this, var);
  }

  public void setLongVar(ConfVars var, long val) {
    setLongVar(this, var, val);
  }

  public static boolean getBoolVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Boolean.class);
    return conf.getBoolean(var.varname, var.defaultBoolVal);
  }

  public static void setBoolVar(Configuration conf, ConfVars var, boolean val) {
    assert (var.valClass == Boolean.class);
    conf.setBoolean(var.varname, val);
  }

  public boolean getBoolVar(ConfVars var) {
    return getBoolVar(this, var);
  }

  public void setBoolVar(ConfVars var, boolean val) {
    setBoolVar(this, var, val);
  }

  public static String getVar(Configuration conf, ConfVars var) {
    return conf.get(var.varname, var.defaultVal);
  }

  public static void setVar(Configuration conf, ConfVars var, String val) {
    conf.set(var.varname, val);
  }

  public String getVar(ConfVars var) {
    return getVar(this, var);
  }

  public void setVar(ConfVars var, String val) {
    setVar(this, var, val);
  }

  /**
   * @return the number of segments rows are distributed over
   */
  public int getNumSegments() {
    int numSegments = getIntVar(ConfVars.CLUSTER_SEGMENTS);
    Preconditions.checkState(numSegments > 0,
        "%s must be positive: %s", ConfVars.CLUSTER_SEGMENTS.varname, numSegments);
    return numSegments;
  }
}
