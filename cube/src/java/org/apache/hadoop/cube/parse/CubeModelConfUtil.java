/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.hadoop.cube.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.conf.Configuration;

public class CubeModelConfUtil {
  public static final String ISOLATE_INVALID_CUBES = "cube.model.isolate.invalid.cubes";
  public static final String DERIVE_DEFAULT_AGGREGATES =
      "cube.model.derive.default.aggregates";
  public static final String EXTRA_AGGREGATE_FUNCTIONS =
      "cube.model.aggregate.functions.extra";
  public static final String DEFAULT_JOIN_METHOD = "cube.model.join.default.method";
  public static final String CHECK_MASTER_TABLES = "cube.model.join.check.master.tables";

  public static final boolean DEFAULT_ISOLATE_INVALID_CUBES = true;
  public static final boolean DEFAULT_DERIVE_DEFAULT_AGGREGATES = true;
  public static final String DEFAULT_JOIN_METHOD_VALUE = "match";
  public static final boolean DEFAULT_CHECK_MASTER_TABLES = false;

  private CubeModelConfUtil() {
  }

  public static List<String> getStringList(Configuration conf, String keyName) {
    String str = conf.get(keyName);
    List<String> list = new ArrayList<String>();
    if (StringUtils.isBlank(str)) {
      return list;
    }
    for (String value : StringUtils.split(str.toLowerCase(Locale.ENGLISH), ",")) {
      if (StringUtils.isNotBlank(value)) {
        list.add(value.trim());
      }
    }
    return list;
  }
}
