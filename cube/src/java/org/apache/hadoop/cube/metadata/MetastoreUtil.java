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
package org.apache.hadoop.cube.metadata;

import java.util.Collection;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

public class MetastoreUtil {
  public static final String AGGREGATE_REF_SEPARATOR = "_";

  private MetastoreUtil() {
  }

  /**
   * Reference of an aggregate derived from a measure, e.g. amount_sum.
   */
  public static String getAggregateRef(String measure, String function) {
    return measure + AGGREGATE_REF_SEPARATOR + function;
  }

  /**
   * Split an aggregate reference created by
   * {@link #getAggregateRef(String, String)} into measure and function.
   */
  public static String[] splitAggregateRef(String ref) throws CubeModelException {
    int sep = ref.lastIndexOf(AGGREGATE_REF_SEPARATOR);
    if (sep == -1 || sep >= ref.length() - 1) {
      String meaning = sep == -1 ? ref + "_sum" : ref + "sum";
      throw new CubeModelException(ErrorMsg.INVALID_AGGREGATE_REFERENCE, ref,
          "aggregates", ref, meaning);
    }
    return new String[] { ref.substring(0, sep), ref.substring(sep + 1) };
  }

  public static String getNamedStr(Collection<? extends Named> set) {
    if (set == null || set.isEmpty()) {
      return "";
    }
    StringBuilder valueStr = new StringBuilder();
    for (Named named : set) {
      if (valueStr.length() > 0) {
        valueStr.append(",");
      }
      valueStr.append(named.getName());
    }
    return valueStr.toString();
  }
}
