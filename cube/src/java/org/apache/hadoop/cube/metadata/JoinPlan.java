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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

/**
 * Joins of a cube indexed by effective name, in declaration order. The same
 * physical table may appear several times under different effective names,
 * each entry keeping its own method.
 */
public final class JoinPlan {
  public static final JoinPlan EMPTY = new JoinPlan(new ArrayList<CubeJoin>());

  private final Map<String, CubeJoin> joins;

  /**
   * @param joins resolved joins, effective names must be unique
   */
  public JoinPlan(List<CubeJoin> joins) {
    Map<String, CubeJoin> joinMap = new LinkedHashMap<String, CubeJoin>();
    for (CubeJoin join : joins) {
      if (joinMap.put(join.getEffectiveName(), join) != null) {
        throw new IllegalArgumentException("Duplicate effective name "
            + join.getEffectiveName());
      }
    }
    this.joins = Collections.unmodifiableMap(joinMap);
  }

  public List<CubeJoin> getJoins() {
    return new ArrayList<CubeJoin>(joins.values());
  }

  public List<String> getEffectiveNames() {
    return new ArrayList<String>(joins.keySet());
  }

  public CubeJoin getJoin(String effectiveName) {
    return joins.get(effectiveName);
  }

  public boolean hasJoin(String effectiveName) {
    return joins.containsKey(effectiveName);
  }

  public List<CubeJoin> getJoinsForTable(String detailTable) {
    List<CubeJoin> result = new ArrayList<CubeJoin>();
    for (CubeJoin join : joins.values()) {
      if (join.getDetailTable().equals(detailTable)) {
        result.add(join);
      }
    }
    return result;
  }

  public List<CubeJoin> getJoinsByMethod(JoinMethod method) {
    List<CubeJoin> result = new ArrayList<CubeJoin>();
    for (CubeJoin join : joins.values()) {
      if (join.getMethod() == method) {
        result.add(join);
      }
    }
    return result;
  }

  /**
   * Effective names of the joins that restrict the set of fact rows.
   */
  public List<String> getRowFilteringJoins() {
    List<String> names = new ArrayList<String>();
    for (CubeJoin join : joins.values()) {
      if (join.getMethod().filtersFactRows()) {
        names.add(join.getEffectiveName());
      }
    }
    return names;
  }

  /**
   * @return true when one of the joins uses the master method, i.e. the cube
   * is meant to be referenced as a fact source by other cubes
   */
  public boolean isFactSource() {
    for (CubeJoin join : joins.values()) {
      if (join.getMethod().marksFactSource()) {
        return true;
      }
    }
    return false;
  }

  public int size() {
    return joins.size();
  }

  public boolean isEmpty() {
    return joins.isEmpty();
  }

  /**
   * Merged join clause of all joins, in declaration order.
   */
  public String getMergedJoinClause() {
    List<String> clauses = new ArrayList<String>();
    for (CubeJoin join : joins.values()) {
      clauses.add(join.getJoinClause());
    }
    return StringUtils.join(clauses, " ");
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof JoinPlan)) {
      return false;
    }
    return getJoins().equals(((JoinPlan) obj).getJoins());
  }

  @Override
  public int hashCode() {
    return joins.hashCode();
  }

  @Override
  public String toString() {
    return joins.values().toString();
  }
}
