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
import java.util.List;

/**
 * A planned aggregate of a cube. Either bound to a measure, or a row count
 * over the cube's fact rows after the row filtering joins are applied.
 */
public final class CubeAggregate implements Named {
  private final String name;
  private final AggregateFunction function;
  private final String measure;
  private final String label;
  private final List<String> rowFilteringJoins;

  public CubeAggregate(String name, AggregateFunction function, String measure,
      String label, List<String> rowFilteringJoins) {
    this.name = name;
    this.function = function;
    this.measure = measure;
    this.label = label;
    this.rowFilteringJoins = Collections.unmodifiableList(
        new ArrayList<String>(rowFilteringJoins));
  }

  @Override
  public String getName() {
    return name;
  }

  public AggregateFunction getFunction() {
    return function;
  }

  /**
   * @return bound measure, null for a row count
   */
  public String getMeasure() {
    return measure;
  }

  public String getLabel() {
    return label;
  }

  public boolean isRowCount() {
    return measure == null;
  }

  /**
   * Effective names of the joins that restrict the rows this aggregate is
   * computed over. Joins that keep every fact row are never listed.
   */
  public List<String> getRowFilteringJoins() {
    return rowFilteringJoins;
  }

  /**
   * Aggregate expression for a SQL consumer, e.g. {@code sum(facts.amount)}
   * or {@code count(1)}.
   */
  public String getExpression(String factAlias) {
    if (isRowCount()) {
      return function.getName() + "(1)";
    }
    String column = factAlias == null ? measure : factAlias + "." + measure;
    if (function.equals(AggregateFunction.COUNT_NONEMPTY)) {
      return "count(" + column + ")";
    }
    if (function.equals(AggregateFunction.COUNT_DISTINCT)) {
      return "count(distinct " + column + ")";
    }
    return function.getName() + "(" + column + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CubeAggregate)) {
      return false;
    }
    CubeAggregate other = (CubeAggregate) obj;
    if (!name.equals(other.name) || !function.equals(other.function)) {
      return false;
    }
    if (measure == null ? other.measure != null : !measure.equals(other.measure)) {
      return false;
    }
    if (label == null ? other.label != null : !label.equals(other.label)) {
      return false;
    }
    return rowFilteringJoins.equals(other.rowFilteringJoins);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + function.hashCode();
  }

  @Override
  public String toString() {
    return name + ":" + function + "(" + (measure == null ? "*" : measure) + ")";
  }
}
