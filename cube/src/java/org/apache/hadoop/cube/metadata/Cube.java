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

/**
 * A resolved, immutable cube. This is what a query executor consumes: the
 * fact table, the bound dimensions, the measure names, the join plan and the
 * aggregate plan.
 */
public final class Cube implements Named {
  private final String name;
  private final String factTable;
  private final Map<String, Dimension> dimensions;
  private final List<String> measures;
  private final List<String> details;
  private final String key;
  private final JoinPlan joinPlan;
  private final AggregatePlan aggregatePlan;
  private final String label;
  private final String description;
  private final Map<String, String> info;

  public Cube(String name, String factTable, List<Dimension> dimensions,
      List<String> measures, List<String> details, String key,
      JoinPlan joinPlan, AggregatePlan aggregatePlan, String label,
      String description, Map<String, String> info) {
    this.name = name;
    this.factTable = factTable;
    Map<String, Dimension> dimMap = new LinkedHashMap<String, Dimension>();
    for (Dimension dim : dimensions) {
      dimMap.put(dim.getName(), dim);
    }
    this.dimensions = Collections.unmodifiableMap(dimMap);
    this.measures = Collections.unmodifiableList(new ArrayList<String>(measures));
    this.details = Collections.unmodifiableList(new ArrayList<String>(details));
    this.key = key;
    this.joinPlan = joinPlan;
    this.aggregatePlan = aggregatePlan;
    this.label = label;
    this.description = description;
    Map<String, String> infoCopy = new LinkedHashMap<String, String>();
    if (info != null) {
      infoCopy.putAll(info);
    }
    this.info = Collections.unmodifiableMap(infoCopy);
  }

  @Override
  public String getName() {
    return name;
  }

  public String getFactTable() {
    return factTable;
  }

  /**
   * @return true when the cube is its own fact table
   */
  public boolean isSelfFact() {
    return name.equals(factTable);
  }

  public List<Dimension> getDimensions() {
    return new ArrayList<Dimension>(dimensions.values());
  }

  public List<String> getDimensionNames() {
    return new ArrayList<String>(dimensions.keySet());
  }

  public Dimension getDimensionByName(String dimension) {
    return dimensions.get(dimension);
  }

  public List<String> getMeasures() {
    return measures;
  }

  public boolean hasMeasure(String measure) {
    return measures.contains(measure);
  }

  public List<String> getDetails() {
    return details;
  }

  /**
   * @return fact key column, null when the backend default applies
   */
  public String getKey() {
    return key;
  }

  public JoinPlan getJoinPlan() {
    return joinPlan;
  }

  public AggregatePlan getAggregatePlan() {
    return aggregatePlan;
  }

  public String getLabel() {
    return label;
  }

  public String getDescription() {
    return description;
  }

  public Map<String, String> getInfo() {
    return info;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Cube other = (Cube) obj;
    if (!name.equals(other.name) || !factTable.equals(other.factTable)) {
      return false;
    }
    if (!getDimensions().equals(other.getDimensions())) {
      return false;
    }
    if (!measures.equals(other.measures) || !details.equals(other.details)) {
      return false;
    }
    if (key == null ? other.key != null : !key.equals(other.key)) {
      return false;
    }
    if (!joinPlan.equals(other.joinPlan)
        || !aggregatePlan.equals(other.aggregatePlan)) {
      return false;
    }
    if (label == null ? other.label != null : !label.equals(other.label)) {
      return false;
    }
    if (description == null ? other.description != null
        : !description.equals(other.description)) {
      return false;
    }
    return info.equals(other.info);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + factTable.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return name;
  }
}
