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
 * Planned aggregates of a cube, by name and in declaration order.
 */
public final class AggregatePlan {
  private final Map<String, CubeAggregate> aggregates;

  public AggregatePlan(List<CubeAggregate> aggregates) {
    Map<String, CubeAggregate> aggregateMap = new LinkedHashMap<String, CubeAggregate>();
    for (CubeAggregate aggregate : aggregates) {
      aggregateMap.put(aggregate.getName(), aggregate);
    }
    this.aggregates = Collections.unmodifiableMap(aggregateMap);
  }

  public List<CubeAggregate> getAggregates() {
    return new ArrayList<CubeAggregate>(aggregates.values());
  }

  public List<String> getAggregateNames() {
    return new ArrayList<String>(aggregates.keySet());
  }

  public CubeAggregate getAggregate(String name) {
    return aggregates.get(name);
  }

  public List<CubeAggregate> getRowCountAggregates() {
    List<CubeAggregate> result = new ArrayList<CubeAggregate>();
    for (CubeAggregate aggregate : aggregates.values()) {
      if (aggregate.isRowCount()) {
        result.add(aggregate);
      }
    }
    return result;
  }

  public List<CubeAggregate> getAggregatesForMeasure(String measure) {
    List<CubeAggregate> result = new ArrayList<CubeAggregate>();
    for (CubeAggregate aggregate : aggregates.values()) {
      if (measure.equals(aggregate.getMeasure())) {
        result.add(aggregate);
      }
    }
    return result;
  }

  public int size() {
    return aggregates.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AggregatePlan)) {
      return false;
    }
    return getAggregates().equals(((AggregatePlan) obj).getAggregates());
  }

  @Override
  public int hashCode() {
    return aggregates.hashCode();
  }

  @Override
  public String toString() {
    return aggregates.values().toString();
  }
}
