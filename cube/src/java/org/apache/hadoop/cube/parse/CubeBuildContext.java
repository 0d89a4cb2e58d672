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

import org.apache.hadoop.cube.metadata.AggregatePlan;
import org.apache.hadoop.cube.metadata.Cube;
import org.apache.hadoop.cube.metadata.Dimension;
import org.apache.hadoop.cube.metadata.JoinPlan;
import org.apache.hadoop.cube.schema.CubeSpec;

/**
 * State of one cube while it is being built. The resolvers fill it in
 * order; {@link #toCube()} turns the completed state into an immutable
 * {@link Cube}.
 */
public class CubeBuildContext {
  private final CubeSpec spec;
  private final DimensionRegistry registry;
  private final TableCatalog catalog;

  private String factTable;
  private final List<Dimension> dimensions = new ArrayList<Dimension>();
  private final List<String> measures = new ArrayList<String>();
  private final List<String> details = new ArrayList<String>();
  private JoinPlan joinPlan = JoinPlan.EMPTY;
  private AggregatePlan aggregatePlan;

  public CubeBuildContext(CubeSpec spec, DimensionRegistry registry,
      TableCatalog catalog) {
    this.spec = spec;
    this.registry = registry;
    this.catalog = catalog;
  }

  public String getCubeName() {
    return spec.getName();
  }

  public CubeSpec getSpec() {
    return spec;
  }

  public DimensionRegistry getRegistry() {
    return registry;
  }

  /**
   * @return catalog of physical tables, null when tables are not checked
   */
  public TableCatalog getCatalog() {
    return catalog;
  }

  public String getFactTable() {
    return factTable;
  }

  void setFactTable(String factTable) {
    this.factTable = factTable;
  }

  public List<Dimension> getDimensions() {
    return dimensions;
  }

  void addDimension(Dimension dimension) {
    dimensions.add(dimension);
  }

  public List<String> getMeasures() {
    return measures;
  }

  void addMeasure(String measure) {
    measures.add(measure);
  }

  public List<String> getDetails() {
    return details;
  }

  void addDetail(String detail) {
    details.add(detail);
  }

  public JoinPlan getJoinPlan() {
    return joinPlan;
  }

  void setJoinPlan(JoinPlan joinPlan) {
    this.joinPlan = joinPlan;
  }

  public AggregatePlan getAggregatePlan() {
    return aggregatePlan;
  }

  void setAggregatePlan(AggregatePlan aggregatePlan) {
    this.aggregatePlan = aggregatePlan;
  }

  Cube toCube() {
    if (factTable == null || aggregatePlan == null) {
      throw new IllegalStateException("Cube " + getCubeName()
          + " is not completely resolved");
    }
    return new Cube(spec.getName(), factTable, dimensions, measures, details,
        spec.getKey(), joinPlan, aggregatePlan, spec.getLabel(),
        spec.getDescription(), spec.getInfo());
  }
}
