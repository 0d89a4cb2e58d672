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
package org.apache.hadoop.cube.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw cube definition. A null fact means the cube is its own fact table; a
 * null aggregate list means no aggregates were declared at all. Measures may
 * list the functions their default aggregates are derived from.
 */
public class CubeSpec {
  private String name;
  private String fact;
  private List<String> dimensions = new ArrayList<String>();
  private List<String> measures = new ArrayList<String>();
  private Map<String, List<String>> measureAggregates =
      new LinkedHashMap<String, List<String>>();
  private List<String> details = new ArrayList<String>();
  private List<AggregateSpec> aggregates;
  private List<JoinSpec> joins = new ArrayList<JoinSpec>();
  private String key;
  private String label;
  private String description;
  private Map<String, String> info;

  public CubeSpec() {
  }

  public CubeSpec(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getFact() {
    return fact;
  }

  public void setFact(String fact) {
    this.fact = fact;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public void setDimensions(List<String> dimensions) {
    this.dimensions = dimensions;
  }

  public List<String> getMeasures() {
    return measures;
  }

  public void setMeasures(List<String> measures) {
    this.measures = measures;
  }

  /**
   * @return aggregate functions declared per measure, keyed by measure name
   */
  public Map<String, List<String>> getMeasureAggregates() {
    return measureAggregates;
  }

  public void setMeasureAggregates(Map<String, List<String>> measureAggregates) {
    this.measureAggregates = measureAggregates;
  }

  public void setMeasureAggregates(String measure, List<String> functions) {
    measureAggregates.put(measure, functions);
  }

  public List<String> getDetails() {
    return details;
  }

  public void setDetails(List<String> details) {
    this.details = details;
  }

  public List<AggregateSpec> getAggregates() {
    return aggregates;
  }

  public void setAggregates(List<AggregateSpec> aggregates) {
    this.aggregates = aggregates;
  }

  public List<JoinSpec> getJoins() {
    return joins;
  }

  public void setJoins(List<JoinSpec> joins) {
    this.joins = joins;
  }

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Map<String, String> getInfo() {
    return info;
  }

  public void setInfo(Map<String, String> info) {
    this.info = info;
  }

  @Override
  public String toString() {
    return name;
  }
}
