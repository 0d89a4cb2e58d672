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

import java.util.List;
import java.util.Map;

/**
 * Raw dimension definition as declared in a schema document.
 *
 * Fields left null are absent from the declaration. For a templated
 * dimension an absent field is taken from the template, so an empty level
 * list and a null level list are not the same thing.
 */
public class DimensionSpec {
  private String name;
  private String template;
  private List<LevelSpec> levels;
  private List<HierarchySpec> hierarchies;
  private String defaultHierarchyName;
  private String label;
  private String description;
  private Map<String, String> info;

  public DimensionSpec() {
  }

  public DimensionSpec(String name) {
    this.name = name;
  }

  public DimensionSpec(String name, String template) {
    this.name = name;
    this.template = template;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getTemplate() {
    return template;
  }

  public void setTemplate(String template) {
    this.template = template;
  }

  public List<LevelSpec> getLevels() {
    return levels;
  }

  public void setLevels(List<LevelSpec> levels) {
    this.levels = levels;
  }

  public List<HierarchySpec> getHierarchies() {
    return hierarchies;
  }

  public void setHierarchies(List<HierarchySpec> hierarchies) {
    this.hierarchies = hierarchies;
  }

  public String getDefaultHierarchyName() {
    return defaultHierarchyName;
  }

  public void setDefaultHierarchyName(String defaultHierarchyName) {
    this.defaultHierarchyName = defaultHierarchyName;
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
    return name + (template == null ? "" : "<" + template + ">");
  }
}
