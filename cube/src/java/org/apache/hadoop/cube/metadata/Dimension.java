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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * A resolved dimension. Instances are created by the dimension registry
 * once the template, if any, has been applied, and are never mutated
 * afterwards.
 */
public final class Dimension implements Named {
  private final String name;
  private final String template;
  private final Map<String, Level> levels;
  private final Map<String, Hierarchy> hierarchies;
  private final String defaultHierarchyName;
  private final String label;
  private final String description;
  private final Map<String, String> info;

  public Dimension(String name, String template, List<Level> levels,
      List<Hierarchy> hierarchies, String defaultHierarchyName, String label,
      String description, Map<String, String> info) {
    if (name == null) {
      throw new NullPointerException("Dimension name cannot be null");
    }
    this.name = name;
    this.template = template;
    Map<String, Level> levelMap = new LinkedHashMap<String, Level>();
    for (Level level : levels) {
      levelMap.put(level.getName(), level);
    }
    this.levels = Collections.unmodifiableMap(levelMap);
    Map<String, Hierarchy> hierarchyMap = new LinkedHashMap<String, Hierarchy>();
    for (Hierarchy hierarchy : hierarchies) {
      hierarchyMap.put(hierarchy.getName(), hierarchy);
    }
    this.hierarchies = Collections.unmodifiableMap(hierarchyMap);
    this.defaultHierarchyName = defaultHierarchyName;
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

  /**
   * @return name of the dimension this one was derived from, null if none
   */
  public String getTemplate() {
    return template;
  }

  public List<Level> getLevels() {
    return new ArrayList<Level>(levels.values());
  }

  public List<String> getLevelNames() {
    return new ArrayList<String>(levels.keySet());
  }

  public Level getLevel(String levelName) throws CubeModelException {
    Level level = levels.get(levelName);
    if (level == null) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_LEVEL, name, "levels",
          "dimension " + name, levelName);
    }
    return level;
  }

  public Collection<Hierarchy> getHierarchies() {
    return hierarchies.values();
  }

  public String getDefaultHierarchyName() {
    return defaultHierarchyName;
  }

  /**
   * Get the default hierarchy: the one named by default_hierarchy_name, else
   * the one named {@value Hierarchy#DEFAULT_HIERARCHY}, else the only one.
   */
  public Hierarchy getHierarchy() throws CubeModelException {
    if (defaultHierarchyName != null) {
      return getHierarchy(defaultHierarchyName);
    }
    Hierarchy hierarchy = hierarchies.get(Hierarchy.DEFAULT_HIERARCHY);
    if (hierarchy == null && hierarchies.size() == 1) {
      hierarchy = hierarchies.values().iterator().next();
    }
    if (hierarchy == null) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_HIERARCHY, name,
          "default_hierarchy_name", name, Hierarchy.DEFAULT_HIERARCHY);
    }
    return hierarchy;
  }

  public Hierarchy getHierarchy(String hierarchyName) throws CubeModelException {
    Hierarchy hierarchy = hierarchies.get(hierarchyName);
    if (hierarchy == null) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_HIERARCHY, name,
          "hierarchies", name, hierarchyName);
    }
    return hierarchy;
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

  public boolean isFlat() {
    return levels.size() == 1;
  }

  public boolean hasDetails() {
    for (Level level : levels.values()) {
      if (level.hasDetails()) {
        return true;
      }
    }
    return false;
  }

  public List<String> getKeyAttributes() {
    List<String> keys = new ArrayList<String>();
    for (Level level : levels.values()) {
      keys.add(level.getKey());
    }
    return keys;
  }

  public List<String> getAllAttributes() {
    List<String> attributes = new ArrayList<String>();
    for (Level level : levels.values()) {
      attributes.addAll(level.getAttributes());
    }
    return attributes;
  }

  /**
   * Full reference of an attribute of this dimension. A flat dimension
   * without details is referenced by its name alone.
   */
  public String getAttributeRef(String attribute) {
    if (isFlat() && !hasDetails()) {
      return name;
    }
    return name + "." + attribute;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + levels.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Dimension other = (Dimension) obj;
    if (!name.equals(other.name)) {
      return false;
    }
    if (template == null ? other.template != null : !template.equals(other.template)) {
      return false;
    }
    if (!getLevels().equals(other.getLevels())) {
      return false;
    }
    if (!new ArrayList<Hierarchy>(hierarchies.values()).equals(
        new ArrayList<Hierarchy>(other.hierarchies.values()))) {
      return false;
    }
    if (defaultHierarchyName == null) {
      if (other.defaultHierarchyName != null) {
        return false;
      }
    } else if (!defaultHierarchyName.equals(other.defaultHierarchyName)) {
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
  public String toString() {
    return name + ":" + levels.keySet();
  }
}
