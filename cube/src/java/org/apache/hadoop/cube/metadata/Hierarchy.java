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

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * Ordered roll-up path through the levels of a dimension. Paths passed to
 * the navigation methods are lists of level member values, the first value
 * belonging to the first level.
 */
public final class Hierarchy implements Named {
  public static final String DEFAULT_HIERARCHY = "default";

  private final String name;
  private final String dimension;
  private final List<Level> levels;
  private final String label;

  public Hierarchy(String name, String dimension, List<Level> levels,
      String label) {
    if (levels == null || levels.isEmpty()) {
      throw new IllegalArgumentException("Hierarchy " + name
          + " must have at least one level");
    }
    this.name = name;
    this.dimension = dimension;
    this.levels = Collections.unmodifiableList(new ArrayList<Level>(levels));
    this.label = label;
  }

  @Override
  public String getName() {
    return name;
  }

  public String getDimension() {
    return dimension;
  }

  public List<Level> getLevels() {
    return levels;
  }

  public String getLabel() {
    return label;
  }

  public int size() {
    return levels.size();
  }

  public boolean contains(String levelName) {
    for (Level level : levels) {
      if (level.getName().equals(levelName)) {
        return true;
      }
    }
    return false;
  }

  public int levelIndex(String levelName) throws CubeModelException {
    for (int i = 0; i < levels.size(); i++) {
      if (levels.get(i).getName().equals(levelName)) {
        return i;
      }
    }
    throw new CubeModelException(ErrorMsg.UNKNOWN_LEVEL, dimension, "hierarchies",
        "hierarchy " + name, levelName);
  }

  /**
   * Levels needed to address a path of the given depth. With drilldown the
   * next level is included as well.
   */
  public List<Level> levelsForDepth(int depth, boolean drilldown)
      throws CubeModelException {
    int extend = drilldown ? 1 : 0;
    if (depth < 0 || depth + extend > levels.size()) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_LEVEL, dimension, "hierarchies",
          "hierarchy " + name, "#" + (depth + extend));
    }
    return levels.subList(0, depth + extend);
  }

  public List<Level> levelsForPath(List<String> path, boolean drilldown)
      throws CubeModelException {
    return levelsForDepth(path == null ? 0 : path.size(), drilldown);
  }

  /**
   * @return level after the given one, the first level for null, or null
   * when the given level is the last one
   */
  public Level nextLevel(String levelName) throws CubeModelException {
    if (levelName == null) {
      return levels.get(0);
    }
    int index = levelIndex(levelName);
    if (index + 1 >= levels.size()) {
      return null;
    }
    return levels.get(index + 1);
  }

  public Level previousLevel(String levelName) throws CubeModelException {
    if (levelName == null) {
      return null;
    }
    int index = levelIndex(levelName);
    if (index == 0) {
      return null;
    }
    return levels.get(index - 1);
  }

  public boolean isLast(String levelName) {
    return levels.get(levels.size() - 1).getName().equals(levelName);
  }

  /**
   * Rolls the path up to the given level, or by one level when level is
   * null. Rolling up to a level deeper than the path fails.
   */
  public List<String> rollup(List<String> path, String levelName)
      throws CubeModelException {
    int last;
    if (levelName != null) {
      last = levelIndex(levelName) + 1;
      if (last > path.size()) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_LEVEL, dimension,
            "hierarchies", "path " + path, levelName);
      }
    } else if (path.isEmpty()) {
      return new ArrayList<String>();
    } else {
      last = path.size() - 1;
    }
    return new ArrayList<String>(path.subList(0, last));
  }

  /**
   * @return true when no further drill down is possible from the path
   */
  public boolean isBasePath(List<String> path) {
    return path != null && path.size() == levels.size();
  }

  public List<String> getKeyAttributes() {
    List<String> keys = new ArrayList<String>();
    for (Level level : levels) {
      keys.add(level.getKey());
    }
    return keys;
  }

  public List<String> getAllAttributes() {
    List<String> attributes = new ArrayList<String>();
    for (Level level : levels) {
      attributes.addAll(level.getAttributes());
    }
    return attributes;
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + levels.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Hierarchy)) {
      return false;
    }
    Hierarchy other = (Hierarchy) obj;
    if (!name.equals(other.name) || !levels.equals(other.levels)) {
      return false;
    }
    return label == null ? other.label == null : label.equals(other.label);
  }

  @Override
  public String toString() {
    return name;
  }
}
