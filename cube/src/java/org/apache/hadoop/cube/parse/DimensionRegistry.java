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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.Dimension;
import org.apache.hadoop.cube.metadata.Hierarchy;
import org.apache.hadoop.cube.metadata.Level;
import org.apache.hadoop.cube.schema.DimensionSpec;
import org.apache.hadoop.cube.schema.HierarchySpec;
import org.apache.hadoop.cube.schema.LevelSpec;

/**
 * Holds the canonical dimensions of one model build.
 *
 * <p>
 * Templates are resolved in two steps. The template's resolved dimension is
 * taken as base snapshot, then each field the spec declares replaces the
 * snapshot's field. Levels are never merged: declaring levels replaces all
 * inherited levels, and only a missing level list inherits them.
 * </p>
 *
 * <p>
 * A template must be registered before the dimensions using it. Resolved
 * dimensions are immutable, so cubes built from this registry keep their
 * snapshot whatever happens to the registry later.
 * </p>
 */
public class DimensionRegistry {
  private static final Log LOG = LogFactory.getLog(DimensionRegistry.class);

  private final Map<String, Dimension> dimensions = new LinkedHashMap<String, Dimension>();
  private boolean frozen = false;

  public Dimension register(DimensionSpec spec) throws CubeModelException {
    checkNotFrozen();
    String name = spec.getName();
    if (StringUtils.isBlank(name)) {
      throw new CubeModelException(ErrorMsg.BLANK_NAME, "dimension", "name",
          "dimension", "registry");
    }
    if (dimensions.containsKey(name)) {
      throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, name, "name",
          "dimension", name, "registry");
    }

    Dimension template = null;
    String templateName = spec.getTemplate();
    if (templateName != null) {
      if (templateName.equals(name)) {
        throw new CubeModelException(ErrorMsg.CYCLIC_TEMPLATE, name, "template",
            name, name + " -> " + name);
      }
      template = dimensions.get(templateName);
      if (template == null) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_TEMPLATE, name, "template",
            name, templateName);
      }
    }

    Dimension dimension = resolve(spec, template);
    dimensions.put(name, dimension);
    LOG.info("Registered dimension " + name
        + (templateName == null ? "" : " from template " + templateName)
        + " with levels " + dimension.getLevelNames());
    return dimension;
  }

  /**
   * Register a batch of dimensions in declaration order. Template cycles
   * among the batch are reported before anything is registered.
   */
  public List<Dimension> registerAll(List<DimensionSpec> specs)
      throws CubeModelException {
    checkTemplateCycles(specs);
    List<Dimension> registered = new ArrayList<Dimension>();
    for (DimensionSpec spec : specs) {
      registered.add(register(spec));
    }
    return registered;
  }

  public Dimension resolve(String name) throws CubeModelException {
    Dimension dimension = dimensions.get(name);
    if (dimension == null) {
      throw new CubeModelException(ErrorMsg.NOT_FOUND, name, "name", name);
    }
    return dimension;
  }

  public boolean contains(String name) {
    return dimensions.containsKey(name);
  }

  public List<Dimension> getDimensions() {
    return new ArrayList<Dimension>(dimensions.values());
  }

  public Map<String, Dimension> getDimensionMap() {
    return new LinkedHashMap<String, Dimension>(dimensions);
  }

  public int size() {
    return dimensions.size();
  }

  void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkNotFrozen() throws CubeModelException {
    if (frozen) {
      throw new CubeModelException(ErrorMsg.MODEL_FROZEN, "registry", "dimensions",
          "frozen");
    }
  }

  private void checkTemplateCycles(List<DimensionSpec> specs)
      throws CubeModelException {
    Map<String, String> templates = new LinkedHashMap<String, String>();
    for (DimensionSpec spec : specs) {
      if (spec.getName() != null && spec.getTemplate() != null) {
        templates.put(spec.getName(), spec.getTemplate());
      }
    }
    for (String start : templates.keySet()) {
      List<String> chain = new ArrayList<String>();
      chain.add(start);
      String current = templates.get(start);
      while (current != null) {
        if (chain.contains(current)) {
          chain.add(current);
          throw new CubeModelException(ErrorMsg.CYCLIC_TEMPLATE, start, "template",
              start, StringUtils.join(chain, " -> "));
        }
        chain.add(current);
        current = templates.get(current);
      }
    }
  }

  private Dimension resolve(DimensionSpec spec, Dimension template)
      throws CubeModelException {
    String name = spec.getName();

    // base snapshot
    List<Level> levels = new ArrayList<Level>();
    List<Hierarchy> hierarchies = new ArrayList<Hierarchy>();
    String defaultHierarchyName = null;
    String label = null;
    String description = null;
    Map<String, String> info = null;
    if (template != null) {
      levels.addAll(template.getLevels());
      for (Hierarchy hierarchy : template.getHierarchies()) {
        hierarchies.add(new Hierarchy(hierarchy.getName(), name,
            hierarchy.getLevels(), hierarchy.getLabel()));
      }
      defaultHierarchyName = template.getDefaultHierarchyName();
      label = template.getLabel();
      description = template.getDescription();
      info = template.getInfo();
    }

    // overrides
    if (spec.getLevels() != null) {
      levels = createLevels(name, spec.getLevels());
      if (spec.getHierarchies() == null) {
        hierarchies.clear();
        defaultHierarchyName = null;
      }
    }
    if (levels.isEmpty()) {
      throw new CubeModelException(ErrorMsg.NO_LEVELS, name, "levels",
          "dimension", name);
    }
    if (spec.getHierarchies() != null) {
      hierarchies = createHierarchies(name, spec.getHierarchies(), levels);
      // inherited default only holds while the child keeps that hierarchy
      if (defaultHierarchyName != null
          && !containsHierarchy(hierarchies, defaultHierarchyName)) {
        defaultHierarchyName = null;
      }
    }
    if (hierarchies.isEmpty()) {
      hierarchies.add(new Hierarchy(Hierarchy.DEFAULT_HIERARCHY, name, levels, null));
    }
    if (spec.getDefaultHierarchyName() != null) {
      defaultHierarchyName = spec.getDefaultHierarchyName();
    }
    if (spec.getLabel() != null) {
      label = spec.getLabel();
    }
    if (spec.getDescription() != null) {
      description = spec.getDescription();
    }
    if (spec.getInfo() != null) {
      info = spec.getInfo();
    }

    Dimension dimension = new Dimension(name, spec.getTemplate(), levels,
        hierarchies, defaultHierarchyName, label, description, info);
    // fails when the default hierarchy cannot be determined
    dimension.getHierarchy();
    return dimension;
  }

  private static boolean containsHierarchy(List<Hierarchy> hierarchies,
      String hierarchyName) {
    for (Hierarchy hierarchy : hierarchies) {
      if (hierarchy.getName().equals(hierarchyName)) {
        return true;
      }
    }
    return false;
  }

  private List<Level> createLevels(String dimension, List<LevelSpec> specs)
      throws CubeModelException {
    List<Level> levels = new ArrayList<Level>();
    Set<String> levelNames = new HashSet<String>();
    Set<String> attributes = new HashSet<String>();
    for (LevelSpec spec : specs) {
      if (StringUtils.isBlank(spec.getName())) {
        throw new CubeModelException(ErrorMsg.BLANK_NAME, dimension, "levels",
            "level", "dimension " + dimension);
      }
      if (!levelNames.add(spec.getName())) {
        throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, dimension, "levels",
            "level", spec.getName(), "dimension " + dimension);
      }
      Level level = new Level(spec.getName(), spec.getAttributes(), spec.getKey(),
          spec.getLabelAttribute(), spec.getOrderAttribute(), spec.getLabel());
      checkAttribute(dimension, level, level.getKey());
      checkAttribute(dimension, level, level.getLabelAttribute());
      checkAttribute(dimension, level, level.getOrderAttribute());
      for (String attribute : level.getAttributes()) {
        if (StringUtils.isBlank(attribute)) {
          throw new CubeModelException(ErrorMsg.BLANK_NAME, dimension, "attributes",
              "attribute", "level " + level.getName());
        }
        if (!attributes.add(attribute)) {
          throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, dimension,
              "attributes", "attribute", attribute, "dimension " + dimension);
        }
      }
      levels.add(level);
    }
    return levels;
  }

  private void checkAttribute(String dimension, Level level, String attribute)
      throws CubeModelException {
    if (!level.hasAttribute(attribute)) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_ATTRIBUTE, dimension,
          "levels", level.getName(), attribute);
    }
  }

  private List<Hierarchy> createHierarchies(String dimension,
      List<HierarchySpec> specs, List<Level> levels) throws CubeModelException {
    Map<String, Level> levelMap = new LinkedHashMap<String, Level>();
    for (Level level : levels) {
      levelMap.put(level.getName(), level);
    }
    List<Hierarchy> hierarchies = new ArrayList<Hierarchy>();
    Set<String> names = new HashSet<String>();
    for (HierarchySpec spec : specs) {
      String hierarchyName = spec.getName() == null ? Hierarchy.DEFAULT_HIERARCHY
          : spec.getName();
      if (!names.add(hierarchyName)) {
        throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, dimension,
            "hierarchies", "hierarchy", hierarchyName, "dimension " + dimension);
      }
      if (spec.getLevels() == null || spec.getLevels().isEmpty()) {
        throw new CubeModelException(ErrorMsg.NO_LEVELS, dimension, "hierarchies",
            "hierarchy", hierarchyName);
      }
      List<Level> hierarchyLevels = new ArrayList<Level>();
      for (String levelName : spec.getLevels()) {
        Level level = levelMap.get(levelName);
        if (level == null) {
          throw new CubeModelException(ErrorMsg.UNKNOWN_LEVEL, dimension,
              "hierarchies", "dimension " + dimension, levelName);
        }
        hierarchyLevels.add(level);
      }
      hierarchies.add(new Hierarchy(hierarchyName, dimension, hierarchyLevels,
          spec.getLabel()));
    }
    return hierarchies;
  }
}
