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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;

/**
 * Reads a JSON schema document into a {@link ModelSpec}.
 *
 * <p>
 * Fields that are not known are ignored. Dimensions of a cube, levels of a
 * dimension, levels of a hierarchy and measures may be given as plain
 * strings instead of objects. Hierarchies may be a list of objects or an
 * object mapping hierarchy names to level lists.
 * </p>
 */
public class SchemaReader {
  private static final Log LOG = LogFactory.getLog(SchemaReader.class);
  static final String DOCUMENT = "document";

  private final ObjectMapper mapper = new ObjectMapper();

  public ModelSpec read(String json) throws CubeModelException {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (IOException e) {
      throw new CubeModelException(ErrorMsg.INVALID_SCHEMA_DOCUMENT, DOCUMENT,
          DOCUMENT, e, e.getMessage());
    }
    return readModel(root);
  }

  public ModelSpec read(InputStream in) throws CubeModelException {
    JsonNode root;
    try {
      root = mapper.readTree(in);
    } catch (IOException e) {
      throw new CubeModelException(ErrorMsg.INVALID_SCHEMA_DOCUMENT, DOCUMENT,
          DOCUMENT, e, e.getMessage());
    }
    return readModel(root);
  }

  /**
   * Read a document from the class path.
   */
  public ModelSpec readResource(String resource) throws CubeModelException {
    InputStream in = Thread.currentThread().getContextClassLoader()
        .getResourceAsStream(resource);
    if (in == null) {
      throw new CubeModelException(ErrorMsg.INVALID_SCHEMA_DOCUMENT, resource,
          DOCUMENT, "resource " + resource + " not found");
    }
    try {
      return read(in);
    } finally {
      try {
        in.close();
      } catch (IOException e) {
        LOG.warn("Error closing " + resource, e);
      }
    }
  }

  ModelSpec readModel(JsonNode root) throws CubeModelException {
    if (root == null || !root.isObject()) {
      throw invalid(DOCUMENT, "top level value must be an object");
    }
    ModelSpec model = new ModelSpec();
    for (JsonNode node : elements(root, "dimensions", DOCUMENT)) {
      model.addDimension(readDimension(node));
    }
    for (JsonNode node : elements(root, "cubes", DOCUMENT)) {
      model.addCube(readCube(node));
    }
    LOG.debug("Read " + model.getDimensions().size() + " dimensions and "
        + model.getCubes().size() + " cubes");
    return model;
  }

  DimensionSpec readDimension(JsonNode node) throws CubeModelException {
    if (node.isTextual()) {
      DimensionSpec dim = new DimensionSpec(node.getTextValue());
      List<LevelSpec> levels = new ArrayList<LevelSpec>();
      levels.add(new LevelSpec(node.getTextValue()));
      dim.setLevels(levels);
      return dim;
    }
    String name = requiredText(node, "name", "dimension");
    DimensionSpec dim = new DimensionSpec(name, text(node, "template", name));
    if (present(node, "levels")) {
      List<LevelSpec> levels = new ArrayList<LevelSpec>();
      for (JsonNode levelNode : elements(node, "levels", name)) {
        levels.add(readLevel(levelNode, name));
      }
      dim.setLevels(levels);
    }
    if (present(node, "hierarchies")) {
      dim.setHierarchies(readHierarchies(node.get("hierarchies"), name));
    }
    dim.setDefaultHierarchyName(text(node, "default_hierarchy_name", name));
    dim.setLabel(text(node, "label", name));
    dim.setDescription(text(node, "description", name));
    dim.setInfo(info(node, name));
    return dim;
  }

  LevelSpec readLevel(JsonNode node, String dimension) throws CubeModelException {
    if (node.isTextual()) {
      return new LevelSpec(node.getTextValue());
    }
    LevelSpec level = new LevelSpec();
    level.setName(requiredText(node, "name", dimension));
    level.setAttributes(names(node, "attributes", dimension));
    level.setKey(text(node, "key", dimension));
    level.setLabelAttribute(text(node, "label_attribute", dimension));
    level.setOrderAttribute(text(node, "order_attribute", dimension));
    level.setLabel(text(node, "label", dimension));
    return level;
  }

  List<HierarchySpec> readHierarchies(JsonNode node, String dimension)
      throws CubeModelException {
    List<HierarchySpec> hierarchies = new ArrayList<HierarchySpec>();
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = node.getFields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        HierarchySpec hierarchy = new HierarchySpec();
        hierarchy.setName(field.getKey());
        hierarchy.setLevels(stringList(field.getValue(), dimension));
        hierarchies.add(hierarchy);
      }
      return hierarchies;
    }
    if (!node.isArray()) {
      throw invalid(dimension, "hierarchies must be a list or an object");
    }
    for (JsonNode hierNode : node) {
      HierarchySpec hierarchy = new HierarchySpec();
      hierarchy.setName(requiredText(hierNode, "name", dimension));
      hierarchy.setLevels(strings(hierNode, "levels", dimension));
      hierarchy.setLabel(text(hierNode, "label", dimension));
      hierarchies.add(hierarchy);
    }
    return hierarchies;
  }

  CubeSpec readCube(JsonNode node) throws CubeModelException {
    String name = requiredText(node, "name", "cube");
    CubeSpec cube = new CubeSpec(name);
    cube.setFact(text(node, "fact", name));
    cube.setDimensions(names(node, "dimensions", name));
    readMeasures(node, cube);
    cube.setDetails(names(node, "details", name));
    if (present(node, "aggregates")) {
      List<AggregateSpec> aggregates = new ArrayList<AggregateSpec>();
      for (JsonNode aggNode : elements(node, "aggregates", name)) {
        AggregateSpec aggregate = new AggregateSpec(
            requiredText(aggNode, "name", name),
            text(aggNode, "function", name),
            text(aggNode, "measure", name));
        aggregate.setLabel(text(aggNode, "label", name));
        aggregates.add(aggregate);
      }
      cube.setAggregates(aggregates);
    }
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    for (JsonNode joinNode : elements(node, "joins", name)) {
      joins.add(new JoinSpec(text(joinNode, "master", name),
          text(joinNode, "detail", name), text(joinNode, "method", name),
          text(joinNode, "alias", name)));
    }
    cube.setJoins(joins);
    cube.setKey(text(node, "key", name));
    cube.setLabel(text(node, "label", name));
    cube.setDescription(text(node, "description", name));
    cube.setInfo(info(node, name));
    return cube;
  }

  private void readMeasures(JsonNode node, CubeSpec cube) throws CubeModelException {
    String name = cube.getName();
    List<String> measures = new ArrayList<String>();
    for (JsonNode element : elements(node, "measures", name)) {
      if (element.isTextual()) {
        measures.add(element.getTextValue());
        continue;
      }
      String measure = requiredText(element, "name", name);
      measures.add(measure);
      String field = "aggregates";
      if (!present(element, field) && present(element, "aggregations")) {
        LOG.warn("Measure " + measure + " of cube " + name
            + " uses 'aggregations', which is deprecated; use 'aggregates'");
        field = "aggregations";
      }
      if (present(element, field)) {
        cube.setMeasureAggregates(measure, stringList(element.get(field), name));
      }
    }
    cube.setMeasures(measures);
  }

  private static boolean present(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }

  private List<JsonNode> elements(JsonNode node, String field, String entity)
      throws CubeModelException {
    List<JsonNode> result = new ArrayList<JsonNode>();
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return result;
    }
    if (!value.isArray()) {
      throw invalid(entity, field + " of " + entity + " must be a list");
    }
    for (JsonNode element : value) {
      result.add(element);
    }
    return result;
  }

  // Strings, or objects carrying a name
  private List<String> names(JsonNode node, String field, String entity)
      throws CubeModelException {
    List<String> result = new ArrayList<String>();
    for (JsonNode element : elements(node, field, entity)) {
      if (element.isTextual()) {
        result.add(element.getTextValue());
      } else {
        result.add(requiredText(element, "name", entity));
      }
    }
    return result;
  }

  private List<String> strings(JsonNode node, String field, String entity)
      throws CubeModelException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return new ArrayList<String>();
    }
    return stringList(value, entity);
  }

  private List<String> stringList(JsonNode value, String entity)
      throws CubeModelException {
    if (!value.isArray()) {
      throw invalid(entity, "expected a list of strings in " + entity);
    }
    List<String> result = new ArrayList<String>();
    for (JsonNode element : value) {
      if (!element.isTextual()) {
        throw invalid(entity, "expected a string in " + entity + ", got " + element);
      }
      result.add(element.getTextValue());
    }
    return result;
  }

  private String text(JsonNode node, String field, String entity)
      throws CubeModelException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isValueNode()) {
      throw invalid(entity, field + " of " + entity + " must be a string");
    }
    return value.asText();
  }

  private String requiredText(JsonNode node, String field, String entity)
      throws CubeModelException {
    if (!node.isObject()) {
      throw invalid(entity, "expected an object in " + entity + ", got " + node);
    }
    String value = text(node, field, entity);
    if (value == null) {
      throw invalid(entity, "missing " + field + " in " + entity);
    }
    return value;
  }

  private Map<String, String> info(JsonNode node, String entity)
      throws CubeModelException {
    JsonNode value = node.get("info");
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isObject()) {
      throw invalid(entity, "info of " + entity + " must be an object");
    }
    Map<String, String> info = new LinkedHashMap<String, String>();
    Iterator<Map.Entry<String, JsonNode>> fields = value.getFields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode fieldValue = field.getValue();
      info.put(field.getKey(), fieldValue.isValueNode() ? fieldValue.asText()
          : fieldValue.toString());
    }
    return info;
  }

  private static CubeModelException invalid(String entity, String reason) {
    return new CubeModelException(ErrorMsg.INVALID_SCHEMA_DOCUMENT, entity,
        DOCUMENT, reason);
  }
}
