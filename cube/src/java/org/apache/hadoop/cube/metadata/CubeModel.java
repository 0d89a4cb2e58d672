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

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * Frozen result of a model build: every registered dimension, every cube
 * that built successfully, and the failures of the cubes that were isolated
 * out of the model. Safe for concurrent readers.
 */
public final class CubeModel {
  private final Map<String, Dimension> dimensions;
  private final Map<String, Cube> cubes;
  private final Map<String, CubeModelException> cubeFailures;

  public CubeModel(Map<String, Dimension> dimensions, Map<String, Cube> cubes,
      Map<String, CubeModelException> cubeFailures) {
    this.dimensions = Collections.unmodifiableMap(
        new LinkedHashMap<String, Dimension>(dimensions));
    this.cubes = Collections.unmodifiableMap(new LinkedHashMap<String, Cube>(cubes));
    this.cubeFailures = Collections.unmodifiableMap(
        new LinkedHashMap<String, CubeModelException>(cubeFailures));
  }

  public Cube getCube(String name) throws CubeModelException {
    Cube cube = cubes.get(name);
    if (cube == null) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_CUBE, name, "cubes", name);
    }
    return cube;
  }

  public boolean hasCube(String name) {
    return cubes.containsKey(name);
  }

  public Dimension getDimension(String name) throws CubeModelException {
    Dimension dimension = dimensions.get(name);
    if (dimension == null) {
      throw new CubeModelException(ErrorMsg.NOT_FOUND, name, "dimensions", name);
    }
    return dimension;
  }

  public List<Cube> getCubes() {
    return new ArrayList<Cube>(cubes.values());
  }

  public List<String> getCubeNames() {
    return new ArrayList<String>(cubes.keySet());
  }

  public List<Dimension> getDimensions() {
    return new ArrayList<Dimension>(dimensions.values());
  }

  /**
   * @return failures of cubes left out of the model, keyed by cube name
   */
  public Map<String, CubeModelException> getCubeFailures() {
    return cubeFailures;
  }

  /**
   * Non fatal problems of the model, one message per problem.
   */
  public List<String> validate() {
    List<String> warnings = new ArrayList<String>();
    if (cubes.isEmpty()) {
      warnings.add("No cubes defined");
    }
    if (dimensions.isEmpty()) {
      warnings.add("No dimensions defined");
    }
    for (Map.Entry<String, CubeModelException> entry : cubeFailures.entrySet()) {
      warnings.add("Cube '" + entry.getKey() + "' was left out: "
          + entry.getValue().getMessage());
    }
    for (Cube cube : cubes.values()) {
      if (cube.getMeasures().isEmpty() && cube.getAggregatePlan().size() == 0) {
        warnings.add("Cube '" + cube.getName() + "' has no measures and no aggregates");
      }
    }
    return warnings;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CubeModel)) {
      return false;
    }
    CubeModel other = (CubeModel) obj;
    return getDimensions().equals(other.getDimensions())
        && getCubes().equals(other.getCubes())
        && cubeFailures.keySet().equals(other.cubeFailures.keySet());
  }

  @Override
  public int hashCode() {
    return 31 * dimensions.keySet().hashCode() + cubes.keySet().hashCode();
  }

  @Override
  public String toString() {
    return "cubes:[" + MetastoreUtil.getNamedStr(cubes.values()) + "] dimensions:["
        + MetastoreUtil.getNamedStr(dimensions.values()) + "]";
  }
}
