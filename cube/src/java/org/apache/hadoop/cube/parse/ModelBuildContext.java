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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.Cube;
import org.apache.hadoop.cube.metadata.CubeModel;
import org.apache.hadoop.cube.metadata.Dimension;
import org.apache.hadoop.cube.schema.DimensionSpec;

/**
 * Scope of one model build. The context is created open, collects
 * dimensions and cubes, and ends either frozen into a {@link CubeModel} or
 * discarded. Nothing can be added once it has ended.
 */
public class ModelBuildContext {
  public enum State {
    OPEN, FROZEN, DISCARDED
  }

  public static final String FAILURE_KEY_SEPARATOR = "#";

  private final DimensionRegistry registry = new DimensionRegistry();
  private final Map<String, Cube> cubes = new LinkedHashMap<String, Cube>();
  private final Map<String, CubeModelException> cubeFailures =
      new LinkedHashMap<String, CubeModelException>();
  private State state = State.OPEN;

  public DimensionRegistry getRegistry() {
    return registry;
  }

  public State getState() {
    return state;
  }

  public Dimension registerDimension(DimensionSpec spec) throws CubeModelException {
    checkOpen();
    return registry.register(spec);
  }

  public List<Dimension> registerDimensions(List<DimensionSpec> specs)
      throws CubeModelException {
    checkOpen();
    return registry.registerAll(specs);
  }

  public void addCube(Cube cube) throws CubeModelException {
    checkOpen();
    if (cubes.containsKey(cube.getName())) {
      throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, cube.getName(), "name",
          "cube", cube.getName(), "model");
    }
    cubes.put(cube.getName(), cube);
  }

  /**
   * Record a cube left out of the model. A name already taken by a built
   * cube or an earlier failure is keyed as {@code name#2}, {@code name#3}
   * and so on.
   *
   * @return key the failure was recorded under
   */
  public String addCubeFailure(String cubeName, CubeModelException failure)
      throws CubeModelException {
    checkOpen();
    String key = cubeName;
    int occurrence = 2;
    while (cubes.containsKey(key) || cubeFailures.containsKey(key)) {
      key = cubeName + FAILURE_KEY_SEPARATOR + occurrence++;
    }
    cubeFailures.put(key, failure);
    return key;
  }

  public CubeModel freeze() throws CubeModelException {
    checkOpen();
    state = State.FROZEN;
    registry.freeze();
    return new CubeModel(registry.getDimensionMap(), cubes, cubeFailures);
  }

  public void discard() {
    state = State.DISCARDED;
    registry.freeze();
    cubes.clear();
    cubeFailures.clear();
  }

  private void checkOpen() throws CubeModelException {
    if (state != State.OPEN) {
      throw new CubeModelException(ErrorMsg.MODEL_FROZEN, "model", "state",
          state.name().toLowerCase(Locale.ENGLISH));
    }
  }
}
