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
import java.util.List;

/**
 * A whole schema document: dimensions in declaration order, then cubes.
 */
public class ModelSpec {
  private List<DimensionSpec> dimensions = new ArrayList<DimensionSpec>();
  private List<CubeSpec> cubes = new ArrayList<CubeSpec>();

  public List<DimensionSpec> getDimensions() {
    return dimensions;
  }

  public void setDimensions(List<DimensionSpec> dimensions) {
    this.dimensions = dimensions;
  }

  public void addDimension(DimensionSpec dimension) {
    dimensions.add(dimension);
  }

  public List<CubeSpec> getCubes() {
    return cubes;
  }

  public void setCubes(List<CubeSpec> cubes) {
    this.cubes = cubes;
  }

  public void addCube(CubeSpec cube) {
    cubes.add(cube);
  }
}
