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

import java.util.HashSet;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * Bind the dimension references of a cube to registered dimensions.
 */
public class CubeDimensionResolver implements ContextResolver {

  public CubeDimensionResolver(Configuration conf) {
  }

  @Override
  public void resolveContext(CubeBuildContext cubectx) throws CubeModelException {
    String cubeName = cubectx.getCubeName();
    Set<String> seen = new HashSet<String>();
    for (String dimName : cubectx.getSpec().getDimensions()) {
      if (!seen.add(dimName)) {
        throw new CubeModelException(ErrorMsg.DUPLICATE_NAME, cubeName,
            "dimensions", "dimension", dimName, "cube " + cubeName);
      }
      if (dimName == null || !cubectx.getRegistry().contains(dimName)) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_DIMENSION, cubeName,
            "dimensions", cubeName, dimName);
      }
      cubectx.addDimension(cubectx.getRegistry().resolve(dimName));
    }
  }
}
