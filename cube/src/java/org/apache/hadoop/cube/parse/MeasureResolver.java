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

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * Check measure and detail names of a cube: non blank and unique among
 * measures and details together.
 */
public class MeasureResolver implements ContextResolver {

  public MeasureResolver(Configuration conf) {
  }

  @Override
  public void resolveContext(CubeBuildContext cubectx) throws CubeModelException {
    String cubeName = cubectx.getCubeName();
    for (String measure : cubectx.getSpec().getMeasures()) {
      if (StringUtils.isBlank(measure) || cubectx.getMeasures().contains(measure)) {
        throw new CubeModelException(ErrorMsg.INVALID_MEASURE, cubeName,
            "measures", cubeName, measure);
      }
      cubectx.addMeasure(measure);
    }
    for (String detail : cubectx.getSpec().getDetails()) {
      if (StringUtils.isBlank(detail) || cubectx.getMeasures().contains(detail)
          || cubectx.getDetails().contains(detail)) {
        throw new CubeModelException(ErrorMsg.INVALID_MEASURE, cubeName,
            "details", cubeName, detail);
      }
      cubectx.addDetail(detail);
    }
  }
}
