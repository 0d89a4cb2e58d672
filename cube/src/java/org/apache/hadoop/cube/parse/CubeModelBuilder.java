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
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.Cube;
import org.apache.hadoop.cube.metadata.CubeModel;
import org.apache.hadoop.cube.schema.CubeSpec;
import org.apache.hadoop.cube.schema.ModelSpec;

/**
 * Builds a {@link CubeModel} from a {@link ModelSpec}.
 *
 * <p>
 * All dimensions are registered first and any failure there fails the
 * build. Each cube then runs through the resolvers; a failing cube is left
 * out of the model and recorded as a failure, or fails the whole build when
 * {@link CubeModelConfUtil#ISOLATE_INVALID_CUBES} is off.
 * </p>
 */
public class CubeModelBuilder {
  private static final Log LOG = LogFactory.getLog(CubeModelBuilder.class);

  private final Configuration conf;
  private final TableCatalog catalog;
  private final List<ContextResolver> resolvers = new ArrayList<ContextResolver>();

  public CubeModelBuilder(Configuration conf) {
    this(conf, null);
  }

  public CubeModelBuilder(Configuration conf, TableCatalog catalog) {
    this.conf = conf;
    this.catalog = catalog;
    setupResolvers();
  }

  private void setupResolvers() {
    // Fact table first, joins need it
    resolvers.add(new FactResolver(conf));
    resolvers.add(new CubeDimensionResolver(conf));
    resolvers.add(new MeasureResolver(conf));
    resolvers.add(new JoinResolver(conf));
    // Aggregates need measures and the join plan
    resolvers.add(new AggregateResolver(conf));
  }

  public CubeModel build(ModelSpec spec) throws CubeModelException {
    ModelBuildContext ctx = new ModelBuildContext();
    try {
      ctx.registerDimensions(spec.getDimensions());
      boolean isolate = conf.getBoolean(CubeModelConfUtil.ISOLATE_INVALID_CUBES,
          CubeModelConfUtil.DEFAULT_ISOLATE_INVALID_CUBES);
      for (CubeSpec cubeSpec : spec.getCubes()) {
        try {
          ctx.addCube(build(cubeSpec, ctx.getRegistry()));
        } catch (CubeModelException e) {
          if (!isolate) {
            throw e;
          }
          String key = ctx.addCubeFailure(cubeSpec.getName(), e);
          LOG.warn("Leaving cube " + key + " out of the model: " + e.getMessage());
        }
      }
      CubeModel model = ctx.freeze();
      LOG.info("Built model with " + model.getCubes().size() + " cubes and "
          + model.getDimensions().size() + " dimensions");
      return model;
    } catch (CubeModelException e) {
      ctx.discard();
      throw e;
    } catch (RuntimeException e) {
      ctx.discard();
      throw e;
    }
  }

  /**
   * Build a single cube against already registered dimensions.
   */
  public Cube build(CubeSpec spec, DimensionRegistry registry)
      throws CubeModelException {
    if (StringUtils.isBlank(spec.getName())) {
      throw new CubeModelException(ErrorMsg.BLANK_NAME, "cube", "name", "cube",
          "model");
    }
    CubeBuildContext cubectx = new CubeBuildContext(spec, registry, catalog);
    for (ContextResolver resolver : resolvers) {
      resolver.resolveContext(cubectx);
    }
    Cube cube = cubectx.toCube();
    LOG.info("Built cube " + cube.getName() + " on fact " + cube.getFactTable()
        + " with joins " + cube.getJoinPlan().getEffectiveNames());
    return cube;
  }
}
