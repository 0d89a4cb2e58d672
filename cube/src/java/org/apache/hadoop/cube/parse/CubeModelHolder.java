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

import java.util.concurrent.atomic.AtomicReference;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.metadata.CubeModel;
import org.apache.hadoop.cube.schema.ModelSpec;

/**
 * Holds the active model. A reload builds a complete new model and then
 * replaces the active one in a single step, so readers see either the old
 * or the new model. A failed reload keeps the old model active.
 */
public class CubeModelHolder {
  private static final Log LOG = LogFactory.getLog(CubeModelHolder.class);

  private final CubeModelBuilder builder;
  private final AtomicReference<CubeModel> active = new AtomicReference<CubeModel>();

  public CubeModelHolder(CubeModelBuilder builder) {
    this.builder = builder;
  }

  /**
   * @return active model, null before the first successful load
   */
  public CubeModel getModel() {
    return active.get();
  }

  public CubeModel reload(ModelSpec spec) throws CubeModelException {
    CubeModel model;
    try {
      model = builder.build(spec);
    } catch (CubeModelException e) {
      LOG.error("Model reload failed, keeping the active model", e);
      throw e;
    }
    CubeModel previous = active.getAndSet(model);
    LOG.info("Activated model " + model + (previous == null ? ""
        : ", replacing " + previous));
    return model;
  }
}
