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
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;

/**
 * Resolve the fact table of a cube. A cube declaring no fact is its own
 * fact table.
 */
public class FactResolver implements ContextResolver {
  private static final Log LOG = LogFactory.getLog(FactResolver.class);

  public FactResolver(Configuration conf) {
  }

  @Override
  public void resolveContext(CubeBuildContext cubectx) throws CubeModelException {
    String cubeName = cubectx.getCubeName();
    String fact = cubectx.getSpec().getFact();
    if (fact == null) {
      fact = cubeName;
      LOG.debug("Cube " + cubeName + " is its own fact table");
    } else if (StringUtils.isBlank(fact)) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_FACT, cubeName, "fact",
          cubeName, fact);
    }
    TableCatalog catalog = cubectx.getCatalog();
    if (catalog != null && !catalog.tableExists(fact)) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_FACT, cubeName, "fact",
          cubeName, fact);
    }
    cubectx.setFactTable(fact);
  }
}
