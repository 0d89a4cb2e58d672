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
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.CubeJoin;
import org.apache.hadoop.cube.metadata.JoinMethod;
import org.apache.hadoop.cube.metadata.JoinPlan;
import org.apache.hadoop.cube.metadata.TableReference;
import org.apache.hadoop.cube.schema.JoinSpec;

/**
 * <p>
 * Resolve the joins of a cube into a {@link JoinPlan}.
 * </p>
 *
 * <p>
 * Master and detail keys are split into table and column on the last dot.
 * The detail side is known by its effective name, the alias if one is
 * declared and the detail table otherwise; effective names must be unique
 * within the cube, so joining one table twice needs an alias on at least
 * one of the joins.
 * </p>
 *
 * <p>
 * A join without method gets {@link CubeModelConfUtil#DEFAULT_JOIN_METHOD}.
 * </p>
 */
public class JoinResolver implements ContextResolver {
  private static final Log LOG = LogFactory.getLog(JoinResolver.class);

  private final Configuration conf;

  public JoinResolver(Configuration conf) {
    this.conf = conf;
  }

  @Override
  public void resolveContext(CubeBuildContext cubectx) throws CubeModelException {
    cubectx.setJoinPlan(resolve(cubectx.getCubeName(), cubectx.getFactTable(),
        cubectx.getSpec().getJoins(), cubectx.getCatalog()));
  }

  /**
   * @param cubeName cube owning the joins, used in failures
   * @param factTable fact table of the cube
   * @param joinSpecs joins in declaration order
   * @param catalog physical tables, null to skip table checks
   */
  public JoinPlan resolve(String cubeName, String factTable,
      List<JoinSpec> joinSpecs, TableCatalog catalog) throws CubeModelException {
    if (joinSpecs == null || joinSpecs.isEmpty()) {
      return JoinPlan.EMPTY;
    }
    JoinMethod defaultMethod = getDefaultMethod(cubeName);
    List<CubeJoin> joins = new ArrayList<CubeJoin>();
    Set<String> effectiveNames = new HashSet<String>();
    for (JoinSpec spec : joinSpecs) {
      TableReference master = parseReference(cubeName, "master", spec.getMaster());
      TableReference detail = parseReference(cubeName, "detail", spec.getDetail());
      JoinMethod method = defaultMethod;
      if (spec.getMethod() != null) {
        method = JoinMethod.forIdentifier(spec.getMethod());
        if (method == null) {
          throw new CubeModelException(ErrorMsg.UNKNOWN_JOIN_METHOD, cubeName,
              "joins", cubeName, spec.getMethod());
        }
      }
      String alias = StringUtils.isBlank(spec.getAlias()) ? null
          : spec.getAlias().trim();
      CubeJoin join = new CubeJoin(master, detail, alias, method);
      if (!effectiveNames.add(join.getEffectiveName())) {
        throw new CubeModelException(ErrorMsg.AMBIGUOUS_ALIAS, cubeName, "joins",
            cubeName, join.getEffectiveName());
      }
      if (catalog != null && !catalog.tableExists(detail.getTable())) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_DIMENSION_TABLE, cubeName,
            "joins", cubeName, detail.getTable());
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Cube " + cubeName + " join " + join.getEffectiveName() + ":"
            + join.getJoinClause());
      }
      joins.add(join);
    }
    if (conf.getBoolean(CubeModelConfUtil.CHECK_MASTER_TABLES,
        CubeModelConfUtil.DEFAULT_CHECK_MASTER_TABLES)) {
      checkMasterTables(cubeName, factTable, joins);
    }
    return new JoinPlan(joins);
  }

  private JoinMethod getDefaultMethod(String cubeName) throws CubeModelException {
    String identifier = conf.get(CubeModelConfUtil.DEFAULT_JOIN_METHOD,
        CubeModelConfUtil.DEFAULT_JOIN_METHOD_VALUE);
    JoinMethod method = JoinMethod.forIdentifier(identifier);
    if (method == null) {
      throw new CubeModelException(ErrorMsg.UNKNOWN_JOIN_METHOD, cubeName,
          CubeModelConfUtil.DEFAULT_JOIN_METHOD, cubeName, identifier);
    }
    return method;
  }

  private TableReference parseReference(String cubeName, String side,
      String reference) throws CubeModelException {
    TableReference ref = TableReference.parse(reference);
    if (ref == null) {
      throw new CubeModelException(ErrorMsg.MALFORMED_REFERENCE, cubeName, "joins",
          cubeName, side, reference);
    }
    return ref;
  }

  // Every master must be the fact table or a table brought in by another join
  private void checkMasterTables(String cubeName, String factTable,
      List<CubeJoin> joins) throws CubeModelException {
    for (CubeJoin join : joins) {
      String masterTable = join.getMasterTable();
      if (masterTable.equals(factTable)) {
        continue;
      }
      boolean found = false;
      for (CubeJoin other : joins) {
        if (other != join && (masterTable.equals(other.getEffectiveName())
            || masterTable.equals(other.getDetailTable()))) {
          found = true;
          break;
        }
      }
      if (!found) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_DIMENSION_TABLE, cubeName,
            "joins", cubeName, masterTable);
      }
    }
  }
}
