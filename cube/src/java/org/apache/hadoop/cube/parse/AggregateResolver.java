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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.AggregateFunction;
import org.apache.hadoop.cube.metadata.AggregatePlan;
import org.apache.hadoop.cube.metadata.CubeAggregate;
import org.apache.hadoop.cube.metadata.JoinPlan;
import org.apache.hadoop.cube.metadata.MetastoreUtil;
import org.apache.hadoop.cube.schema.AggregateSpec;

/**
 * <p>
 * Plan the aggregates of a cube.
 * </p>
 *
 * <p>
 * Every aggregate is bound to a known function. {@code count} may go without
 * a measure and then counts the cube's rows; any other function needs a
 * measure declared on the cube. Each planned aggregate carries the joins
 * that restrict its rows, which are the {@code match} joins of the plan.
 * </p>
 *
 * <p>
 * When the cube declares no aggregates at all, default aggregates are derived
 * unless {@link CubeModelConfUtil#DERIVE_DEFAULT_AGGREGATES} is off: one per
 * function listed on the measure, or a single {@code sum} when the measure
 * lists none.
 * </p>
 */
public class AggregateResolver implements ContextResolver {
  private static final Log LOG = LogFactory.getLog(AggregateResolver.class);

  private final Configuration conf;
  private final Map<String, AggregateFunction> functions;

  public AggregateResolver(Configuration conf) {
    this.conf = conf;
    functions = new LinkedHashMap<String, AggregateFunction>();
    for (AggregateFunction function : AggregateFunction.getBuiltins()) {
      functions.put(function.getName(), function);
    }
    for (String extra : CubeModelConfUtil.getStringList(conf,
        CubeModelConfUtil.EXTRA_AGGREGATE_FUNCTIONS)) {
      if (!functions.containsKey(extra)) {
        functions.put(extra, new AggregateFunction(extra, true));
      }
    }
  }

  @Override
  public void resolveContext(CubeBuildContext cubectx) throws CubeModelException {
    String cubeName = cubectx.getCubeName();
    List<AggregateSpec> specs = cubectx.getSpec().getAggregates();
    if (specs == null) {
      if (conf.getBoolean(CubeModelConfUtil.DERIVE_DEFAULT_AGGREGATES,
          CubeModelConfUtil.DEFAULT_DERIVE_DEFAULT_AGGREGATES)) {
        specs = getDefaultAggregates(cubectx.getMeasures(),
            cubectx.getSpec().getMeasureAggregates());
        LOG.debug("Derived default aggregates for cube " + cubeName);
      } else {
        specs = new ArrayList<AggregateSpec>();
      }
    }
    cubectx.setAggregatePlan(plan(cubeName, specs, cubectx.getMeasures(),
        cubectx.getJoinPlan()));
  }

  /**
   * @param cubeName cube owning the aggregates, used in failures
   * @param specs declared aggregates
   * @param measures measures of the cube
   * @param joinPlan resolved joins of the cube
   */
  public AggregatePlan plan(String cubeName, List<AggregateSpec> specs,
      List<String> measures, JoinPlan joinPlan) throws CubeModelException {
    List<String> rowFilteringJoins = joinPlan.getRowFilteringJoins();
    List<CubeAggregate> aggregates = new ArrayList<CubeAggregate>();
    Set<String> names = new HashSet<String>();
    for (AggregateSpec spec : specs) {
      String functionName = spec.getFunction() == null ? "" : spec.getFunction();
      String measure = StringUtils.isBlank(spec.getMeasure()) ? null
          : spec.getMeasure();
      String name = spec.getName();
      if (StringUtils.isBlank(name)) {
        String normalized = functionName.trim().toLowerCase(Locale.ENGLISH);
        name = measure == null ? normalized
            : MetastoreUtil.getAggregateRef(measure, normalized);
      }

      AggregateFunction function = getFunction(functionName);
      if (function == null) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_FUNCTION, cubeName,
            "aggregates", cubeName, name, functionName);
      }
      if (measure == null && function.isMeasureRequired()) {
        throw new CubeModelException(ErrorMsg.MEASURE_REQUIRED, cubeName,
            "aggregates", cubeName, name, function.getName());
      }
      if (measure != null && !measures.contains(measure)) {
        throw new CubeModelException(ErrorMsg.UNKNOWN_MEASURE, cubeName,
            "aggregates", cubeName, name, measure);
      }
      if (!names.add(name)) {
        throw new CubeModelException(ErrorMsg.DUPLICATE_AGGREGATE_NAME, cubeName,
            "aggregates", cubeName, name);
      }
      CubeAggregate aggregate = new CubeAggregate(name, function, measure,
          spec.getLabel(), rowFilteringJoins);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Cube " + cubeName + " aggregate " + aggregate
            + (aggregate.isRowCount() ? " restricted by " + rowFilteringJoins : ""));
      }
      aggregates.add(aggregate);
    }
    return new AggregatePlan(aggregates);
  }

  AggregateFunction getFunction(String name) {
    return name == null ? null : functions.get(name.trim().toLowerCase(Locale.ENGLISH));
  }

  static List<AggregateSpec> getDefaultAggregates(List<String> measures) {
    return getDefaultAggregates(measures, null);
  }

  static List<AggregateSpec> getDefaultAggregates(List<String> measures,
      Map<String, List<String>> measureAggregates) {
    List<AggregateSpec> specs = new ArrayList<AggregateSpec>();
    for (String measure : measures) {
      List<String> functionNames = measureAggregates == null ? null
          : measureAggregates.get(measure);
      if (functionNames == null || functionNames.isEmpty()) {
        functionNames = new ArrayList<String>();
        functionNames.add(AggregateFunction.SUM.getName());
      }
      for (String functionName : functionNames) {
        String normalized = functionName.trim().toLowerCase(Locale.ENGLISH);
        specs.add(new AggregateSpec(MetastoreUtil.getAggregateRef(measure,
            normalized), normalized, measure));
      }
    }
    return specs;
  }
}
