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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.junit.Test;

public class TestMetastoreUtil {

  @Test
  public void testAggregateRef() throws Exception {
    assertEquals("amount_sum", MetastoreUtil.getAggregateRef("amount", "sum"));
    String[] parts = MetastoreUtil.splitAggregateRef("unit_price_avg");
    assertEquals("unit_price", parts[0]);
    assertEquals("avg", parts[1]);
  }

  @Test
  public void testInvalidAggregateRef() throws Exception {
    try {
      MetastoreUtil.splitAggregateRef("amount");
      fail("Reference without separator should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.INVALID_AGGREGATE_REFERENCE.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
      assertTrue(e.getMessage().contains("amount_sum"));
    }
    try {
      MetastoreUtil.splitAggregateRef("amount_");
      fail("Reference without function should fail");
    } catch (CubeModelException e) {
      assertTrue(e.getMessage().contains("amount_sum"));
    }
  }

  @Test
  public void testJoinMethod() {
    assertEquals(JoinMethod.DETAIL, JoinMethod.forIdentifier(" Detail "));
    assertNull(JoinMethod.forIdentifier("outer"));
    assertNull(JoinMethod.forIdentifier(null));
    assertTrue(JoinMethod.MATCH.filtersFactRows());
    assertFalse(JoinMethod.DETAIL.filtersFactRows());
    assertTrue(JoinMethod.MASTER.preservesFactRows());
    assertTrue(JoinMethod.MASTER.marksFactSource());
    assertFalse(JoinMethod.DETAIL.marksFactSource());
    assertEquals("master", JoinMethod.MASTER.toString());
  }

  @Test
  public void testTableReference() {
    TableReference ref = TableReference.parse("dim_date.id");
    assertEquals("dim_date", ref.getTable());
    assertEquals("id", ref.getColumn());
    assertEquals("dim_date.id", ref.toString());
    assertEquals(new TableReference("dim_date", "id"), ref);
    assertNull(TableReference.parse("dim_date"));
    assertNull(TableReference.parse(" "));
  }

  @Test
  public void testAggregateFunctions() {
    assertEquals(AggregateFunction.COUNT, AggregateFunction.getBuiltin("COUNT"));
    assertFalse(AggregateFunction.COUNT.isMeasureRequired());
    assertTrue(AggregateFunction.AVG.isMeasureRequired());
    assertNull(AggregateFunction.getBuiltin("median"));
    assertEquals(7, AggregateFunction.getBuiltins().size());
  }

  @Test
  public void testCubeModel() throws Exception {
    Map<String, CubeModelException> failures = new HashMap<String, CubeModelException>();
    CubeModel model = new CubeModel(new HashMap<String, Dimension>(),
        new HashMap<String, Cube>(), failures);
    assertTrue(model.validate().contains("No cubes defined"));
    try {
      model.getDimension("date");
      fail("Unknown dimension should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.NOT_FOUND.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }

    Map<String, Cube> cubes = new HashMap<String, Cube>();
    cubes.put("facts", new Cube("facts", "facts", new ArrayList<Dimension>(),
        new ArrayList<String>(), new ArrayList<String>(), null, JoinPlan.EMPTY,
        new AggregatePlan(new ArrayList<CubeAggregate>()), null, null, null));
    model = new CubeModel(new HashMap<String, Dimension>(), cubes, failures);
    assertTrue(model.validate().contains(
        "Cube 'facts' has no measures and no aggregates"));
    assertEquals(Arrays.asList("facts"), model.getCubeNames());
  }
}
