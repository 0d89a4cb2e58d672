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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.CubeJoin;
import org.apache.hadoop.cube.metadata.JoinMethod;
import org.apache.hadoop.cube.metadata.JoinPlan;
import org.apache.hadoop.cube.schema.JoinSpec;
import org.junit.Before;
import org.junit.Test;

public class TestJoinResolver {

  private Configuration conf;
  private JoinResolver resolver;

  @Before
  public void setupInstance() throws Exception {
    conf = CubeTestSetup.getConf();
    resolver = new JoinResolver(conf);
  }

  @Test
  public void testMasterDetail() throws Exception {
    JoinPlan plan = resolver.resolve("masterdetail", "facts",
        CubeTestSetup.createMasterDetail().getJoins(), null);
    assertEquals(4, plan.size());
    assertEquals(Arrays.asList("dim_date_match", "dim_date_detail", "dim_city_match",
        "dim_city_detail"), plan.getEffectiveNames());

    CubeJoin dateMatch = plan.getJoin("dim_date_match");
    assertEquals(JoinMethod.MATCH, dateMatch.getMethod());
    assertEquals("dim_date", dateMatch.getDetailTable());
    assertEquals("id", dateMatch.getDetailColumn());
    assertEquals("facts", dateMatch.getMasterTable());
    assertEquals("id_date", dateMatch.getMasterColumn());

    assertEquals(JoinMethod.DETAIL, plan.getJoin("dim_date_detail").getMethod());
    assertEquals(JoinMethod.MATCH, plan.getJoin("dim_city_match").getMethod());
    assertEquals(JoinMethod.DETAIL, plan.getJoin("dim_city_detail").getMethod());
    assertEquals(2, plan.getJoinsForTable("dim_date").size());
    assertEquals(2, plan.getJoinsForTable("dim_city").size());
    assertEquals(Arrays.asList("dim_date_match", "dim_city_match"),
        plan.getRowFilteringJoins());
    assertFalse(plan.isFactSource());

    assertEquals("left outer join dim_date dim_date_detail on facts.id_date"
        + " = dim_date_detail.id", plan.getJoin("dim_date_detail").getJoinClause());
    assertEquals("inner join dim_city dim_city_match on facts.id_city"
        + " = dim_city_match.id", plan.getJoin("dim_city_match").getJoinClause());
  }

  @Test
  public void testDefaultMethod() throws Exception {
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_date", "dim_date.id"));
    JoinPlan plan = resolver.resolve("facts", "facts", joins, null);
    assertEquals(JoinMethod.MATCH, plan.getJoin("dim_date").getMethod());
    assertNull(plan.getJoin("dim_date").getAlias());

    conf.set(CubeModelConfUtil.DEFAULT_JOIN_METHOD, "detail");
    plan = new JoinResolver(conf).resolve("facts", "facts", joins, null);
    assertEquals(JoinMethod.DETAIL, plan.getJoin("dim_date").getMethod());
  }

  @Test
  public void testMethodIgnoresCase() throws Exception {
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_city", "dim_city.id", "Master", null));
    JoinPlan plan = resolver.resolve("facts_master", "facts", joins, null);
    CubeJoin join = plan.getJoin("dim_city");
    assertEquals(JoinMethod.MASTER, join.getMethod());
    assertTrue(join.getMethod().preservesFactRows());
    assertTrue(plan.isFactSource());
    assertTrue(plan.getRowFilteringJoins().isEmpty());
  }

  @Test
  public void testUnknownMethod() throws Exception {
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_city", "dim_city.id", "outer", null));
    try {
      resolver.resolve("facts", "facts", joins, null);
      fail("Unknown method should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.UNKNOWN_JOIN_METHOD.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }
  }

  @Test
  public void testAmbiguousAlias() throws Exception {
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_date", "dim_date.id", "match", null));
    joins.add(new JoinSpec("facts.id_date", "dim_date.id", "detail", null));
    try {
      resolver.resolve("facts", "facts", joins, null);
      fail("Same table without aliases should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.AMBIGUOUS_ALIAS.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
      assertEquals("facts", e.getEntity());
      assertTrue(e.getMessage().contains("dim_date"));
    }

    // one alias is enough to tell the joins apart
    joins.get(1).setAlias("dim_date_detail");
    JoinPlan plan = resolver.resolve("facts", "facts", joins, null);
    assertEquals(Arrays.asList("dim_date", "dim_date_detail"), plan.getEffectiveNames());

    // an alias colliding with a table name is ambiguous too
    joins.get(1).setAlias("dim_date");
    try {
      resolver.resolve("facts", "facts", joins, null);
      fail("Alias equal to another join's table should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.AMBIGUOUS_ALIAS.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }
  }

  @Test
  public void testMalformedReference() throws Exception {
    String[][] references = {
        {"facts", "dim_date.id"},
        {"facts.id_date", "dim_date"},
        {"facts.", "dim_date.id"},
        {"facts.id_date", ".id"},
        {null, "dim_date.id"},
    };
    for (String[] refs : references) {
      List<JoinSpec> joins = new ArrayList<JoinSpec>();
      joins.add(new JoinSpec(refs[0], refs[1]));
      try {
        resolver.resolve("facts", "facts", joins, null);
        fail("Malformed reference " + refs[0] + " " + refs[1] + " should fail");
      } catch (CubeModelException e) {
        assertEquals(ErrorMsg.MALFORMED_REFERENCE.getErrorCode(),
            e.getCanonicalErrorMsg().getErrorCode());
      }
    }
  }

  @Test
  public void testReferenceSplitOnLastDot() throws Exception {
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("sales.facts.id_date", "warehouse.dim_date.id"));
    CubeJoin join = resolver.resolve("facts", "sales.facts", joins, null).getJoins().get(0);
    assertEquals("sales.facts", join.getMasterTable());
    assertEquals("id_date", join.getMasterColumn());
    assertEquals("warehouse.dim_date", join.getDetailTable());
    assertEquals("warehouse.dim_date", join.getEffectiveName());
  }

  @Test
  public void testUnknownDimensionTable() throws Exception {
    final Set<String> tables = new HashSet<String>(Arrays.asList("facts", "dim_date"));
    TableCatalog catalog = new TableCatalog() {
      @Override
      public boolean tableExists(String table) {
        return tables.contains(table);
      }
    };
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_date", "dim_date.id"));
    assertEquals(1, resolver.resolve("facts", "facts", joins, catalog).size());

    joins.add(new JoinSpec("facts.id_city", "dim_city.id"));
    try {
      resolver.resolve("facts", "facts", joins, catalog);
      fail("Unknown detail table should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.UNKNOWN_DIMENSION_TABLE.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
      assertTrue(e.getMessage().contains("dim_city"));
    }
  }

  @Test
  public void testMasterTableCheck() throws Exception {
    conf.setBoolean(CubeModelConfUtil.CHECK_MASTER_TABLES, true);
    JoinResolver checking = new JoinResolver(conf);
    List<JoinSpec> joins = new ArrayList<JoinSpec>();
    joins.add(new JoinSpec("facts.id_city", "dim_city.id"));
    joins.add(new JoinSpec("dim_city.id_country", "dim_country.id"));
    assertEquals(2, checking.resolve("facts", "facts", joins, null).size());

    joins.add(new JoinSpec("dim_store.id_region", "dim_region.id"));
    try {
      checking.resolve("facts", "facts", joins, null);
      fail("Master table not brought in by any join should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.UNKNOWN_DIMENSION_TABLE.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
      assertTrue(e.getMessage().contains("dim_store"));
    }
    // without the check the same joins resolve
    assertEquals(3, resolver.resolve("facts", "facts", joins, null).size());
  }

  @Test
  public void testNoJoins() throws Exception {
    assertTrue(resolver.resolve("facts", "facts", new ArrayList<JoinSpec>(), null).isEmpty());
    assertTrue(resolver.resolve("facts", "facts", null, null).isEmpty());
  }
}
