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

import static org.apache.hadoop.cube.parse.RowCountEvaluator.row;
import static org.junit.Assert.assertEquals;

import org.apache.hadoop.cube.metadata.Cube;
import org.apache.hadoop.cube.metadata.CubeAggregate;
import org.apache.hadoop.cube.metadata.CubeModel;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * Row counts planned for the joins schema, evaluated over small tables.
 */
public class TestRowCounts {

  private static CubeModel model;
  private RowCountEvaluator evaluator;

  @BeforeClass
  public static void setup() throws Exception {
    model = CubeTestSetup.getBuilder().build(CubeTestSetup.createJoinsModel());
  }

  @SuppressWarnings("unchecked")
  @Before
  public void setupInstance() throws Exception {
    evaluator = new RowCountEvaluator();
    evaluator.addRows("facts",
        row("id", 1, "id_date", 1, "id_city", 10, "amount", 100),
        row("id", 2, "id_date", 1, "id_city", 20, "amount", 200),
        row("id", 3, "id_date", 2, "id_city", 10, "amount", 300),
        row("id", 4, "id_date", 3, "id_city", 30, "amount", 400));
    evaluator.addRows("dim_date",
        row("id", 1, "year", 2013),
        row("id", 2, "year", 2013),
        row("id", 3, "year", 2014));
    evaluator.addRows("dim_city",
        row("id", 10, "city_name", "Bratislava"),
        row("id", 20, "city_name", "Vienna"));
  }

  @SuppressWarnings("unchecked")
  @Test
  public void testNoMatchingDetailRows() throws Exception {
    evaluator.addRows("dim_city");
    assertEquals(4, evaluator.factRows("facts"));
    assertEquals(0, count("facts"));
    assertEquals(4, count("facts_detail_city"));
    assertEquals(0, count("facts_detail_date"));
    assertEquals(4, count("facts_master"));
  }

  @Test
  public void testPartialMatch() throws Exception {
    // fact 4 has no city
    assertEquals(3, count("facts"));
    assertEquals(4, count("facts_detail_city"));
    assertEquals(3, count("facts_detail_date"));
    assertEquals(4, count("condition_and_drilldown"));
    assertEquals(4, count("facts_master"));
    assertEquals(3, count("masterdetail"));
  }

  @SuppressWarnings("unchecked")
  @Test
  public void testDetailJoinDoesNotDeflate() throws Exception {
    evaluator.addRows("dim_date", row("id", 1, "year", 2013));
    // facts 3 and 4 have no date
    assertEquals(2, count("facts"));
    assertEquals(2, count("facts_detail_city"));
    assertEquals(3, count("facts_detail_date"));
    assertEquals(2, count("masterdetail"));
  }

  @Test
  public void testRowFilteringJoinsDecideTheCount() throws Exception {
    for (Cube cube : model.getCubes()) {
      CubeAggregate recordCount = cube.getAggregatePlan().getAggregate("record_count");
      assertEquals(cube.getName(), evaluator.count(cube, "record_count"),
          evaluator.countWithJoins(cube, recordCount.getRowFilteringJoins()));
    }
  }

  private long count(String cubeName) throws Exception {
    return evaluator.count(model.getCube(cubeName), "record_count");
  }
}
