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
package org.apache.hadoop.cube.schema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.junit.Before;
import org.junit.Test;

public class TestSchemaReader {

  private SchemaReader reader;

  @Before
  public void setupInstance() {
    reader = new SchemaReader();
  }

  @Test
  public void testJoinsDocument() throws Exception {
    ModelSpec model = reader.readResource("joins.json");
    assertEquals(6, model.getDimensions().size());
    assertEquals(6, model.getCubes().size());

    DimensionSpec dateMatch = model.getDimensions().get(2);
    assertEquals("date_match", dateMatch.getName());
    assertEquals("date", dateMatch.getTemplate());
    assertNull(dateMatch.getLevels());

    CubeSpec facts = model.getCubes().get(0);
    assertEquals("facts", facts.getName());
    assertNull(facts.getFact());
    assertNull(facts.getJoins().get(0).getMethod());

    CubeSpec masterdetail = model.getCubes().get(5);
    assertEquals("facts", masterdetail.getFact());
    assertEquals(4, masterdetail.getJoins().size());
    JoinSpec join = masterdetail.getJoins().get(1);
    assertEquals("facts.id_date", join.getMaster());
    assertEquals("dim_date.id", join.getDetail());
    assertEquals("detail", join.getMethod());
    assertEquals("dim_date_detail", join.getAlias());
  }

  @Test
  public void testShortForms() throws Exception {
    ModelSpec model = reader.read("{"
        + "\"dimensions\": [\"flag\","
        + "  {\"name\": \"date\", \"levels\": [\"year\", \"month\"],"
        + "   \"hierarchies\": {\"ym\": [\"year\", \"month\"]},"
        + "   \"info\": {\"min_year\": 2010}}],"
        + "\"cubes\": [{\"name\": \"sales\", \"dimensions\": [{\"name\": \"date\"}],"
        + "  \"measures\": [\"amount\", {\"name\": \"discount\", \"aggregates\": [\"sum\"]}],"
        + "  \"browser_options\": {\"unknown\": true}}],"
        + "\"locale\": \"en\"}");
    DimensionSpec flag = model.getDimensions().get(0);
    assertEquals("flag", flag.getName());
    assertEquals("flag", flag.getLevels().get(0).getName());

    DimensionSpec date = model.getDimensions().get(1);
    assertEquals("month", date.getLevels().get(1).getName());
    assertEquals("ym", date.getHierarchies().get(0).getName());
    assertEquals(Arrays.asList("year", "month"), date.getHierarchies().get(0).getLevels());
    assertEquals("2010", date.getInfo().get("min_year"));

    CubeSpec sales = model.getCubes().get(0);
    assertEquals(Arrays.asList("date"), sales.getDimensions());
    assertEquals(Arrays.asList("amount", "discount"), sales.getMeasures());
    assertNull(sales.getAggregates());
    assertNull(sales.getMeasureAggregates().get("amount"));
    assertEquals(Arrays.asList("sum"), sales.getMeasureAggregates().get("discount"));
  }

  @Test
  public void testMeasureAggregates() throws Exception {
    ModelSpec model = reader.read("{\"cubes\": [{\"name\": \"sales\", \"measures\": ["
        + "{\"name\": \"amount\", \"aggregates\": [\"sum\", \"max\"]},"
        + "{\"name\": \"price\", \"aggregations\": [\"avg\"]},"
        + "{\"name\": \"quantity\", \"aggregates\": null}]}]}");
    CubeSpec sales = model.getCubes().get(0);
    assertEquals(Arrays.asList("amount", "price", "quantity"), sales.getMeasures());
    assertEquals(Arrays.asList("sum", "max"), sales.getMeasureAggregates().get("amount"));
    assertEquals(Arrays.asList("avg"), sales.getMeasureAggregates().get("price"));
    assertFalse(sales.getMeasureAggregates().containsKey("quantity"));
  }

  @Test
  public void testAttributeObjects() throws Exception {
    ModelSpec model = reader.read("{\"dimensions\": [{\"name\": \"product\", \"levels\": ["
        + "{\"name\": \"product\", \"attributes\": ["
        + "{\"name\": \"code\"}, {\"name\": \"name\", \"label\": \"Name\"}, \"price\"]}]}]}");
    LevelSpec level = model.getDimensions().get(0).getLevels().get(0);
    assertEquals(Arrays.asList("code", "name", "price"), level.getAttributes());
  }

  @Test
  public void testLevelFields() throws Exception {
    ModelSpec model = reader.read("{\"dimensions\": [{\"name\": \"store\", \"levels\": ["
        + "{\"name\": \"store\", \"attributes\": [\"id\", \"name\"], \"key\": \"id\","
        + " \"label_attribute\": \"name\", \"order_attribute\": \"name\"}],"
        + " \"default_hierarchy_name\": \"default\"}]}");
    LevelSpec level = model.getDimensions().get(0).getLevels().get(0);
    assertEquals(Arrays.asList("id", "name"), level.getAttributes());
    assertEquals("id", level.getKey());
    assertEquals("name", level.getLabelAttribute());
    assertEquals("name", level.getOrderAttribute());
    assertEquals("default", model.getDimensions().get(0).getDefaultHierarchyName());
  }

  @Test
  public void testInvalidDocuments() throws Exception {
    String[] documents = {
        "{\"cubes\": [",
        "[]",
        "{\"cubes\": {\"name\": \"facts\"}}",
        "{\"cubes\": [{\"measures\": [\"amount\"]}]}",
        "{\"dimensions\": [{\"name\": \"date\", \"levels\": [{\"attributes\": [\"year\"]}]}]}",
        "{\"dimensions\": [{\"name\": \"date\", \"levels\": [{\"name\": \"year\","
            + " \"attributes\": [1]}]}]}",
        "{\"cubes\": [{\"name\": \"facts\", \"fact\": [\"a\"]}]}",
    };
    for (String document : documents) {
      try {
        reader.read(document);
        fail("Document should be rejected: " + document);
      } catch (CubeModelException e) {
        assertEquals(ErrorMsg.INVALID_SCHEMA_DOCUMENT.getErrorCode(),
            e.getCanonicalErrorMsg().getErrorCode());
      }
    }
  }

  @Test
  public void testMissingResource() throws Exception {
    try {
      reader.readResource("no_such_model.json");
      fail("Missing resource should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.INVALID_SCHEMA_DOCUMENT.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }
  }
}
