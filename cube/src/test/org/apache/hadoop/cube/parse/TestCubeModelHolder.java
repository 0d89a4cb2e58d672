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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.cube.CubeModelException;
import org.apache.hadoop.cube.ErrorMsg;
import org.apache.hadoop.cube.metadata.CubeModel;
import org.apache.hadoop.cube.schema.DimensionSpec;
import org.apache.hadoop.cube.schema.ModelSpec;
import org.junit.Before;
import org.junit.Test;

public class TestCubeModelHolder {

  private CubeModelHolder holder;

  @Before
  public void setupInstance() throws Exception {
    holder = new CubeModelHolder(CubeTestSetup.getBuilder());
  }

  @Test
  public void testReload() throws Exception {
    assertNull(holder.getModel());
    CubeModel first = holder.reload(CubeTestSetup.createJoinsModel());
    assertSame(first, holder.getModel());

    ModelSpec smaller = CubeTestSetup.createJoinsModel();
    smaller.getCubes().remove(smaller.getCubes().size() - 1);
    CubeModel second = holder.reload(smaller);
    assertSame(second, holder.getModel());
    assertFalse(second.hasCube("masterdetail"));
    // the replaced model is left untouched
    assertTrue(first.hasCube("masterdetail"));
  }

  @Test
  public void testFailedReloadKeepsModel() throws Exception {
    CubeModel first = holder.reload(CubeTestSetup.createJoinsModel());
    ModelSpec broken = CubeTestSetup.createJoinsModel();
    broken.getDimensions().add(0, new DimensionSpec("date_copy", "date"));
    try {
      holder.reload(broken);
      fail("Reload with a broken dimension should fail");
    } catch (CubeModelException e) {
      assertEquals(ErrorMsg.UNKNOWN_TEMPLATE.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }
    assertSame(first, holder.getModel());
  }

  @Test
  public void testReadersSeeCompleteModels() throws Exception {
    holder.reload(CubeTestSetup.createJoinsModel());
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<Integer>> readers = new ArrayList<Future<Integer>>();
      for (int i = 0; i < 4; i++) {
        readers.add(executor.submit(new Callable<Integer>() {
          @Override
          public Integer call() throws Exception {
            int checked = 0;
            for (int j = 0; j < 200; j++) {
              CubeModel model = holder.getModel();
              assertEquals(6, model.getCubes().size());
              assertEquals(4, model.getCube("masterdetail").getJoinPlan().size());
              checked++;
            }
            return checked;
          }
        }));
      }
      for (int i = 0; i < 10; i++) {
        holder.reload(CubeTestSetup.createJoinsModel());
      }
      for (Future<Integer> reader : readers) {
        assertEquals(Integer.valueOf(200), reader.get(30, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
