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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate function identifier. Built-in functions are registered here;
 * additional functions may be configured and always require a measure.
 */
public final class AggregateFunction implements Named {
  public static final AggregateFunction COUNT = new AggregateFunction("count", false);
  public static final AggregateFunction COUNT_NONEMPTY =
      new AggregateFunction("count_nonempty", true);
  public static final AggregateFunction COUNT_DISTINCT =
      new AggregateFunction("count_distinct", true);
  public static final AggregateFunction SUM = new AggregateFunction("sum", true);
  public static final AggregateFunction MIN = new AggregateFunction("min", true);
  public static final AggregateFunction MAX = new AggregateFunction("max", true);
  public static final AggregateFunction AVG = new AggregateFunction("avg", true);

  private static final Map<String, AggregateFunction> BUILTINS;

  static {
    Map<String, AggregateFunction> builtins = new LinkedHashMap<String, AggregateFunction>();
    for (AggregateFunction function : new AggregateFunction[] {
        COUNT, COUNT_NONEMPTY, COUNT_DISTINCT, SUM, MIN, MAX, AVG }) {
      builtins.put(function.getName(), function);
    }
    BUILTINS = Collections.unmodifiableMap(builtins);
  }

  private final String name;
  private final boolean measureRequired;

  public AggregateFunction(String name, boolean measureRequired) {
    this.name = name.toLowerCase(Locale.ENGLISH);
    this.measureRequired = measureRequired;
  }

  public static AggregateFunction getBuiltin(String name) {
    return name == null ? null : BUILTINS.get(name.trim().toLowerCase(Locale.ENGLISH));
  }

  public static Collection<AggregateFunction> getBuiltins() {
    return BUILTINS.values();
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * @return false only for functions that can count rows without a measure
   */
  public boolean isMeasureRequired() {
    return measureRequired;
  }

  public boolean isCount() {
    return this.equals(COUNT);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AggregateFunction)) {
      return false;
    }
    AggregateFunction other = (AggregateFunction) obj;
    return name.equals(other.name) && measureRequired == other.measureRequired;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
