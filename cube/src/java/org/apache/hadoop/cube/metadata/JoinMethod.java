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

/**
 * Cardinality method of a join between the fact table and a detail table.
 *
 * <ul>
 * <li>{@link #MATCH}: only fact rows with a matching detail row take part,
 * one detail row per fact row.</li>
 * <li>{@link #DETAIL}: every fact row is kept, detail attributes are empty
 * when there is no matching detail row.</li>
 * <li>{@link #MASTER}: marks the cube as usable as a fact source by other
 * cubes. The cube's own row set is left untouched.</li>
 * </ul>
 */
public enum JoinMethod {
  MATCH("match", " inner"),
  MASTER("master", " left outer"),
  DETAIL("detail", " left outer");

  private final String identifier;
  private final String joinTypeStr;

  JoinMethod(String identifier, String joinTypeStr) {
    this.identifier = identifier;
    this.joinTypeStr = joinTypeStr;
  }

  public String getIdentifier() {
    return identifier;
  }

  /**
   * @return join type a SQL consumer emits for this method, with a leading
   * space so it can be prepended to " join"
   */
  public String getJoinTypeStr() {
    return joinTypeStr;
  }

  public boolean filtersFactRows() {
    return this == MATCH;
  }

  public boolean preservesFactRows() {
    return this != MATCH;
  }

  public boolean marksFactSource() {
    return this == MASTER;
  }

  /**
   * @return the method with the given identifier, ignoring case, or null
   */
  public static JoinMethod forIdentifier(String identifier) {
    if (identifier == null) {
      return null;
    }
    for (JoinMethod method : values()) {
      if (method.identifier.equalsIgnoreCase(identifier.trim())) {
        return method;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return identifier;
  }
}
