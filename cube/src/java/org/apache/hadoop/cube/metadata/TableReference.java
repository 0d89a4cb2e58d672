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

import org.apache.commons.lang.StringUtils;

/**
 * Reference to a column of a physical table, written as table.column.
 */
public final class TableReference {
  private final String table;
  private final String column;

  public TableReference(String table, String column) {
    this.table = table;
    this.column = column;
  }

  /**
   * Parse a table.column reference, splitting on the last dot.
   *
   * @return the reference, or null when either side is blank or there is no
   * dot at all
   */
  public static TableReference parse(String reference) {
    if (StringUtils.isBlank(reference)) {
      return null;
    }
    int dot = reference.lastIndexOf('.');
    if (dot < 0) {
      return null;
    }
    String table = reference.substring(0, dot).trim();
    String column = reference.substring(dot + 1).trim();
    if (table.isEmpty() || column.isEmpty()) {
      return null;
    }
    return new TableReference(table, column);
  }

  public String getTable() {
    return table;
  }

  public String getColumn() {
    return column;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TableReference)) {
      return false;
    }
    TableReference other = (TableReference) obj;
    return table.equals(other.table) && column.equals(other.column);
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    return table + "." + column;
  }
}
