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
 * A resolved join of a cube: master key, detail key, effective name of the
 * detail side and cardinality method.
 */
public final class CubeJoin {
  private final TableReference master;
  private final TableReference detail;
  private final String alias;
  private final JoinMethod method;

  public CubeJoin(TableReference master, TableReference detail, String alias,
      JoinMethod method) {
    this.master = master;
    this.detail = detail;
    this.alias = alias;
    this.method = method;
  }

  public TableReference getMaster() {
    return master;
  }

  public TableReference getDetail() {
    return detail;
  }

  public String getMasterTable() {
    return master.getTable();
  }

  public String getMasterColumn() {
    return master.getColumn();
  }

  public String getDetailTable() {
    return detail.getTable();
  }

  public String getDetailColumn() {
    return detail.getColumn();
  }

  /**
   * @return declared alias, null when the join has none
   */
  public String getAlias() {
    return alias;
  }

  /**
   * Name under which the detail table is known within the cube: the alias
   * when one is declared, the detail table name otherwise.
   */
  public String getEffectiveName() {
    return alias != null ? alias : detail.getTable();
  }

  public JoinMethod getMethod() {
    return method;
  }

  /**
   * Join clause for this join, e.g.
   * {@code left outer join dim_date dim_date_detail on facts.date_id = dim_date_detail.id}
   */
  public String getJoinClause() {
    StringBuilder clause = new StringBuilder(method.getJoinTypeStr().trim())
        .append(" join ").append(detail.getTable());
    if (alias != null) {
      clause.append(" ").append(alias);
    }
    clause.append(" on ").append(master.toString())
        .append(" = ").append(getEffectiveName()).append(".")
        .append(detail.getColumn());
    return clause.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CubeJoin)) {
      return false;
    }
    CubeJoin other = (CubeJoin) obj;
    return master.equals(other.master) && detail.equals(other.detail)
        && getEffectiveName().equals(other.getEffectiveName())
        && method == other.method;
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    return master + "->" + detail + " as " + getEffectiveName() + " (" + method + ")";
  }
}
