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

/**
 * Raw join between a master key and a detail key, both written as
 * {@code table.column}.
 */
public class JoinSpec {
  private String master;
  private String detail;
  private String method;
  private String alias;

  public JoinSpec() {
  }

  public JoinSpec(String master, String detail) {
    this(master, detail, null, null);
  }

  public JoinSpec(String master, String detail, String method, String alias) {
    this.master = master;
    this.detail = detail;
    this.method = method;
    this.alias = alias;
  }

  public String getMaster() {
    return master;
  }

  public void setMaster(String master) {
    this.master = master;
  }

  public String getDetail() {
    return detail;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public String getAlias() {
    return alias;
  }

  public void setAlias(String alias) {
    this.alias = alias;
  }

  @Override
  public String toString() {
    return master + " -> " + detail + (alias == null ? "" : " as " + alias)
        + (method == null ? "" : " (" + method + ")");
  }
}
