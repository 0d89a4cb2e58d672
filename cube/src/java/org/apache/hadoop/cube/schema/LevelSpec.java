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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Raw level definition. An empty attribute list means a single attribute
 * named like the level.
 */
public class LevelSpec {
  private String name;
  private List<String> attributes = new ArrayList<String>();
  private String key;
  private String labelAttribute;
  private String orderAttribute;
  private String label;

  public LevelSpec() {
  }

  public LevelSpec(String name, String... attributes) {
    this.name = name;
    this.attributes = new ArrayList<String>(Arrays.asList(attributes));
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<String> getAttributes() {
    return attributes;
  }

  public void setAttributes(List<String> attributes) {
    this.attributes = attributes;
  }

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public String getLabelAttribute() {
    return labelAttribute;
  }

  public void setLabelAttribute(String labelAttribute) {
    this.labelAttribute = labelAttribute;
  }

  public String getOrderAttribute() {
    return orderAttribute;
  }

  public void setOrderAttribute(String orderAttribute) {
    this.orderAttribute = orderAttribute;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }
}
