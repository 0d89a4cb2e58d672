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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A level of a dimension hierarchy, holding an ordered list of attribute
 * names. The key attribute defaults to the first attribute, the label
 * attribute to the second one if present and the order attribute to the
 * first one.
 */
public final class Level implements Named {
  private final String name;
  private final List<String> attributes;
  private final String key;
  private final String labelAttribute;
  private final String orderAttribute;
  private final String label;

  public Level(String name) {
    this(name, null, null, null, null, null);
  }

  public Level(String name, List<String> attributes) {
    this(name, attributes, null, null, null, null);
  }

  /**
   * Attributes named by key, labelAttribute and orderAttribute must be
   * members of attributes; callers validate this before construction.
   */
  public Level(String name, List<String> attributes, String key,
      String labelAttribute, String orderAttribute, String label) {
    if (name == null) {
      throw new NullPointerException("Level name cannot be null");
    }
    this.name = name;
    List<String> attrs = new ArrayList<String>();
    if (attributes == null || attributes.isEmpty()) {
      attrs.add(name);
    } else {
      attrs.addAll(attributes);
    }
    this.attributes = Collections.unmodifiableList(attrs);
    this.key = key != null ? key : attrs.get(0);
    if (labelAttribute != null) {
      this.labelAttribute = labelAttribute;
    } else if (attrs.size() > 1) {
      this.labelAttribute = attrs.get(1);
    } else {
      this.labelAttribute = this.key;
    }
    this.orderAttribute = orderAttribute != null ? orderAttribute : attrs.get(0);
    this.label = label;
  }

  @Override
  public String getName() {
    return name;
  }

  public List<String> getAttributes() {
    return attributes;
  }

  public boolean hasAttribute(String attribute) {
    return attributes.contains(attribute);
  }

  public String getKey() {
    return key;
  }

  public String getLabelAttribute() {
    return labelAttribute;
  }

  public String getOrderAttribute() {
    return orderAttribute;
  }

  public String getLabel() {
    return label;
  }

  /**
   * @return true when the level carries more than its key attribute
   */
  public boolean hasDetails() {
    return attributes.size() > 1;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + attributes.hashCode();
    result = prime * result + key.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Level other = (Level) obj;
    if (!name.equals(other.name) || !attributes.equals(other.attributes)) {
      return false;
    }
    if (!key.equals(other.key)
        || !labelAttribute.equals(other.labelAttribute)
        || !orderAttribute.equals(other.orderAttribute)) {
      return false;
    }
    if (label == null) {
      return other.label == null;
    }
    return label.equals(other.label);
  }

  @Override
  public String toString() {
    return name + attributes;
  }
}
