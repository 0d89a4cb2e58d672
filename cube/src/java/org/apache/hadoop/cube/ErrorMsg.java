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
package org.apache.hadoop.cube;

import java.text.MessageFormat;

/**
 * List of error messages raised while building a cube model. Each message
 * carries a stable error code; the text is a {@link MessageFormat} pattern
 * filled with the arguments given to {@link CubeModelException}.
 */
public enum ErrorMsg {
  // 30000 to 30099: dimension registry
  DUPLICATE_NAME(30001, "Duplicate {0} ''{1}'' in {2}"),
  UNKNOWN_TEMPLATE(30002, "Template ''{1}'' of dimension ''{0}'' is not registered"),
  CYCLIC_TEMPLATE(30003, "Cyclic template reference for dimension ''{0}'': {1}"),
  NOT_FOUND(30004, "No dimension with name ''{0}''"),
  NO_LEVELS(30005, "No levels specified for {0} ''{1}''"),
  UNKNOWN_LEVEL(30006, "Level ''{1}'' is not part of {0}"),
  UNKNOWN_ATTRIBUTE(30007, "Attribute ''{1}'' is not an attribute of level ''{0}''"),
  UNKNOWN_HIERARCHY(30008, "Cannot determine hierarchy ''{1}'' of dimension ''{0}''"),
  BLANK_NAME(30009, "Blank name given for {0} in {1}"),

  // 30100 to 30199: cube builder
  UNKNOWN_DIMENSION(30101, "Cube ''{0}'' references unknown dimension ''{1}''"),
  UNKNOWN_FACT(30102, "Cube ''{0}'' has unknown fact table ''{1}''"),
  DUPLICATE_AGGREGATE_NAME(30103, "Cube ''{0}'' declares aggregate ''{1}'' more than once"),
  INVALID_MEASURE(30104, "Cube ''{0}'' has invalid measure or detail ''{1}''"),
  UNKNOWN_CUBE(30105, "No cube with name ''{0}''"),

  // 30200 to 30299: join resolver
  MALFORMED_REFERENCE(30201, "Join {1} reference ''{2}'' of cube ''{0}'' is not of the form table.column"),
  AMBIGUOUS_ALIAS(30202, "Cube ''{0}'' joins ''{1}'' more than once, use distinct aliases"),
  UNKNOWN_DIMENSION_TABLE(30203, "Cube ''{0}'' joins unknown table ''{1}''"),
  UNKNOWN_JOIN_METHOD(30204, "Unknown join method ''{1}'' in cube ''{0}''"),

  // 30300 to 30399: aggregate planner
  UNKNOWN_FUNCTION(30301, "Aggregate ''{1}'' of cube ''{0}'' uses unknown function ''{2}''"),
  MEASURE_REQUIRED(30302, "Aggregate ''{1}'' of cube ''{0}'' requires a measure for function ''{2}''"),
  UNKNOWN_MEASURE(30303, "Aggregate ''{1}'' of cube ''{0}'' references unknown measure ''{2}''"),
  INVALID_AGGREGATE_REFERENCE(30304, "Invalid aggregate reference ''{0}''. Did you mean ''{1}''?"),

  // 30400 to 30499: model lifecycle and loading
  MODEL_FROZEN(30401, "Model build context is {0}, no further changes are accepted"),
  INVALID_SCHEMA_DOCUMENT(30402, "Invalid schema document: {0}"),
  ;

  private final int errorCode;
  private final String mesg;

  ErrorMsg(int errorCode, String mesg) {
    this.errorCode = errorCode;
    this.mesg = mesg;
  }

  public int getErrorCode() {
    return errorCode;
  }

  public String getMsg() {
    return mesg;
  }

  public String format(String... args) {
    return MessageFormat.format(mesg, (Object[]) args);
  }
}
