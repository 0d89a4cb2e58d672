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

/**
 * Validation failure raised while registering dimensions or building cubes.
 * The failure names the offending entity and the field that made it
 * invalid.
 */
public class CubeModelException extends Exception {

  private static final long serialVersionUID = 1L;

  private final ErrorMsg errorMsg;
  private final String entity;
  private final String field;

  /**
   * @param errorMsg canonical error
   * @param entity name of the dimension, cube or document at fault
   * @param field field of the entity at fault
   * @param msgArgs arguments of the message pattern
   */
  public CubeModelException(ErrorMsg errorMsg, String entity, String field,
      String... msgArgs) {
    super(errorMsg.format(msgArgs));
    this.errorMsg = errorMsg;
    this.entity = entity;
    this.field = field;
  }

  public CubeModelException(ErrorMsg errorMsg, String entity, String field,
      Throwable cause, String... msgArgs) {
    super(errorMsg.format(msgArgs), cause);
    this.errorMsg = errorMsg;
    this.entity = entity;
    this.field = field;
  }

  public ErrorMsg getCanonicalErrorMsg() {
    return errorMsg;
  }

  public String getEntity() {
    return entity;
  }

  public String getField() {
    return field;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + errorMsg.getErrorCode() + "] "
        + entity + "." + field + ": " + getMessage();
  }
}
