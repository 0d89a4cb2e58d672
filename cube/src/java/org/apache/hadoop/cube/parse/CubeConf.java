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

import org.apache.hadoop.conf.Configuration;

/**
 * Configuration of the cube model build. Adds cube-default.xml and
 * cube-site.xml from the class path to the Hadoop resources.
 */
public class CubeConf extends Configuration {
  public static final String CUBE_DEFAULT_XML = "cube-default.xml";
  public static final String CUBE_SITE_XML = "cube-site.xml";

  static {
    Configuration.addDefaultResource(CUBE_DEFAULT_XML);
    Configuration.addDefaultResource(CUBE_SITE_XML);
  }

  public CubeConf() {
    super();
  }

  public CubeConf(Configuration other) {
    super(other);
  }
}
