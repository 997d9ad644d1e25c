/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hmmkit.common;

import com.google.common.io.Files;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;

import java.io.File;
import java.io.IOException;

/**
 * Base class for the HmmKit tests
 */
public abstract class HmmKitTestCase extends Assert {
  /** tolerance for comparing probabilities */
  public static final double EPSILON = 1.0e-6;

  private File testTempDir;

  @Before
  public void setUp() throws Exception {
  }

  @After
  public void tearDown() throws Exception {
    if (testTempDir != null) {
      File[] files = testTempDir.listFiles();
      if (files != null) {
        for (File file : files) {
          if (!file.delete())
            throw new IOException("Could not delete " + file);
        }
      }
      if (!testTempDir.delete())
        throw new IOException("Could not delete " + testTempDir);
      testTempDir = null;
    }
  }

  /**
   * A file in a directory private to the running test, removed after the test
   */
  protected final File getTestTempFile(String name) {
    if (testTempDir == null)
      testTempDir = Files.createTempDir();
    return new File(testTempDir, name);
  }
}
