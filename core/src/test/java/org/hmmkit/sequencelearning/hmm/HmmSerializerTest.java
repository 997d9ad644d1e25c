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

package org.hmmkit.sequencelearning.hmm;

import org.hmmkit.common.HmmKitTestCase;
import org.hmmkit.sequencelearning.hmm.example.LoadedDieExample;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

public class HmmSerializerTest extends HmmKitTestCase {

  @Test
  public void testNamedModel() throws IOException {
    HmmModel model = LoadedDieExample.loadedDieModel();
    HmmModel read = HmmSerializer.deserialize(new DataInputStream(new ByteArrayInputStream(toBytes(model))));

    assertEquals(LoadedDieExample.DIE_STATES, read.getHiddenStateNames());
    assertEquals(LoadedDieExample.DIE_FACES, read.getOutputStateNames());
    assertEquals(0.0001, read.getInitialProbabilities().get(1), 0.0);
    for (int i = 0; i < model.getNrOfHiddenStates(); ++i) {
      for (int j = 0; j < model.getNrOfOutputStates(); ++j)
        assertEquals(model.getEmissionMatrix().get(i, j), read.getEmissionMatrix().get(i, j), 0.0);
      for (int j = 0; j < model.getNrOfHiddenStates(); ++j)
        assertEquals(model.getTransitionMatrix().get(i, j), read.getTransitionMatrix().get(i, j), 0.0);
    }
  }

  @Test
  public void testUnnamedModel() throws IOException {
    HmmModel read = HmmSerializer.deserialize(
      new DataInputStream(new ByteArrayInputStream(toBytes(new HmmModel(3, 2)))));
    assertNull(read.getHiddenStateNames());
    assertNull(read.getOutputStateNames());
    assertEquals(3, read.getNrOfHiddenStates());
  }

  @Test(expected = IOException.class)
  public void testTruncatedStream() throws IOException {
    byte[] bytes = toBytes(LoadedDieExample.loadedDieModel());
    HmmSerializer.deserialize(new DataInputStream(new ByteArrayInputStream(Arrays.copyOf(bytes, 20))));
  }

  @Test(expected = IOException.class)
  public void testInvalidDimensions() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream output = new DataOutputStream(bytes);
    output.writeInt(0);
    output.writeInt(2);
    output.close();
    HmmSerializer.deserialize(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));
  }

  private static byte[] toBytes(HmmModel model) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream output = new DataOutputStream(bytes);
    HmmSerializer.serialize(model, output);
    output.close();
    return bytes.toByteArray();
  }
}
