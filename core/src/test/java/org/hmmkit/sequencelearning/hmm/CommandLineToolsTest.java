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

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.hmmkit.common.HmmKitTestCase;
import org.hmmkit.sequencelearning.hmm.example.LoadedDieExample;
import org.junit.Test;

import java.io.File;
import java.io.IOException;

public class CommandLineToolsTest extends HmmKitTestCase {

  @Test
  public void testGenerateTrainAndDecode() throws Exception {
    File truthFile = getTestTempFile("truth.hmm");
    File observedFile = getTestTempFile("observed.txt");
    File hiddenFile = getTestTempFile("hidden.txt");
    File trainedFile = getTestTempFile("trained.hmm");
    File decodedFile = getTestTempFile("decoded.txt");

    SequenceFiles.writeModel(truthFile.getPath(), LoadedDieExample.loadedDieModel());

    RandomSequenceGenerator.main(new String[] {
      "--model", truthFile.getPath(), "--output", observedFile.getPath(),
      "--hidden", hiddenFile.getPath(), "--length", "200", "--seed", "515"});
    int[] observed = SequenceFiles.readSequence(observedFile.getPath());
    int[] hidden = SequenceFiles.readSequence(hiddenFile.getPath());
    assertEquals(200, observed.length);
    assertEquals(200, hidden.length);
    assertArrayEquals(HmmEvaluator.predict(LoadedDieExample.loadedDieModel(), 200, 515).getOutputStates(), observed);

    ViterbiTrainer.main(new String[] {
      "--input", observedFile.getPath(), "--output", trainedFile.getPath(),
      "--model", truthFile.getPath(), "--max-iterations", "5"});
    HmmModel trained = SequenceFiles.readModel(trainedFile.getPath());
    assertEquals(LoadedDieExample.DIE_FACES, trained.getOutputStateNames());
    assertTrue(HmmUtils.isRowStochastic(trained.getEmissionMatrix(), EPSILON));

    ViterbiEvaluator.main(new String[] {
      "--input", observedFile.getPath(), "--output", decodedFile.getPath(), "--model", trainedFile.getPath()});
    int[] decoded = SequenceFiles.readSequence(decodedFile.getPath());
    assertArrayEquals(HmmEvaluator.decode(trained, observed, true), decoded);
  }

  @Test
  public void testTrainFromRandomModel() throws Exception {
    File observedFile = getTestTempFile("observed.txt");
    File trainedFile = getTestTempFile("trained.hmm");
    SequenceFiles.writeSequence(observedFile.getPath(), new int[] {0, 1, 2, 2, 1, 0, 0, 2});

    ViterbiTrainer.main(new String[] {
      "-i", observedFile.getPath(), "-o", trainedFile.getPath(), "-nh", "2", "-no", "3", "-s", "9", "-u"});
    HmmModel trained = SequenceFiles.readModel(trainedFile.getPath());
    assertEquals(2, trained.getNrOfHiddenStates());
    assertEquals(3, trained.getNrOfOutputStates());
    assertTrue(HmmUtils.isRowStochastic(trained.getTransitionMatrix(), EPSILON));
  }

  @Test
  public void testModelExcludesRandomModelOptions() throws Exception {
    File modelFile = getTestTempFile("initial.hmm");
    File observedFile = getTestTempFile("observed.txt");
    File trainedFile = getTestTempFile("trained.hmm");
    SequenceFiles.writeModel(modelFile.getPath(), LoadedDieExample.loadedDieModel());
    SequenceFiles.writeSequence(observedFile.getPath(), new int[] {0, 5, 5, 5, 1});

    ViterbiTrainer.main(new String[] {
      "-i", observedFile.getPath(), "-o", trainedFile.getPath(), "-m", modelFile.getPath(), "-nh", "3", "-no", "6"});
    assertFalse(trainedFile.exists());
  }

  @Test
  public void testMissingRequiredOptionWritesNothing() throws Exception {
    File observedFile = getTestTempFile("observed.txt");
    RandomSequenceGenerator.main(new String[] {"--output", observedFile.getPath()});
    assertFalse(observedFile.exists());
  }

  @Test(expected = IOException.class)
  public void testMalformedSequenceFile() throws Exception {
    File file = getTestTempFile("bad.txt");
    Files.write("0 1 x 2", file, Charsets.UTF_8);
    SequenceFiles.readSequence(file.getPath());
  }
}
