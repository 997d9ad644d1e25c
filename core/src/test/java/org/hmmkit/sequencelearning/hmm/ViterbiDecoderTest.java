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

import org.apache.mahout.math.DenseVector;
import org.hmmkit.common.HmmKitTestCase;
import org.hmmkit.sequencelearning.hmm.example.LoadedDieExample;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class ViterbiDecoderTest extends HmmKitTestCase {
  private HmmModel model;
  private int[] observations;

  @Override
  public void setUp() throws Exception {
    super.setUp();

    model = new HmmModel(2, 2);
    double e = 0.1;
    model.setInitialProbabilities(new DenseVector(new double[] {e, 1.0 - e}));

    model.getEmissionMatrix().set(0, 0, e);
    model.getEmissionMatrix().set(0, 1, 1.0 - e);
    model.getEmissionMatrix().set(1, 0, 1.0 - e);
    model.getEmissionMatrix().set(1, 1, e);
    model.getTransitionMatrix().set(0, 0, 0.7);
    model.getTransitionMatrix().set(0, 1, 0.3);
    model.getTransitionMatrix().set(1, 0, 0.4);
    model.getTransitionMatrix().set(1, 1, 0.6);

    observations = new int[] {1, 0, 0, 1};
  }

  @Test
  public void testSingleObservation() {
    for (boolean scaled : new boolean[] {true, false}) {
      ViterbiResult result = new ViterbiDecoder(model, scaled).decode(new int[] {0});
      assertEquals(1, result.length());
      //0.1 * 0.1 for state 0 against 0.9 * 0.9 for state 1
      assertArrayEquals(new int[] {1}, result.getPath());
      assertEquals(0, result.getBackpointers().length);
    }
  }

  @Test
  public void testDirectProbabilityMatchesBruteForce() {
    ViterbiResult result = new ViterbiDecoder(model, false).decode(observations);
    BruteForceViterbi expected = BruteForceViterbi.decode(model, observations, false);

    assertEquals(expected.probability, result.getProbability(), 0.0);
    assertArrayEquals(expected.path, result.getPath());
  }

  @Test
  public void testLogProbabilityMatchesBruteForce() {
    ViterbiResult result = new ViterbiDecoder(model, true).decode(observations);
    BruteForceViterbi direct = BruteForceViterbi.decode(model, observations, false);

    assertTrue(result.isScaled());
    assertEquals(direct.probability, Math.exp(result.getProbability()), EPSILON);
    assertArrayEquals(direct.path, result.getPath());
  }

  @Test
  public void testRandomModelsMatchBruteForce() {
    for (long seed = 1; seed <= 20; ++seed) {
      HmmModel randomModel = new HmmModel(3, 4, seed);
      int[] sample = HmmEvaluator.predict(randomModel, 6, seed).getOutputStates();

      for (boolean scaled : new boolean[] {true, false}) {
        ViterbiResult result = new ViterbiDecoder(randomModel, scaled).decode(sample);
        BruteForceViterbi expected = BruteForceViterbi.decode(randomModel, sample, scaled);
        assertEquals("seed " + seed, expected.probability, result.getProbability(), 1.0e-12);
        assertArrayEquals("seed " + seed, expected.path, result.getPath());
      }
    }
  }

  @Test
  public void testDeterministic() {
    ViterbiDecoder decoder = new ViterbiDecoder(model, true);
    ViterbiResult first = decoder.decode(observations);
    ViterbiResult second = new ViterbiDecoder(model, true).decode(observations);

    assertArrayEquals(first.getPath(), second.getPath());
    assertEquals(first.getProbability(), second.getProbability(), 0.0);
    for (int t = 0; t < observations.length; ++t)
      assertArrayEquals(first.getDelta()[t], second.getDelta()[t], 0.0);
  }

  @Test
  public void testTiesResolveToLowestState() {
    HmmModel flat = HmmModel.fromArrays(
      new double[][] {{0.5, 0.5}, {0.5, 0.5}},
      new double[][] {{0.5, 0.5}, {0.5, 0.5}},
      new double[] {0.5, 0.5});

    for (boolean scaled : new boolean[] {true, false}) {
      ViterbiResult result = new ViterbiDecoder(flat, scaled).decode(new int[] {0, 1, 1, 0});
      assertArrayEquals(new int[] {0, 0, 0, 0}, result.getPath());
      for (int[] backpointers : result.getBackpointers())
        assertArrayEquals(new int[] {0, 0}, backpointers);
    }
  }

  @Test
  public void testFirstPositionIsBacktracked() {
    HmmModel sticky = HmmModel.fromArrays(
      new double[][] {{0.9, 0.1}, {0.1, 0.9}},
      new double[][] {{0.9, 0.1}, {0.1, 0.9}},
      new double[] {0.1, 0.9});

    ViterbiResult result = new ViterbiDecoder(sticky, true).decode(new int[] {1, 1, 1});
    assertArrayEquals(new int[] {1, 1, 1}, result.getPath());
    assertEquals(result.getBackpointers()[0][result.getPath()[1]], result.getPath()[0]);
  }

  @Test
  public void testTables() {
    ViterbiResult result = new ViterbiDecoder(model, false).decode(observations);
    double[][] delta = result.getDelta();
    int[][] phi = result.getBackpointers();

    assertEquals(observations.length, delta.length);
    assertEquals(observations.length - 1, phi.length);
    assertEquals(0.1 * 0.9, delta[0][0], 0.0);
    assertEquals(0.9 * 0.1, delta[0][1], 0.0);
    //delta[1][0] = max(0.7 * 0.09, 0.4 * 0.09) * 0.1
    assertEquals(0.7 * (0.1 * 0.9) * 0.1, delta[1][0], 1.0e-15);
    assertEquals(0, phi[0][0]);

    //modifying the returned tables does not touch the result
    delta[0][0] = 42;
    assertEquals(0.1 * 0.9, result.getDelta()[0][0], 0.0);
  }

  @Test
  public void testZeroProbabilitiesStayFinite() {
    HmmModel strict = HmmModel.fromArrays(
      new double[][] {{1.0, 0.0}, {0.0, 1.0}},
      new double[][] {{1.0, 0.0}, {0.0, 1.0}},
      new double[] {1.0, 0.0});

    ViterbiResult result = new ViterbiDecoder(strict, true).decode(new int[] {0, 1, 0});
    assertFalse(Double.isInfinite(result.getProbability()));
    assertFalse(Double.isNaN(result.getProbability()));
    //a single emission mismatch on the best path
    assertEquals(Math.log(HmmUtils.LOG_EPSILON), result.getProbability(), 1.0e-9);
    assertArrayEquals(new int[] {0, 0, 0}, result.getPath());
  }

  @Test
  public void testLoadedDieMatchesBruteForce() {
    HmmModel die = LoadedDieExample.loadedDieModel();
    List<String> rolls = Arrays.asList("3", "1", "6", "6", "6", "6", "6", "6", "2", "6", "4", "5");

    ViterbiResult result = new ViterbiDecoder(die, true).decode(rolls);
    BruteForceViterbi expected = BruteForceViterbi.decode(die, LoadedDieExample.DIE_FACES.encode(rolls), true);

    assertEquals(expected.probability, result.getProbability(), 1.0e-9);
    assertArrayEquals(expected.path, result.getPath());
    assertEquals(LoadedDieExample.DIE_STATES.decode(expected.path), result.getLabeledPath());
    assertEquals(Arrays.asList("F", "F", "L", "L", "L", "L", "L", "L", "L", "L", "L", "L"), result.getLabeledPath());
  }

  @Test
  public void testLongRunOfSixesIsLoaded() {
    HmmModel die = LoadedDieExample.loadedDieModel();
    List<String> rolls = Arrays.asList("1", "3", "2", "6", "6", "6", "6", "6", "6", "6", "6", "4", "2", "5");

    List<String> decoded = new ViterbiDecoder(die, true).decode(rolls).getLabeledPath();
    assertEquals("F", decoded.get(0));
    assertEquals("L", decoded.get(6));
    assertEquals(rolls.size(), decoded.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySequenceRejected() {
    new ViterbiDecoder(model, true).decode(new int[0]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownObservationIndexRejected() {
    new ViterbiDecoder(model, true).decode(new int[] {0, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownObservationLabelRejected() {
    new ViterbiDecoder(LoadedDieExample.loadedDieModel(), true).decode(Arrays.asList("1", "7"));
  }

  @Test(expected = IllegalStateException.class)
  public void testLabelsRequireOutputStateNames() {
    new ViterbiDecoder(model, true).decode(Arrays.asList("0", "1"));
  }

  @Test(expected = IllegalStateException.class)
  public void testLabeledPathRequiresHiddenStateNames() {
    new ViterbiDecoder(model, true).decode(observations).getLabeledPath();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedModelRejected() {
    model.setInitialProbabilities(new DenseVector(new double[] {0.5, -0.5}));
    new ViterbiDecoder(model, true);
  }
}
