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

import org.apache.mahout.math.Vector;

import java.util.Random;

/**
 * Static entry points for using a trained model: sampling sequences from it and decoding
 * observed sequences with it.
 */
public final class HmmEvaluator {

  private HmmEvaluator() {
  }

  /**
   * Samples a hidden state sequence from the model and an output state for every hidden state.
   * @param model model to sample from
   * @param length number of steps
   * @param seed seed of the random generator, the same seed gives the same sequences
   */
  public static HmmSequence predict(HmmModel model, int length, long seed) {
    return predict(model, length, new Random(seed));
  }

  /**
   * Same as {@link #predict(HmmModel, int, long)} with a time based seed
   */
  public static HmmSequence predict(HmmModel model, int length) {
    return predict(model, length, new Random());
  }

  private static HmmSequence predict(HmmModel model, int length, Random random) {
    HmmUtils.validate(model);
    if (length <= 0)
      throw new IllegalArgumentException("length must be positive: " + length);

    int[] hiddenStates = new int[length];
    int[] outputStates = new int[length];

    int state = sample(model.getInitialProbabilities(), random);
    for (int t = 0; t < length; ++t) {
      if (t > 0)
        state = sample(model.getTransitionMatrix().viewRow(state), random);
      hiddenStates[t] = state;
      outputStates[t] = sample(model.getEmissionMatrix().viewRow(state), random);
    }

    return new HmmSequence(hiddenStates, outputStates);
  }

  /**
   * Draws an index with probability proportional to its weight
   */
  private static int sample(Vector distribution, Random random) {
    double sum = 0;
    for (int i = 0; i < distribution.size(); ++i)
      sum += distribution.getQuick(i);
    if (sum <= 0)
      throw new IllegalArgumentException("Can not sample from a distribution without mass");

    double threshold = random.nextDouble() * sum;
    int lastPositive = 0;
    for (int i = 0; i < distribution.size(); ++i) {
      double weight = distribution.getQuick(i);
      if (weight <= 0)
        continue;
      lastPositive = i;
      threshold -= weight;
      if (threshold < 0)
        return i;
    }
    //rounding left some mass over
    return lastPositive;
  }

  /**
   * Decodes the most likely hidden state sequence for the given output states.
   * @param scaled use log probabilities
   */
  public static int[] decode(HmmModel model, int[] observations, boolean scaled) {
    return new ViterbiDecoder(model, scaled).decode(observations).getPath();
  }
}
