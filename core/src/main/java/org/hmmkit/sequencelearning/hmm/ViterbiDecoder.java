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

import org.apache.commons.lang.NullArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Viterbi algorithm: finds the most likely sequence of hidden states for a sequence of
 * observed states.
 * <p>
 * The model parameters are copied when the decoder is created and, in scaled mode, turned into
 * logarithms once (see {@link HmmUtils#LOG_EPSILON}). In scaled mode probabilities are added,
 * otherwise they are multiplied. Every {@link #decode(int[])} call builds its own tables, so
 * the decoder can be reused and shared.
 * <p>
 * Ties are broken towards the lowest state index, both when choosing a predecessor and
 * when choosing the final state.
 */
public class ViterbiDecoder {
  private static final Logger log = LoggerFactory.getLogger(ViterbiDecoder.class);

  private final boolean scaled;
  private final int nrOfHiddenStates;
  private final int nrOfOutputStates;
  private final double[] initialProbabilities;
  private final double[][] transitionProbabilities;
  private final double[][] emissionProbabilities;
  private final LabelSpace hiddenStateNames;
  private final LabelSpace outputStateNames;

  /**
   * @param model model to decode with
   * @param scaled true to work with log probabilities, false to multiply raw probabilities
   * @throws IllegalArgumentException if the model is malformed
   */
  public ViterbiDecoder(HmmModel model, boolean scaled) {
    HmmUtils.validate(model);
    this.scaled = scaled;
    this.nrOfHiddenStates = model.getNrOfHiddenStates();
    this.nrOfOutputStates = model.getNrOfOutputStates();
    this.hiddenStateNames = model.getHiddenStateNames();
    this.outputStateNames = model.getOutputStateNames();

    initialProbabilities = new double[nrOfHiddenStates];
    for (int i = 0; i < nrOfHiddenStates; ++i)
      initialProbabilities[i] = transform(model.getInitialProbabilities().getQuick(i));

    transitionProbabilities = HmmUtils.toArray(model.getTransitionMatrix());
    emissionProbabilities = HmmUtils.toArray(model.getEmissionMatrix());
    for (int i = 0; i < nrOfHiddenStates; ++i) {
      for (int j = 0; j < nrOfHiddenStates; ++j)
        transitionProbabilities[i][j] = transform(transitionProbabilities[i][j]);
      for (int k = 0; k < nrOfOutputStates; ++k)
        emissionProbabilities[i][k] = transform(emissionProbabilities[i][k]);
    }
  }

  private double transform(double probability) {
    return scaled ? HmmUtils.logProbability(probability) : probability;
  }

  private double combine(double first, double second) {
    return scaled ? first + second : first * second;
  }

  public boolean isScaled() {
    return scaled;
  }

  /**
   * Decodes a sequence of output state names.
   * @throws IllegalStateException if the model has no output state names
   * @throws IllegalArgumentException if a name is not an output state of the model
   */
  public ViterbiResult decode(List<String> observations) {
    if (observations == null)
      throw new NullArgumentException("observations");
    if (outputStateNames == null)
      throw new IllegalStateException("Model has no output state names, decode output state indices instead");
    return decode(outputStateNames.encode(observations));
  }

  /**
   * Decodes a sequence of output state indices.
   * @param observations output states, each in {@code [0, nrOfOutputStates)}
   * @throws IllegalArgumentException if the sequence is empty or contains an unknown output state
   */
  public ViterbiResult decode(int[] observations) {
    if (observations == null)
      throw new NullArgumentException("observations");
    if (observations.length == 0)
      throw new IllegalArgumentException("Can not decode an empty observation sequence");
    for (int t = 0; t < observations.length; ++t) {
      if (observations[t] < 0 || observations[t] >= nrOfOutputStates)
        throw new IllegalArgumentException("Observation " + observations[t] + " at position " + t +
          " is not an output state of the model");
    }

    log.debug("Decoding {} observations over {} hidden states", observations.length, nrOfHiddenStates);

    double[][] delta = new double[observations.length][nrOfHiddenStates];
    int[][] phi = new int[observations.length - 1][nrOfHiddenStates];

    for (int i = 0; i < nrOfHiddenStates; ++i)
      delta[0][i] = combine(initialProbabilities[i], emissionProbabilities[i][observations[0]]);

    for (int t = 1; t < observations.length; ++t) {
      for (int j = 0; j < nrOfHiddenStates; ++j) {
        int maxState = 0;
        double maxProb = combine(transitionProbabilities[0][j], delta[t - 1][0]);
        for (int i = 1; i < nrOfHiddenStates; ++i) {
          double currentProb = combine(transitionProbabilities[i][j], delta[t - 1][i]);
          if (currentProb > maxProb) {
            maxProb = currentProb;
            maxState = i;
          }
        }
        delta[t][j] = combine(maxProb, emissionProbabilities[j][observations[t]]);
        phi[t - 1][j] = maxState;
      }
    }

    int last = observations.length - 1;
    int[] path = new int[observations.length];
    path[last] = 0;
    for (int i = 1; i < nrOfHiddenStates; ++i) {
      if (delta[last][i] > delta[last][path[last]])
        path[last] = i;
    }
    double probability = delta[last][path[last]];

    for (int t = last - 1; t >= 0; --t)
      path[t] = phi[t][path[t + 1]];

    return new ViterbiResult(path, probability, scaled, delta, phi, hiddenStateNames);
  }
}
