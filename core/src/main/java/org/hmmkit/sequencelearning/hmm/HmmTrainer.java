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
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Viterbi training: the observed sequence is decoded with the current model, the transition and
 * emission matrices are re-estimated by counting along the decoded path, and the two steps repeat
 * until the decoded path probability stops changing or the iteration limit is reached.
 * Initial probabilities are never re-estimated.
 */
public final class HmmTrainer {
  private static final Logger log = LoggerFactory.getLogger(HmmTrainer.class);

  private HmmTrainer() {
  }

  /**
   * Trains on a sequence of output state names, using the output state names of the model.
   * @throws IllegalStateException if the model has no output state names
   */
  public static ViterbiTrainingResult trainViterbi(HmmModel initialModel, List<String> observedSequence,
                                                   ViterbiTrainingParams params) {
    if (initialModel == null)
      throw new NullArgumentException("initialModel");
    if (observedSequence == null)
      throw new NullArgumentException("observedSequence");
    if (initialModel.getOutputStateNames() == null)
      throw new IllegalStateException("Model has no output state names, train on output state indices instead");
    return trainViterbi(initialModel, initialModel.getOutputStateNames().encode(observedSequence), params);
  }

  /**
   * @param initialModel starting point, left untouched
   * @param observedSequence output state indices to train on
   * @param params convergence threshold, iteration limit and re-estimation options
   * @return the trained model, the number of iterations and whether training converged
   */
  public static ViterbiTrainingResult trainViterbi(HmmModel initialModel, int[] observedSequence,
                                                   ViterbiTrainingParams params) {
    if (initialModel == null)
      throw new NullArgumentException("initialModel");
    if (observedSequence == null)
      throw new NullArgumentException("observedSequence");
    if (params == null)
      throw new NullArgumentException("params");

    HmmModel model = initialModel.clone();
    double previousProbability = Double.NaN;
    ViterbiResult decoded = null;

    for (int iteration = 1; iteration <= params.getMaxIterations(); ++iteration) {
      // a fresh decoder for every model, nothing is carried over between decodings
      decoded = new ViterbiDecoder(model, params.isScaled()).decode(observedSequence);
      log.info("Iteration {} path probability: {}", iteration, decoded.getProbability());

      if (!Double.isNaN(previousProbability)
        && Math.abs(previousProbability - decoded.getProbability()) < params.getEpsilon()) {
        log.info("Converged after {} iterations", iteration);
        return new ViterbiTrainingResult(model, iteration, true, decoded);
      }
      previousProbability = decoded.getProbability();

      model = reestimate(model, decoded.getPath(), observedSequence, params.getPseudoCount(),
        params.getEmptyRowStrategy());
    }

    log.info("Did not converge after {} iterations", params.getMaxIterations());
    return new ViterbiTrainingResult(model, params.getMaxIterations(), false, decoded);
  }

  /**
   * Estimates transition and emission probabilities by counting the transitions and emissions
   * along a hidden state path.
   * @param model model the path was decoded with; supplies initial probabilities, names and
   *              the rows kept for states without counts
   * @param hiddenSequence decoded hidden states
   * @param observedSequence observed states, same length as the hidden sequence
   * @param pseudoCount added to every count
   * @param strategy how to fill rows without counts
   * @return a new model, the given one is not modified
   */
  public static HmmModel reestimate(HmmModel model, int[] hiddenSequence, int[] observedSequence,
                                    double pseudoCount, EmptyRowStrategy strategy) {
    HmmUtils.validate(model);
    if (hiddenSequence == null)
      throw new NullArgumentException("hiddenSequence");
    if (observedSequence == null)
      throw new NullArgumentException("observedSequence");
    if (hiddenSequence.length != observedSequence.length)
      throw new IllegalArgumentException("Hidden sequence length " + hiddenSequence.length +
        " differs from observed sequence length " + observedSequence.length);

    int nrOfHiddenStates = model.getNrOfHiddenStates();
    int nrOfOutputStates = model.getNrOfOutputStates();
    for (int t = 0; t < hiddenSequence.length; ++t) {
      if (hiddenSequence[t] < 0 || hiddenSequence[t] >= nrOfHiddenStates)
        throw new IllegalArgumentException("Unknown hidden state " + hiddenSequence[t] + " at position " + t);
      if (observedSequence[t] < 0 || observedSequence[t] >= nrOfOutputStates)
        throw new IllegalArgumentException("Unknown output state " + observedSequence[t] + " at position " + t);
    }

    Matrix transitionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfHiddenStates).assign(pseudoCount);
    Matrix emissionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfOutputStates).assign(pseudoCount);

    for (int t = 1; t < hiddenSequence.length; ++t) {
      int from = hiddenSequence[t - 1];
      int to = hiddenSequence[t];
      transitionMatrix.setQuick(from, to, transitionMatrix.getQuick(from, to) + 1);
    }
    for (int t = 0; t < hiddenSequence.length; ++t) {
      int state = hiddenSequence[t];
      int output = observedSequence[t];
      emissionMatrix.setQuick(state, output, emissionMatrix.getQuick(state, output) + 1);
    }

    int emptyTransitions = HmmUtils.normalizeRows(transitionMatrix, model.getTransitionMatrix(), strategy);
    int emptyEmissions = HmmUtils.normalizeRows(emissionMatrix, model.getEmissionMatrix(), strategy);
    if (emptyTransitions > 0 || emptyEmissions > 0)
      log.debug("{} transition rows and {} emission rows had no counts, filled with {}",
        emptyTransitions, emptyEmissions, strategy);

    HmmModel result = new HmmModel(transitionMatrix, emissionMatrix,
      HmmUtils.copyOf(model.getInitialProbabilities()));
    result.registerHiddenStateNames(model.getHiddenStateNames());
    result.registerOutputStateNames(model.getOutputStateNames());
    return result;
  }
}
