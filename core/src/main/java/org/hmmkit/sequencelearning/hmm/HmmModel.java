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
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

import java.util.Random;

/**
 * Discrete Hidden Markov Model: initial hidden state probabilities, hidden state transition
 * matrix and emission matrix. Hidden states and observed (output) states are addressed by index;
 * optional {@link LabelSpace}s give them names.
 * <p>
 * The transition matrix is indexed as {@code [from][to]}, the emission matrix as
 * {@code [hiddenState][outputState]}.
 */
public class HmmModel implements Cloneable {
  private Vector initialProbabilities;
  private Matrix transitionMatrix;
  private Matrix emissionMatrix;

  private LabelSpace hiddenStateNames;
  private LabelSpace outputStateNames;

  /**
   * Creates a model from the given parameters.
   * @throws IllegalArgumentException if the dimensions of the parameters do not agree
   */
  public HmmModel(Matrix transitionMatrix, Matrix emissionMatrix, Vector initialProbabilities) {
    if (transitionMatrix == null)
      throw new NullArgumentException("transitionMatrix");
    if (emissionMatrix == null)
      throw new NullArgumentException("emissionMatrix");
    if (initialProbabilities == null)
      throw new NullArgumentException("initialProbabilities");

    this.transitionMatrix = transitionMatrix;
    this.emissionMatrix = emissionMatrix;
    this.initialProbabilities = initialProbabilities;
    HmmUtils.validate(this);
  }

  /**
   * Creates a model with uniform initial, transition and emission distributions
   */
  public HmmModel(int nrOfHiddenStates, int nrOfOutputStates) {
    checkSizes(nrOfHiddenStates, nrOfOutputStates);
    initialProbabilities = new DenseVector(nrOfHiddenStates).assign(1.0 / nrOfHiddenStates);
    transitionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfHiddenStates).assign(1.0 / nrOfHiddenStates);
    emissionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfOutputStates).assign(1.0 / nrOfOutputStates);
  }

  /**
   * Creates a model with random distributions, each one normalized to sum up to 1
   * @param seed seed of the random generator, the same seed gives the same model
   */
  public HmmModel(int nrOfHiddenStates, int nrOfOutputStates, long seed) {
    checkSizes(nrOfHiddenStates, nrOfOutputStates);
    Random random = new Random(seed);

    initialProbabilities = new DenseVector(nrOfHiddenStates);
    transitionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfHiddenStates);
    emissionMatrix = new DenseMatrix(nrOfHiddenStates, nrOfOutputStates);

    randomize(initialProbabilities, random);
    for (int i = 0; i < nrOfHiddenStates; ++i) {
      randomize(transitionMatrix.viewRow(i), random);
      randomize(emissionMatrix.viewRow(i), random);
    }
  }

  /**
   * Creates a model from plain arrays, checking that every row has the expected length.
   * @param transitionMatrix N x N transition probabilities
   * @param emissionMatrix N x M emission probabilities
   * @param initialProbabilities N initial probabilities
   * @throws IllegalArgumentException on any dimension mismatch
   */
  public static HmmModel fromArrays(double[][] transitionMatrix, double[][] emissionMatrix,
                                    double[] initialProbabilities) {
    if (transitionMatrix == null)
      throw new NullArgumentException("transitionMatrix");
    if (emissionMatrix == null)
      throw new NullArgumentException("emissionMatrix");
    if (initialProbabilities == null)
      throw new NullArgumentException("initialProbabilities");

    int nrOfHiddenStates = initialProbabilities.length;
    if (nrOfHiddenStates == 0)
      throw new IllegalArgumentException("Model must have at least one hidden state");
    if (transitionMatrix.length != nrOfHiddenStates)
      throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
        " does not match transition matrix rows " + transitionMatrix.length);
    for (int i = 0; i < transitionMatrix.length; ++i) {
      if (transitionMatrix[i] == null)
        throw new NullArgumentException("transitionMatrix[" + i + ']');
      if (transitionMatrix[i].length != nrOfHiddenStates)
        throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
          " does not match transition matrix row " + i);
    }
    if (emissionMatrix.length != nrOfHiddenStates)
      throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
        " does not match emission matrix rows " + emissionMatrix.length);
    for (int i = 0; i < emissionMatrix.length; ++i) {
      if (emissionMatrix[i] == null)
        throw new NullArgumentException("emissionMatrix[" + i + ']');
    }
    int nrOfOutputStates = emissionMatrix[0].length;
    for (int i = 0; i < emissionMatrix.length; ++i) {
      if (emissionMatrix[i].length != nrOfOutputStates)
        throw new IllegalArgumentException("Number of output states " + nrOfOutputStates +
          " does not match emission matrix row " + i);
    }

    return new HmmModel(new DenseMatrix(transitionMatrix), new DenseMatrix(emissionMatrix),
      new DenseVector(initialProbabilities));
  }

  private static void checkSizes(int nrOfHiddenStates, int nrOfOutputStates) {
    if (nrOfHiddenStates <= 0)
      throw new IllegalArgumentException("nrOfHiddenStates must be positive: " + nrOfHiddenStates);
    if (nrOfOutputStates <= 0)
      throw new IllegalArgumentException("nrOfOutputStates must be positive: " + nrOfOutputStates);
  }

  private static void randomize(Vector vector, Random random) {
    double sum = 0;
    for (int i = 0; i < vector.size(); ++i) {
      double value = random.nextDouble();
      vector.setQuick(i, value);
      sum += value;
    }
    for (int i = 0; i < vector.size(); ++i)
      vector.setQuick(i, vector.getQuick(i) / sum);
  }

  public int getNrOfHiddenStates() {
    return initialProbabilities.size();
  }

  public int getNrOfOutputStates() {
    return emissionMatrix.numCols();
  }

  public Vector getInitialProbabilities() {
    return initialProbabilities;
  }

  public void setInitialProbabilities(Vector initialProbabilities) {
    if (initialProbabilities == null)
      throw new NullArgumentException("initialProbabilities");
    if (initialProbabilities.size() != getNrOfHiddenStates())
      throw new IllegalArgumentException("Expected " + getNrOfHiddenStates() +
        " initial probabilities, got " + initialProbabilities.size());
    this.initialProbabilities = initialProbabilities;
  }

  public Matrix getTransitionMatrix() {
    return transitionMatrix;
  }

  public Matrix getEmissionMatrix() {
    return emissionMatrix;
  }

  public LabelSpace getHiddenStateNames() {
    return hiddenStateNames;
  }

  public LabelSpace getOutputStateNames() {
    return outputStateNames;
  }

  /**
   * Assigns names to the hidden states. The name list must have one entry per hidden state.
   */
  public HmmModel registerHiddenStateNames(LabelSpace names) {
    if (names != null && names.size() != getNrOfHiddenStates())
      throw new IllegalArgumentException("Expected " + getNrOfHiddenStates() +
        " hidden state names, got " + names.size());
    this.hiddenStateNames = names;
    return this;
  }

  /**
   * Assigns names to the output states. The name list must have one entry per output state.
   */
  public HmmModel registerOutputStateNames(LabelSpace names) {
    if (names != null && names.size() != getNrOfOutputStates())
      throw new IllegalArgumentException("Expected " + getNrOfOutputStates() +
        " output state names, got " + names.size());
    this.outputStateNames = names;
    return this;
  }

  /**
   * @return a deep copy of the probabilities, sharing the (immutable) name spaces
   */
  @Override
  public HmmModel clone() {
    HmmModel model = new HmmModel(HmmUtils.copyOf(transitionMatrix), HmmUtils.copyOf(emissionMatrix),
      HmmUtils.copyOf(initialProbabilities));
    model.hiddenStateNames = hiddenStateNames;
    model.outputStateNames = outputStateNames;
    return model;
  }
}
