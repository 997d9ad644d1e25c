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

/**
 * Helpers shared by the decoder and the trainer: model validation, log transformation
 * and row normalization of count matrices.
 */
public final class HmmUtils {

  /**
   * Shift added to every probability before taking its logarithm, so that a zero probability
   * maps to a finite value ({@code log(LOG_EPSILON)}, about -36.04) instead of negative infinity.
   * It is the double precision machine epsilon, the gap between 1.0 and the next double.
   */
  public static final double LOG_EPSILON = Math.ulp(1.0);

  private HmmUtils() {
  }

  /**
   * Checks that the dimensions of the model parameters agree with each other and that no
   * probability is NaN or lies outside [0, 1].
   * @throws IllegalArgumentException if the model is malformed
   */
  public static void validate(HmmModel model) {
    if (model == null)
      throw new NullArgumentException("model");

    Vector initialProbabilities = model.getInitialProbabilities();
    Matrix transitionMatrix = model.getTransitionMatrix();
    Matrix emissionMatrix = model.getEmissionMatrix();

    int nrOfHiddenStates = initialProbabilities.size();
    if (nrOfHiddenStates == 0)
      throw new IllegalArgumentException("Model must have at least one hidden state");
    if (transitionMatrix.numRows() != nrOfHiddenStates)
      throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
        " does not match transition matrix rows " + transitionMatrix.numRows());
    if (transitionMatrix.numCols() != nrOfHiddenStates)
      throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
        " does not match transition matrix columns " + transitionMatrix.numCols());
    if (emissionMatrix.numRows() != nrOfHiddenStates)
      throw new IllegalArgumentException("Number of hidden states " + nrOfHiddenStates +
        " does not match emission matrix rows " + emissionMatrix.numRows());
    if (emissionMatrix.numCols() == 0)
      throw new IllegalArgumentException("Model must have at least one output state");

    for (int i = 0; i < nrOfHiddenStates; ++i) {
      checkProbability(initialProbabilities.getQuick(i), "initial probability", i, 0);
      for (int j = 0; j < nrOfHiddenStates; ++j)
        checkProbability(transitionMatrix.getQuick(i, j), "transition probability", i, j);
      for (int k = 0; k < emissionMatrix.numCols(); ++k)
        checkProbability(emissionMatrix.getQuick(i, k), "emission probability", i, k);
    }

    if (model.getHiddenStateNames() != null && model.getHiddenStateNames().size() != nrOfHiddenStates)
      throw new IllegalArgumentException("Hidden state names do not match the number of hidden states");
    if (model.getOutputStateNames() != null
      && model.getOutputStateNames().size() != emissionMatrix.numCols())
      throw new IllegalArgumentException("Output state names do not match the number of output states");
  }

  private static void checkProbability(double value, String name, int row, int column) {
    if (Double.isNaN(value) || value < 0 || value > 1)
      throw new IllegalArgumentException("Invalid " + name + " at (" + row + ", " + column + "): " + value);
  }

  /**
   * @return {@code log(probability + LOG_EPSILON)}
   */
  public static double logProbability(double probability) {
    return Math.log(probability + LOG_EPSILON);
  }

  /**
   * Divides every row of the count matrix by its sum. A row that sums up to zero
   * can not be normalized and is filled according to the given strategy.
   * @param counts count matrix, modified in place
   * @param previous distributions used by {@link EmptyRowStrategy#KEEP_PREVIOUS}, same shape as counts
   * @param strategy what to do with rows without counts
   * @return number of rows that had no counts
   */
  public static int normalizeRows(Matrix counts, Matrix previous, EmptyRowStrategy strategy) {
    int emptyRows = 0;
    for (int i = 0; i < counts.numRows(); ++i) {
      double sum = 0;
      for (int j = 0; j < counts.numCols(); ++j)
        sum += counts.getQuick(i, j);

      if (sum > 0) {
        for (int j = 0; j < counts.numCols(); ++j)
          counts.setQuick(i, j, counts.getQuick(i, j) / sum);
        continue;
      }

      ++emptyRows;
      for (int j = 0; j < counts.numCols(); ++j) {
        if (strategy == EmptyRowStrategy.KEEP_PREVIOUS)
          counts.setQuick(i, j, previous.getQuick(i, j));
        else
          counts.setQuick(i, j, 1.0 / counts.numCols());
      }
    }
    return emptyRows;
  }

  /**
   * @return true if every row of the matrix sums up to 1 within the given tolerance
   */
  public static boolean isRowStochastic(Matrix matrix, double tolerance) {
    for (int i = 0; i < matrix.numRows(); ++i) {
      double sum = 0;
      for (int j = 0; j < matrix.numCols(); ++j) {
        double value = matrix.getQuick(i, j);
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0)
          return false;
        sum += value;
      }
      if (Math.abs(sum - 1.0) > tolerance)
        return false;
    }
    return true;
  }

  static double[][] toArray(Matrix matrix) {
    double[][] result = new double[matrix.numRows()][matrix.numCols()];
    for (int i = 0; i < result.length; ++i) {
      for (int j = 0; j < result[i].length; ++j)
        result[i][j] = matrix.getQuick(i, j);
    }
    return result;
  }

  static Matrix copyOf(Matrix matrix) {
    return new DenseMatrix(toArray(matrix));
  }

  static Vector copyOf(Vector vector) {
    DenseVector result = new DenseVector(vector.size());
    for (int i = 0; i < vector.size(); ++i)
      result.setQuick(i, vector.getQuick(i));
    return result;
  }
}
