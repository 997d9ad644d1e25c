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

import java.util.List;

/**
 * Outcome of one {@link ViterbiDecoder#decode(int[])} call: the most likely hidden state
 * sequence, its probability and the tables it was extracted from.
 * Arrays are copied on the way in and on the way out.
 */
public final class ViterbiResult {
  private final int[] path;
  private final double probability;
  private final boolean scaled;
  private final double[][] delta;
  private final int[][] phi;
  private final LabelSpace hiddenStateNames;

  ViterbiResult(int[] path, double probability, boolean scaled, double[][] delta, int[][] phi,
                LabelSpace hiddenStateNames) {
    this.path = path.clone();
    this.probability = probability;
    this.scaled = scaled;
    this.delta = copy(delta);
    this.phi = copy(phi);
    this.hiddenStateNames = hiddenStateNames;
  }

  /**
   * @return decoded hidden state indices, one per observation
   */
  public int[] getPath() {
    return path.clone();
  }

  /**
   * @return decoded hidden state names
   * @throws IllegalStateException if the decoded model has no hidden state names
   */
  public List<String> getLabeledPath() {
    if (hiddenStateNames == null)
      throw new IllegalStateException("Model has no hidden state names");
    return hiddenStateNames.decode(path);
  }

  public int length() {
    return path.length;
  }

  /**
   * @return probability of the decoded path, a natural logarithm if {@link #isScaled()}
   */
  public double getProbability() {
    return probability;
  }

  public boolean isScaled() {
    return scaled;
  }

  /**
   * @return {@code delta[t][i]}, the probability of the best path ending in state i at time t
   */
  public double[][] getDelta() {
    return copy(delta);
  }

  /**
   * @return {@code phi[t][j]}, the state at time t on the best path into state j at time t+1
   */
  public int[][] getBackpointers() {
    return copy(phi);
  }

  private static double[][] copy(double[][] table) {
    double[][] result = new double[table.length][];
    for (int i = 0; i < table.length; ++i)
      result[i] = table[i].clone();
    return result;
  }

  private static int[][] copy(int[][] table) {
    int[][] result = new int[table.length][];
    for (int i = 0; i < table.length; ++i)
      result[i] = table[i].clone();
    return result;
  }
}
