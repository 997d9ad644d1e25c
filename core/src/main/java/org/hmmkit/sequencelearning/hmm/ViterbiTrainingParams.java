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

/**
 * Parameters for {@link HmmTrainer#trainViterbi(HmmModel, int[], ViterbiTrainingParams)}.
 */
public class ViterbiTrainingParams {
  public static final double DEFAULT_EPSILON = 1e-6;
  public static final int DEFAULT_MAX_ITERATIONS = 100;

  private double epsilon = DEFAULT_EPSILON;
  private int maxIterations = DEFAULT_MAX_ITERATIONS;
  private boolean scaled = true;
  private double pseudoCount = 0;
  private EmptyRowStrategy emptyRowStrategy = EmptyRowStrategy.KEEP_PREVIOUS;

  /**
   * Training stops once the decoded path probability changes by less than this value
   * between two iterations.
   */
  public ViterbiTrainingParams setEpsilon(double value) {
    if (Double.isNaN(value) || value < 0)
      throw new IllegalArgumentException("epsilon must be non-negative: " + value);
    this.epsilon = value;
    return this;
  }

  /**
   * Upper bound of decode/re-estimate rounds.
   */
  public ViterbiTrainingParams setMaxIterations(int value) {
    if (value <= 0)
      throw new IllegalArgumentException("maxIterations must be positive: " + value);
    this.maxIterations = value;
    return this;
  }

  /**
   * Whether to decode with log probabilities. On by default, long sequences underflow otherwise.
   */
  public ViterbiTrainingParams setScaled(boolean value) {
    this.scaled = value;
    return this;
  }

  /**
   * Added to every transition and emission count before normalization.
   */
  public ViterbiTrainingParams setPseudoCount(double value) {
    if (Double.isNaN(value) || value < 0)
      throw new IllegalArgumentException("pseudoCount must be non-negative: " + value);
    this.pseudoCount = value;
    return this;
  }

  public ViterbiTrainingParams setEmptyRowStrategy(EmptyRowStrategy value) {
    if (value == null)
      throw new NullArgumentException("emptyRowStrategy");
    this.emptyRowStrategy = value;
    return this;
  }

  public double getEpsilon() {
    return epsilon;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public boolean isScaled() {
    return scaled;
  }

  public double getPseudoCount() {
    return pseudoCount;
  }

  public EmptyRowStrategy getEmptyRowStrategy() {
    return emptyRowStrategy;
  }
}
