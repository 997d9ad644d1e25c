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

/**
 * Trained model together with how the training went. A run that hit the iteration limit
 * is reported with {@link #isConverged()} false and still carries its last estimate.
 */
public final class ViterbiTrainingResult {
  private final HmmModel model;
  private final int iterations;
  private final boolean converged;
  private final ViterbiResult lastDecoding;

  ViterbiTrainingResult(HmmModel model, int iterations, boolean converged, ViterbiResult lastDecoding) {
    this.model = model;
    this.iterations = iterations;
    this.converged = converged;
    this.lastDecoding = lastDecoding;
  }

  public HmmModel getModel() {
    return model;
  }

  /**
   * @return number of decodings performed
   */
  public int getIterations() {
    return iterations;
  }

  public boolean isConverged() {
    return converged;
  }

  public double getProbability() {
    return lastDecoding.getProbability();
  }

  public ViterbiResult getLastDecoding() {
    return lastDecoding;
  }
}
