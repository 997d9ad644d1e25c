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

import java.util.List;

/**
 * A hidden state sequence together with the output states emitted along it.
 * Both sequences always have the same length.
 */
public final class HmmSequence {
  private final int[] hiddenStates;
  private final int[] outputStates;

  public HmmSequence(int[] hiddenStates, int[] outputStates) {
    if (hiddenStates == null)
      throw new NullArgumentException("hiddenStates");
    if (outputStates == null)
      throw new NullArgumentException("outputStates");
    if (hiddenStates.length != outputStates.length)
      throw new IllegalArgumentException("Sequences differ in length: " + hiddenStates.length +
        " hidden, " + outputStates.length + " observed");
    this.hiddenStates = hiddenStates.clone();
    this.outputStates = outputStates.clone();
  }

  public int length() {
    return hiddenStates.length;
  }

  public int[] getHiddenStates() {
    return hiddenStates.clone();
  }

  public int[] getOutputStates() {
    return outputStates.clone();
  }

  public List<String> getHiddenStateNames(LabelSpace names) {
    return names.decode(hiddenStates);
  }

  public List<String> getOutputStateNames(LabelSpace names) {
    return names.decode(outputStates);
  }
}
