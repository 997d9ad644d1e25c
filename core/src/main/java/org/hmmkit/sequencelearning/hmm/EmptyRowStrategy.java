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
 * How Viterbi training fills a row of the re-estimated transition or emission matrix
 * when the decoded path gives no counts for it (the state was never left, or never visited).
 */
public enum EmptyRowStrategy {
  /** copy the row of the model used in the current iteration */
  KEEP_PREVIOUS,
  /** spread the probability mass evenly over the row */
  UNIFORM
}
