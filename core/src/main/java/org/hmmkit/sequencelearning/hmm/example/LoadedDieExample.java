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

package org.hmmkit.sequencelearning.hmm.example;

import org.hmmkit.sequencelearning.hmm.HmmEvaluator;
import org.hmmkit.sequencelearning.hmm.HmmModel;
import org.hmmkit.sequencelearning.hmm.HmmModelPrinter;
import org.hmmkit.sequencelearning.hmm.HmmSequence;
import org.hmmkit.sequencelearning.hmm.HmmTrainer;
import org.hmmkit.sequencelearning.hmm.LabelSpace;
import org.hmmkit.sequencelearning.hmm.ViterbiDecoder;
import org.hmmkit.sequencelearning.hmm.ViterbiResult;
import org.hmmkit.sequencelearning.hmm.ViterbiTrainingParams;
import org.hmmkit.sequencelearning.hmm.ViterbiTrainingResult;

import java.util.List;

/**
 * The occasionally dishonest casino: a fair die (F) is sometimes swapped for a die loaded
 * towards six (L). Rolls sampled from {@link #loadedDieModel()} are decoded. Then rolls
 * sampled from {@link #heavilyLoadedDieModel()} are used to re-estimate
 * {@link #loadedDieModel()} by Viterbi training.
 */
public final class LoadedDieExample {
  public static final LabelSpace DIE_STATES = LabelSpace.of("F", "L");
  public static final LabelSpace DIE_FACES = LabelSpace.of("1", "2", "3", "4", "5", "6");

  private static final long SEED = 515;

  private LoadedDieExample() {
  }

  public static HmmModel loadedDieModel() {
    double sixth = 1.0 / 6;
    return HmmModel.fromArrays(
      new double[][] {{0.95, 0.05}, {0.10, 0.90}},
      new double[][] {{sixth, sixth, sixth, sixth, sixth, sixth}, {0.1, 0.1, 0.1, 0.1, 0.1, 0.5}},
      new double[] {0.9999, 0.0001}).
      registerHiddenStateNames(DIE_STATES).registerOutputStateNames(DIE_FACES);
  }

  /**
   * Swaps dice less often than {@link #loadedDieModel()} and shows six 80% of the time
   * with the loaded die
   */
  public static HmmModel heavilyLoadedDieModel() {
    double sixth = 1.0 / 6;
    return HmmModel.fromArrays(
      new double[][] {{0.95, 0.05}, {0.05, 0.95}},
      new double[][] {{sixth, sixth, sixth, sixth, sixth, sixth}, {0.04, 0.04, 0.04, 0.04, 0.04, 0.8}},
      new double[] {0.9999, 0.0001}).
      registerHiddenStateNames(DIE_STATES).registerOutputStateNames(DIE_FACES);
  }

  public static void main(String[] args) {
    int rolls = args.length > 0 ? Integer.parseInt(args[0]) : 300;
    int trainingRolls = args.length > 1 ? Integer.parseInt(args[1]) : 10000;

    HmmModel truth = loadedDieModel();
    System.out.println("Truth:");
    System.out.println(HmmModelPrinter.format(truth));

    HmmSequence sample = HmmEvaluator.predict(truth, rolls, SEED);
    List<String> observed = sample.getOutputStateNames(DIE_FACES);

    ViterbiResult decoded = new ViterbiDecoder(truth, true).decode(observed);
    System.out.print(HmmModelPrinter.formatSequences(observed, sample.getHiddenStateNames(DIE_STATES),
      decoded.getLabeledPath()));
    System.out.println("Log probability of the decoded path: " + decoded.getProbability());
    System.out.println();

    HmmModel heavy = heavilyLoadedDieModel();
    System.out.println("Truth:");
    System.out.println(HmmModelPrinter.format(heavy));
    List<String> trainingSet = HmmEvaluator.predict(heavy, trainingRolls, SEED).getOutputStateNames(DIE_FACES);

    ViterbiTrainingResult trained = HmmTrainer.trainViterbi(loadedDieModel(), trainingSet,
      new ViterbiTrainingParams().setMaxIterations(15));
    System.out.println((trained.isConverged() ? "Converged after " : "Stopped after ")
      + trained.getIterations() + " iterations");
    System.out.println("Estimated:");
    System.out.println(HmmModelPrinter.format(trained.getModel()));
  }
}
