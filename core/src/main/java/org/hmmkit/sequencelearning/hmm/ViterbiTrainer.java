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

import org.apache.commons.cli2.CommandLine;
import org.apache.commons.cli2.Group;
import org.apache.commons.cli2.Option;
import org.apache.commons.cli2.OptionException;
import org.apache.commons.cli2.builder.ArgumentBuilder;
import org.apache.commons.cli2.builder.DefaultOptionBuilder;
import org.apache.commons.cli2.builder.GroupBuilder;
import org.apache.commons.cli2.commandline.Parser;
import org.hmmkit.common.CommandLineUtil;

import java.io.IOException;

/**
 * A class for Viterbi training of HMM from console. The initial model is either read from a
 * serialized model or generated randomly from the given numbers of states.
 */
public final class ViterbiTrainer {

  private ViterbiTrainer() {
  }

  public static void main(String[] args) throws IOException {
    final DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    final ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    final Option inputOption = optionBuilder.withLongName("input").
      withDescription("Text file with space-separated integers to train on").
      withShortName("i").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option outputOption = optionBuilder.withLongName("output").
      withDescription("Path trained HMM model should be serialized to").
      withShortName("o").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option modelOption = optionBuilder.withLongName("model").
      withDescription("Path to the serialized initial HMM model, excludes the random model options").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(false).create();

    final Option stateNumberOption = optionBuilder.withLongName("nrOfHiddenStates").
      withDescription("Number of hidden states of a random initial model").
      withShortName("nh").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option observedStateNumberOption = optionBuilder.withLongName("nrOfObservedStates").
      withDescription("Number of observed states of a random initial model").
      withShortName("no").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option seedOption = optionBuilder.withLongName("seed").
      withDescription("Seed for the random initial model, current time if omitted").
      withShortName("s").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option epsilonOption = optionBuilder.withLongName("epsilon").
      withDescription("Convergence threshold on the decoded path probability").
      withShortName("e").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").withDefault(String.valueOf(ViterbiTrainingParams.DEFAULT_EPSILON)).create()).
      withRequired(false).create();

    final Option iterationsOption = optionBuilder.withLongName("max-iterations").
      withDescription("Maximum iterations number").
      withShortName("x").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").withDefault(String.valueOf(ViterbiTrainingParams.DEFAULT_MAX_ITERATIONS)).create()).
      withRequired(false).create();

    final Option pseudoCountOption = optionBuilder.withLongName("pseudo-count").
      withDescription("Value added to every transition and emission count").
      withShortName("p").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").withDefault("0").create()).withRequired(false).create();

    final Option uniformOption = optionBuilder.withLongName("uniform-empty-rows").
      withDescription("Fill rows without counts uniformly instead of keeping the previous estimate").
      withShortName("u").withRequired(false).create();

    final Group optionGroup = new GroupBuilder().withOption(inputOption).
      withOption(outputOption).withOption(modelOption).withOption(stateNumberOption).
      withOption(observedStateNumberOption).withOption(seedOption).withOption(epsilonOption).
      withOption(iterationsOption).withOption(pseudoCountOption).withOption(uniformOption).
      withName("Options").create();

    try {
      final Parser parser = new Parser();
      parser.setGroup(optionGroup);
      final CommandLine commandLine = parser.parse(args);

      final String input = (String) commandLine.getValue(inputOption);
      final String output = (String) commandLine.getValue(outputOption);

      final ViterbiTrainingParams params = new ViterbiTrainingParams().
        setEpsilon(Double.parseDouble((String) commandLine.getValue(epsilonOption,
          String.valueOf(ViterbiTrainingParams.DEFAULT_EPSILON)))).
        setMaxIterations(Integer.parseInt((String) commandLine.getValue(iterationsOption,
          String.valueOf(ViterbiTrainingParams.DEFAULT_MAX_ITERATIONS)))).
        setPseudoCount(Double.parseDouble((String) commandLine.getValue(pseudoCountOption, "0"))).
        setEmptyRowStrategy(commandLine.hasOption(uniformOption)
          ? EmptyRowStrategy.UNIFORM : EmptyRowStrategy.KEEP_PREVIOUS);

      //constructing the initial HMM
      final HmmModel model;
      if (commandLine.hasOption(modelOption)
        && (commandLine.hasOption(stateNumberOption) || commandLine.hasOption(observedStateNumberOption))) {
        System.err.println("--model can not be combined with --nrOfHiddenStates or --nrOfObservedStates");
        CommandLineUtil.printHelp(optionGroup);
        return;
      } else if (commandLine.hasOption(modelOption)) {
        model = SequenceFiles.readModel((String) commandLine.getValue(modelOption));
      } else if (commandLine.hasOption(stateNumberOption) && commandLine.hasOption(observedStateNumberOption)) {
        final int nrOfHiddenStates = Integer.parseInt((String) commandLine.getValue(stateNumberOption));
        final int nrOfObservedStates = Integer.parseInt((String) commandLine.getValue(observedStateNumberOption));
        final long seed = commandLine.hasOption(seedOption)
          ? Long.parseLong((String) commandLine.getValue(seedOption))
          : System.currentTimeMillis();
        model = new HmmModel(nrOfHiddenStates, nrOfObservedStates, seed);
      } else {
        System.err.println("Either --model or both --nrOfHiddenStates and --nrOfObservedStates are required");
        CommandLineUtil.printHelp(optionGroup);
        return;
      }

      //reading observations
      final int[] observations = SequenceFiles.readSequence(input);

      //training
      final ViterbiTrainingResult result = HmmTrainer.trainViterbi(model, observations, params);

      //serializing trained model
      SequenceFiles.writeModel(output, result.getModel());

      //printing trained model
      System.out.println(result.isConverged()
        ? "Converged after " + result.getIterations() + " iterations"
        : "Did not converge after " + result.getIterations() + " iterations");
      System.out.println("Path probability: " + result.getProbability());
      System.out.println();
      System.out.print(HmmModelPrinter.format(result.getModel()));
    } catch (OptionException e) {
      CommandLineUtil.printHelpWithError(optionGroup, e);
    }
  }
}
