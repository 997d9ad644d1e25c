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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command-line tool for sampling an observed sequence, and optionally the hidden sequence
 * behind it, from a serialized HMM
 */
public final class RandomSequenceGenerator {
  private static final Logger log = LoggerFactory.getLogger(RandomSequenceGenerator.class);

  private RandomSequenceGenerator() {
  }

  public static void main(String[] args) throws IOException {
    final DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    final ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    final Option outputOption = optionBuilder.withLongName("output").
      withDescription("Output file with sequence of observed states").
      withShortName("o").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option hiddenOption = optionBuilder.withLongName("hidden").
      withDescription("Output file with sequence of hidden states the observations were emitted from").
      withShortName("hs").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(false).create();

    final Option modelOption = optionBuilder.withLongName("model").
      withDescription("Path to serialized HMM model").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option lengthOption = optionBuilder.withLongName("length").
      withDescription("Length of generated sequence").
      withShortName("l").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(true).create();

    final Option seedOption = optionBuilder.withLongName("seed").
      withDescription("Seed of the random generator, current time if omitted").
      withShortName("s").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Group optionGroup = new GroupBuilder().
      withOption(outputOption).withOption(hiddenOption).withOption(modelOption).
      withOption(lengthOption).withOption(seedOption).
      withName("Options").create();

    try {
      final Parser parser = new Parser();
      parser.setGroup(optionGroup);
      final CommandLine commandLine = parser.parse(args);

      final String output = (String) commandLine.getValue(outputOption);
      final String modelPath = (String) commandLine.getValue(modelOption);
      final int length = Integer.parseInt((String) commandLine.getValue(lengthOption));
      final long seed = commandLine.hasOption(seedOption)
        ? Long.parseLong((String) commandLine.getValue(seedOption))
        : System.currentTimeMillis();

      //reading serialized HMM
      final HmmModel model = SequenceFiles.readModel(modelPath);

      //generating observations
      log.info("Sampling {} observations with seed {}", length, seed);
      final HmmSequence sequence = HmmEvaluator.predict(model, length, seed);

      //writing output
      SequenceFiles.writeSequence(output, sequence.getOutputStates());
      if (commandLine.hasOption(hiddenOption))
        SequenceFiles.writeSequence((String) commandLine.getValue(hiddenOption), sequence.getHiddenStates());
    } catch (OptionException e) {
      CommandLineUtil.printHelpWithError(optionGroup, e);
    }
  }
}
