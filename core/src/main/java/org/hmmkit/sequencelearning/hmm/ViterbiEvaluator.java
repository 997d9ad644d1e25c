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
 * Command-line tool for decoding the most likely hidden state sequence of an observed sequence
 */
public final class ViterbiEvaluator {
  private static final Logger log = LoggerFactory.getLogger(ViterbiEvaluator.class);

  private ViterbiEvaluator() {
  }

  public static void main(String[] args) throws IOException {
    final DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    final ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    final Option inputOption = optionBuilder.withLongName("input").
      withDescription("Text file with space-separated observed state indices").
      withShortName("i").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option outputOption = optionBuilder.withLongName("output").
      withDescription("Output file with the decoded hidden state indices").
      withShortName("o").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option modelOption = optionBuilder.withLongName("model").
      withDescription("Path to serialized HMM model").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option directOption = optionBuilder.withLongName("direct").
      withDescription("Multiply raw probabilities instead of adding log probabilities").
      withShortName("d").withRequired(false).create();

    final Group optionGroup = new GroupBuilder().withOption(inputOption).
      withOption(outputOption).withOption(modelOption).withOption(directOption).
      withName("Options").create();

    try {
      final Parser parser = new Parser();
      parser.setGroup(optionGroup);
      final CommandLine commandLine = parser.parse(args);

      final String input = (String) commandLine.getValue(inputOption);
      final String output = (String) commandLine.getValue(outputOption);
      final String modelPath = (String) commandLine.getValue(modelOption);
      final boolean scaled = !commandLine.hasOption(directOption);

      final HmmModel model = SequenceFiles.readModel(modelPath);
      final int[] observations = SequenceFiles.readSequence(input);
      log.info("Decoding {} observations from {}", observations.length, input);

      final ViterbiResult result = new ViterbiDecoder(model, scaled).decode(observations);
      SequenceFiles.writeSequence(output, result.getPath());

      System.out.println((scaled ? "Log probability of the decoded path: " : "Probability of the decoded path: ")
        + result.getProbability());
    } catch (OptionException e) {
      CommandLineUtil.printHelpWithError(optionGroup, e);
    }
  }
}
