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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.apache.commons.lang.NullArgumentException;
import org.apache.mahout.math.Matrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders models as markdown tables and aligned sequences as fixed width blocks, for the
 * command line tools.
 */
public final class HmmModelPrinter {
  public static final int DEFAULT_LINE_WIDTH = 60;

  private HmmModelPrinter() {
  }

  /**
   * Three tables: initial probabilities as the "Begin" row, the transition matrix
   * and the emission matrix. States without names are shown by index.
   */
  public static String format(HmmModel model) {
    List<String> hiddenNames = names(model.getHiddenStateNames(), model.getNrOfHiddenStates());
    List<String> outputNames = names(model.getOutputStateNames(), model.getNrOfOutputStates());

    List<String> header = new ArrayList<String>();
    header.add("Transitions");
    header.addAll(hiddenNames);

    List<List<String>> begin = new ArrayList<List<String>>();
    List<String> row = new ArrayList<String>();
    row.add("Begin");
    for (int i = 0; i < model.getNrOfHiddenStates(); ++i)
      row.add(String.valueOf(model.getInitialProbabilities().getQuick(i)));
    begin.add(row);

    StringBuilder builder = new StringBuilder();
    table(header, begin, builder);
    builder.append('\n');
    table(header, rows(model.getTransitionMatrix(), hiddenNames), builder);
    builder.append('\n');

    header = new ArrayList<String>();
    header.add("Emissions");
    header.addAll(outputNames);
    table(header, rows(model.getEmissionMatrix(), hiddenNames), builder);
    return builder.toString();
  }

  /**
   * Prints sequences of equal length one above the other, cut into blocks of
   * {@code lineWidth} symbols. Every symbol is printed as is, so single character names line up.
   * @param sequences caption to sequence, in printing order
   */
  public static String formatSequences(Map<String, String> sequences, int lineWidth) {
    if (sequences == null)
      throw new NullArgumentException("sequences");
    if (lineWidth <= 0)
      throw new IllegalArgumentException("lineWidth must be positive: " + lineWidth);

    int captionWidth = 0;
    int length = 0;
    for (Map.Entry<String, String> entry : sequences.entrySet()) {
      captionWidth = Math.max(captionWidth, entry.getKey().length());
      length = Math.max(length, entry.getValue().length());
    }

    StringBuilder builder = new StringBuilder();
    for (int start = 0; start < length; start += lineWidth) {
      for (Map.Entry<String, String> entry : sequences.entrySet()) {
        String sequence = entry.getValue();
        builder.append(Strings.padEnd(entry.getKey(), captionWidth, ' ')).append(": ");
        if (start < sequence.length())
          builder.append(sequence, start, Math.min(sequence.length(), start + lineWidth));
        builder.append('\n');
      }
      builder.append('\n');
    }
    return builder.toString();
  }

  /**
   * Convenience for the usual observed / actual / decoded triple
   */
  public static String formatSequences(List<String> observed, List<String> actual, List<String> decoded) {
    Map<String, String> sequences = new LinkedHashMap<String, String>();
    sequences.put("Observed", Joiner.on("").join(observed));
    if (actual != null)
      sequences.put("Actual", Joiner.on("").join(actual));
    sequences.put("Viterbi", Joiner.on("").join(decoded));
    return formatSequences(sequences, DEFAULT_LINE_WIDTH);
  }

  private static List<String> names(LabelSpace space, int size) {
    if (space != null)
      return space.getLabels();
    List<String> names = new ArrayList<String>(size);
    for (int i = 0; i < size; ++i)
      names.add(String.valueOf(i));
    return names;
  }

  private static List<List<String>> rows(Matrix matrix, List<String> rowNames) {
    List<List<String>> rows = new ArrayList<List<String>>();
    for (int i = 0; i < matrix.numRows(); ++i) {
      List<String> row = new ArrayList<String>();
      row.add(rowNames.get(i));
      for (int j = 0; j < matrix.numCols(); ++j)
        row.add(String.valueOf(matrix.getQuick(i, j)));
      rows.add(row);
    }
    return rows;
  }

  private static void table(List<String> header, List<List<String>> rows, StringBuilder builder) {
    int[] widths = new int[header.size()];
    for (int j = 0; j < widths.length; ++j) {
      widths[j] = header.get(j).length();
      for (List<String> row : rows)
        widths[j] = Math.max(widths[j], row.get(j).length());
    }

    line(header, widths, builder);
    builder.append('|');
    for (int width : widths)
      builder.append(Strings.repeat("-", width + 2)).append('|');
    builder.append('\n');
    for (List<String> row : rows)
      line(row, widths, builder);
  }

  private static void line(List<String> cells, int[] widths, StringBuilder builder) {
    builder.append('|');
    for (int j = 0; j < widths.length; ++j)
      builder.append(' ').append(Strings.padEnd(cells.get(j), widths[j], ' ')).append(" |");
    builder.append('\n');
  }
}
