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

import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary model format: number of hidden states, number of output states, initial probabilities,
 * transition matrix and emission matrix row by row, then the hidden and the output state names,
 * each one preceded by a presence flag.
 */
public final class HmmSerializer {

  private HmmSerializer() {
  }

  public static void serialize(HmmModel model, DataOutput output) throws IOException {
    HmmUtils.validate(model);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    int nrOfOutputStates = model.getNrOfOutputStates();
    output.writeInt(nrOfHiddenStates);
    output.writeInt(nrOfOutputStates);

    for (int i = 0; i < nrOfHiddenStates; ++i)
      output.writeDouble(model.getInitialProbabilities().getQuick(i));
    writeMatrix(model.getTransitionMatrix(), output);
    writeMatrix(model.getEmissionMatrix(), output);

    writeNames(model.getHiddenStateNames(), output);
    writeNames(model.getOutputStateNames(), output);
  }

  /**
   * @throws IOException if the stream ends early or holds an invalid model
   */
  public static HmmModel deserialize(DataInput input) throws IOException {
    int nrOfHiddenStates = input.readInt();
    int nrOfOutputStates = input.readInt();
    if (nrOfHiddenStates <= 0 || nrOfOutputStates <= 0)
      throw new IOException("Invalid model dimensions " + nrOfHiddenStates + " x " + nrOfOutputStates);

    Vector initialProbabilities = new DenseVector(nrOfHiddenStates);
    for (int i = 0; i < nrOfHiddenStates; ++i)
      initialProbabilities.setQuick(i, input.readDouble());
    Matrix transitionMatrix = readMatrix(nrOfHiddenStates, nrOfHiddenStates, input);
    Matrix emissionMatrix = readMatrix(nrOfHiddenStates, nrOfOutputStates, input);

    try {
      HmmModel model = new HmmModel(transitionMatrix, emissionMatrix, initialProbabilities);
      model.registerHiddenStateNames(readNames(input));
      model.registerOutputStateNames(readNames(input));
      return model;
    } catch (IllegalArgumentException e) {
      throw new IOException("Serialized model is invalid", e);
    }
  }

  private static void writeMatrix(Matrix matrix, DataOutput output) throws IOException {
    for (int i = 0; i < matrix.numRows(); ++i) {
      for (int j = 0; j < matrix.numCols(); ++j)
        output.writeDouble(matrix.getQuick(i, j));
    }
  }

  private static Matrix readMatrix(int rows, int columns, DataInput input) throws IOException {
    Matrix matrix = new DenseMatrix(rows, columns);
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < columns; ++j)
        matrix.setQuick(i, j, input.readDouble());
    }
    return matrix;
  }

  private static void writeNames(LabelSpace names, DataOutput output) throws IOException {
    output.writeBoolean(names != null);
    if (names == null)
      return;
    output.writeInt(names.size());
    for (String name : names.getLabels())
      output.writeUTF(name);
  }

  private static LabelSpace readNames(DataInput input) throws IOException {
    if (!input.readBoolean())
      return null;
    int size = input.readInt();
    List<String> names = new ArrayList<String>(size);
    for (int i = 0; i < size; ++i)
      names.add(input.readUTF());
    return new LabelSpace(names);
  }
}
