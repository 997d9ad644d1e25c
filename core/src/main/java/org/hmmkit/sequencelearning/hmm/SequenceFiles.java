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

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * File access shared by the command line tools: whitespace separated state sequences
 * and serialized models.
 */
final class SequenceFiles {

  private SequenceFiles() {
  }

  static int[] readSequence(String path) throws IOException {
    final List<Integer> values = new ArrayList<Integer>();
    final FileInputStream inputStream = new FileInputStream(path);
    try {
      final Scanner scanner = new Scanner(inputStream, "UTF-8");
      while (scanner.hasNext()) {
        if (!scanner.hasNextInt())
          throw new IOException("Not a state index in " + path + ": " + scanner.next());
        values.add(scanner.nextInt());
      }
      scanner.close();
    } finally {
      inputStream.close();
    }

    final int[] result = new int[values.size()];
    for (int i = 0; i < result.length; ++i)
      result[i] = values.get(i);
    return result;
  }

  static void writeSequence(String path, int[] sequence) throws IOException {
    final PrintWriter writer = new PrintWriter(new FileOutputStream(path));
    try {
      for (int value : sequence) {
        writer.print(value);
        writer.print(' ');
      }
      writer.println();
    } finally {
      writer.close();
    }
  }

  static HmmModel readModel(String path) throws IOException {
    final DataInputStream stream = new DataInputStream(new FileInputStream(path));
    try {
      return HmmSerializer.deserialize(stream);
    } finally {
      stream.close();
    }
  }

  static void writeModel(String path, HmmModel model) throws IOException {
    final DataOutputStream stream = new DataOutputStream(new FileOutputStream(path));
    try {
      HmmSerializer.serialize(model, stream);
    } finally {
      stream.close();
    }
  }
}
