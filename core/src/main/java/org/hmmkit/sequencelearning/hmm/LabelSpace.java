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

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang.NullArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered set of state or observation names. Each name gets the index of its position,
 * so the first name is 0, the second is 1 and so on. Both directions of the mapping are
 * kept in one {@link BiMap}.
 */
public final class LabelSpace {
  private final ImmutableList<String> labels;
  private final BiMap<String, Integer> indices;

  public LabelSpace(List<String> labels) {
    if (labels == null)
      throw new NullArgumentException("labels");
    if (labels.isEmpty())
      throw new IllegalArgumentException("Label space must contain at least one label");

    this.indices = HashBiMap.create(labels.size());
    for (String label : labels) {
      if (label == null)
        throw new NullArgumentException("label");
      if (indices.containsKey(label))
        throw new IllegalArgumentException("Duplicate label: " + label);
      indices.put(label, indices.size());
    }
    this.labels = ImmutableList.copyOf(labels);
  }

  public static LabelSpace of(String... labels) {
    return new LabelSpace(Arrays.asList(labels));
  }

  public int size() {
    return labels.size();
  }

  public List<String> getLabels() {
    return labels;
  }

  /**
   * @param label name to look up
   * @return index of the label
   * @throws IllegalArgumentException if the label is not part of this space
   */
  public int indexOf(String label) {
    Integer index = indices.get(label);
    if (index == null)
      throw new IllegalArgumentException("Unknown label: " + label);
    return index;
  }

  public String labelAt(int index) {
    String label = indices.inverse().get(index);
    if (label == null)
      throw new IllegalArgumentException("No label with index " + index);
    return label;
  }

  public boolean contains(String label) {
    return indices.containsKey(label);
  }

  /**
   * Maps every label of the sequence to its index
   */
  public int[] encode(List<String> sequence) {
    if (sequence == null)
      throw new NullArgumentException("sequence");
    int[] result = new int[sequence.size()];
    for (int i = 0; i < result.length; ++i)
      result[i] = indexOf(sequence.get(i));
    return result;
  }

  /**
   * Maps every index of the sequence back to its label
   */
  public List<String> decode(int[] sequence) {
    if (sequence == null)
      throw new NullArgumentException("sequence");
    List<String> result = new ArrayList<String>(sequence.length);
    for (int index : sequence)
      result.add(labelAt(index));
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof LabelSpace && labels.equals(((LabelSpace) obj).labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return labels.toString();
  }
}
