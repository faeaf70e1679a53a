package com.flamingo.ai.climatechat.service.rag.embedding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Lexical token weights produced by a sparse (SPLADE-style) encoder. */
public record SparseVector(List<Integer> indices, List<Float> values) {

  public SparseVector {
    if (indices.size() != values.size()) {
      throw new IllegalArgumentException(
          "Sparse vector has " + indices.size() + " indices but " + values.size() + " values");
    }
    indices = List.copyOf(indices);
    values = List.copyOf(values);
  }

  public static SparseVector empty() {
    return new SparseVector(List.of(), List.of());
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  /** Returns a copy with every weight multiplied by {@code factor}. */
  public SparseVector scale(double factor) {
    List<Float> scaled = new ArrayList<>(values.size());
    for (Float value : values) {
      scaled.add((float) (value * factor));
    }
    return new SparseVector(indices, scaled);
  }

  /** Token id to weight map, the shape expected by a {@code sparse_vector} query. */
  public Map<String, Float> toTokenWeights() {
    Map<String, Float> weights = new LinkedHashMap<>();
    for (int i = 0; i < indices.size(); i++) {
      weights.merge(String.valueOf(indices.get(i)), values.get(i), Float::sum);
    }
    return weights;
  }
}
