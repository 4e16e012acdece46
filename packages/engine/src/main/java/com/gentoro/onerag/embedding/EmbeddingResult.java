package com.gentoro.onerag.embedding;

/**
 * One embedding vector with the model that produced it.
 *
 * @param tokenCount approximate token count of the input (word count)
 */
public record EmbeddingResult(float[] vector, int tokenCount, String model, String modelVersion) {

  public int dimension() {
    return vector.length;
  }
}
