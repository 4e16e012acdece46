package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.EmbeddingException;
import com.gentoro.onerag.utility.StringUtility;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentConfig;
import com.google.genai.types.EmbedContentResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Gemini embeddings using the {@code RETRIEVAL_DOCUMENT} task type for documents and {@code
 * RETRIEVAL_QUERY} for queries.
 */
public class GeminiEmbeddingProvider implements EmbeddingProvider {
  private static final String DOCUMENT_TASK = "RETRIEVAL_DOCUMENT";
  private static final String QUERY_TASK = "RETRIEVAL_QUERY";

  private final Client client;
  private final String model;
  private final String modelVersion;
  private final Integer dimensions;

  public GeminiEmbeddingProvider(
      Client client, String model, String modelVersion, Integer dimensions) {
    this.client = client;
    this.model = model;
    this.modelVersion = modelVersion;
    this.dimensions = dimensions;
  }

  @Override
  public String model() {
    return model;
  }

  @Override
  public String modelVersion() {
    return modelVersion;
  }

  @Override
  public List<EmbeddingResult> embedBatch(List<String> texts) {
    List<float[]> vectors = request(texts, DOCUMENT_TASK);
    List<EmbeddingResult> out = new ArrayList<>(vectors.size());
    for (int i = 0; i < vectors.size(); i++) {
      out.add(
          new EmbeddingResult(
              vectors.get(i), StringUtility.wordCount(texts.get(i)), model, modelVersion));
    }
    return out;
  }

  @Override
  public EmbeddingResult embedQuery(String text) {
    List<float[]> vectors = request(List.of(text), QUERY_TASK);
    if (vectors.isEmpty()) {
      throw new EmbeddingException(EmbeddingException.Kind.FATAL, "Gemini returned no embedding");
    }
    return new EmbeddingResult(vectors.get(0), StringUtility.wordCount(text), model, modelVersion);
  }

  private List<float[]> request(List<String> texts, String taskType) {
    EmbedContentConfig.Builder config = EmbedContentConfig.builder().taskType(taskType);
    if (dimensions != null) {
      config.outputDimensionality(dimensions);
    }
    EmbedContentResponse response;
    try {
      response = client.models.embedContent(model, texts, config.build());
    } catch (ApiException e) {
      throw new EmbeddingException(
          EmbeddingException.classify(e.code(), e.getMessage()),
          e.code(),
          "Gemini embedding failed: " + e.getMessage(),
          e);
    } catch (RuntimeException e) {
      throw new EmbeddingException(
          EmbeddingException.classify(null, e.getMessage()),
          null,
          "Gemini embedding failed: " + e.getMessage(),
          e);
    }

    List<float[]> vectors = new ArrayList<>();
    for (ContentEmbedding embedding : response.embeddings().orElse(List.of())) {
      List<Float> values = embedding.values().orElse(List.of());
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = values.get(i);
      }
      vectors.add(vector);
    }
    return vectors;
  }
}
