package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.EmbeddingException;
import com.gentoro.onerag.utility.StringUtility;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * OpenAI embeddings. The API has no document/query task distinction, so both roles share one
 * request shape.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {
  private final OpenAIClient client;
  private final String model;
  private final String modelVersion;
  private final Long dimensions;

  public OpenAiEmbeddingProvider(
      OpenAIClient client, String model, String modelVersion, Long dimensions) {
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
    List<float[]> vectors = request(texts);
    List<EmbeddingResult> out = new ArrayList<>(texts.size());
    for (int i = 0; i < vectors.size(); i++) {
      out.add(
          new EmbeddingResult(
              vectors.get(i), StringUtility.wordCount(texts.get(i)), model, modelVersion));
    }
    return out;
  }

  @Override
  public EmbeddingResult embedQuery(String text) {
    List<float[]> vectors = request(List.of(text));
    if (vectors.isEmpty()) {
      throw new EmbeddingException(EmbeddingException.Kind.FATAL, "OpenAI returned no embedding");
    }
    return new EmbeddingResult(vectors.get(0), StringUtility.wordCount(text), model, modelVersion);
  }

  private List<float[]> request(List<String> texts) {
    EmbeddingCreateParams.Builder params =
        EmbeddingCreateParams.builder().model(model).inputOfArrayOfStrings(texts);
    if (dimensions != null) {
      params.dimensions(dimensions);
    }
    CreateEmbeddingResponse response;
    try {
      response = client.embeddings().create(params.build());
    } catch (OpenAIServiceException e) {
      throw new EmbeddingException(
          EmbeddingException.classify(e.statusCode(), e.getMessage()),
          e.statusCode(),
          "OpenAI embedding failed: " + e.getMessage(),
          e);
    } catch (OpenAIIoException e) {
      throw new EmbeddingException(
          EmbeddingException.Kind.TRANSIENT, null, "OpenAI embedding I/O failure", e);
    } catch (OpenAIException e) {
      throw new EmbeddingException(
          EmbeddingException.classify(null, e.getMessage()),
          null,
          "OpenAI embedding failed: " + e.getMessage(),
          e);
    }

    List<Embedding> data = new ArrayList<>(response.data());
    data.sort(Comparator.comparingLong(Embedding::index));
    List<float[]> vectors = new ArrayList<>(data.size());
    for (Embedding embedding : data) {
      List<? extends Number> values = embedding.embedding();
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = values.get(i).floatValue();
      }
      vectors.add(vector);
    }
    return vectors;
  }
}
