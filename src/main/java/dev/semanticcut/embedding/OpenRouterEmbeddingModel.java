package dev.semanticcut.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * LangChain4j {@link EmbeddingModel} backed by an OpenAI-compatible embeddings API (OpenRouter,
 * Qwen3-Embedding-8B by default).
 *
 * <p>Batches all segments into one request. Response items are re-ordered by their {@code index}
 * field before being returned. Any failure is raised as {@link EmbeddingException}; there is no
 * fallback and no retry.
 */
public class OpenRouterEmbeddingModel implements EmbeddingModel {

  private static final Logger log = LoggerFactory.getLogger(OpenRouterEmbeddingModel.class);

  static final String EMBEDDINGS_PATH = "/embeddings";

  private final RestClient restClient;
  private final EmbeddingProperties properties;

  public OpenRouterEmbeddingModel(RestClient restClient, EmbeddingProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    if (!properties.hasApiKey()) {
      throw new EmbeddingException(
          "Embedding API key is required (semanticcut.embedding.api-key / OPENROUTER_API_KEY)");
    }
    if (textSegments.isEmpty()) {
      return Response.from(List.of());
    }

    List<String> inputs = textSegments.stream().map(TextSegment::text).toList();
    log.info(
        "Embedding batch_size={}, model={}, preview={}",
        inputs.size(),
        properties.model(),
        preview(inputs.get(0)));

    EmbeddingApiResponse response;
    try {
      response =
          restClient
              .post()
              .uri(EMBEDDINGS_PATH)
              .body(new EmbeddingApiRequest(properties.model(), inputs))
              .retrieve()
              .body(EmbeddingApiResponse.class);
    } catch (RestClientException e) {
      throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
    }

    if (response == null || response.data() == null || response.data().size() != inputs.size()) {
      throw new EmbeddingException(
          "Embedding provider returned %d vectors for %d inputs"
              .formatted(
                  response == null || response.data() == null ? 0 : response.data().size(),
                  inputs.size()));
    }

    List<Embedding> embeddings =
        response.data().stream()
            .sorted(Comparator.comparingInt(EmbeddingApiResponse.Item::index))
            .map(item -> Embedding.from(item.embedding()))
            .toList();
    log.debug("Received {} vectors, dim={}", embeddings.size(), embeddings.get(0).dimension());
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return properties.dimension();
  }

  private static String preview(String text) {
    return text.length() > 60 ? text.substring(0, 60) + "..." : text;
  }
}
