package dev.semanticcut.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the remote embedding model.
 *
 * <p>The {@link RestClient} carries the bearer token as a default header when one is configured;
 * {@link OpenRouterEmbeddingModel} refuses to run without it.
 */
@Configuration
public class EmbeddingConfig {

    @Bean
    public RestClient embeddingRestClient(RestClient.Builder builder, EmbeddingProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.timeout());
        requestFactory.setReadTimeout(properties.timeout());

        RestClient.Builder configured = builder.clone()
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (properties.hasApiKey()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
        }
        return configured.build();
    }

    /**
     * Embedding model used for both query embedding and catalog indexing.
     *
     * @param embeddingRestClient client bound to the embeddings endpoint
     * @param properties          model id, dimension and credentials
     * @return the remote embedding model
     */
    @Bean
    public EmbeddingModel embeddingModel(
            @Qualifier("embeddingRestClient") RestClient embeddingRestClient,
            EmbeddingProperties properties) {
        return new OpenRouterEmbeddingModel(embeddingRestClient, properties);
    }
}
