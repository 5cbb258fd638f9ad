package dev.semanticcut.vector;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the Qdrant-backed {@link ClipVectorStore}.
 */
@Configuration
public class QdrantConfig {

    @Bean
    public RestClient qdrantRestClient(RestClient.Builder builder, QdrantProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.timeout());
        requestFactory.setReadTimeout(properties.timeout());

        RestClient.Builder configured = builder.clone()
                .baseUrl(properties.url())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (properties.hasApiKey()) {
            configured.defaultHeader("api-key", properties.apiKey());
        }
        return configured.build();
    }

    @Bean
    public ClipVectorStore clipVectorStore(
            @Qualifier("qdrantRestClient") RestClient qdrantRestClient, QdrantProperties properties) {
        return new QdrantClipVectorStore(qdrantRestClient, properties);
    }
}
