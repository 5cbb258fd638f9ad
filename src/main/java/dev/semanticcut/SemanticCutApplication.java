package dev.semanticcut;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Semantic Cut footage search service.
 *
 * <p>Exposes the search pipeline over REST (plain and SSE streaming) and as an MCP tool.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SemanticCutApplication {
    public static void main(String[] args) {
        SpringApplication.run(SemanticCutApplication.class, args);
    }
}
