package dev.semanticcut.ingest;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the scene catalog, bound from {@code semanticcut.catalog.*}.
 *
 * @param scenesPath JSON array of scenes; feeds the filter vocabulary and catalog indexing
 */
@ConfigurationProperties(prefix = "semanticcut.catalog")
public record CatalogProperties(@Nullable Path scenesPath) {}
