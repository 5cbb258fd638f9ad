package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One spoken line of a clip.
 *
 * @param timestampStartSec line start in seconds (string timestamps are converted on read)
 * @param timestampEndSec line end in seconds
 * @param actor speaker
 * @param text screenplay line
 * @param actorContext optional stage direction for the speaker
 * @param delivery optional delivery note
 * @param actualDialogs the line as actually spoken in the film, when it differs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Dialogue(
    @JsonDeserialize(using = TimestampDeserializer.class) double timestampStartSec,
    @JsonDeserialize(using = TimestampDeserializer.class) double timestampEndSec,
    @NotNull String actor,
    @NotNull String text,
    @Nullable String actorContext,
    @Nullable String delivery,
    @Nullable List<String> actualDialogs) {}
