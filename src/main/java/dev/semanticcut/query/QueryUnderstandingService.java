package dev.semanticcut.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.semanticcut.filter.FilterClauseParser;
import dev.semanticcut.filter.FilterClauseSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns a raw query into a {@link ParsedIntent} with a chat model.
 *
 * <p>The model is asked for a JSON object with {@code intent}, {@code keywords} and {@code
 * filters}; the allowed filter values come from {@link CanonicalFilterVocabulary}. This service
 * never fails: without a configured model, on any provider error and on unparseable output it
 * returns {@link ParsedIntent#fallback(String)}.
 */
@Service
public class QueryUnderstandingService {

  private static final Logger log = LoggerFactory.getLogger(QueryUnderstandingService.class);

  static final int MAX_KEYWORDS = 5;
  static final int MAX_PROMPT_LOCATIONS = 30;
  static final int MAX_PROMPT_ACTORS = 40;
  static final int MAX_PROMPT_SCENE_IDS = 25;

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final @Nullable ChatModel chatModel;
  private final CanonicalFilterVocabulary vocabulary;
  private final ObjectMapper objectMapper;

  @Autowired
  public QueryUnderstandingService(
      ObjectProvider<ChatModel> chatModel,
      CanonicalFilterVocabulary vocabulary,
      ObjectMapper objectMapper) {
    this(chatModel.getIfAvailable(), vocabulary, objectMapper);
  }

  QueryUnderstandingService(
      @Nullable ChatModel chatModel,
      CanonicalFilterVocabulary vocabulary,
      ObjectMapper objectMapper) {
    this.chatModel = chatModel;
    this.vocabulary = vocabulary;
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a raw query.
   *
   * @param rawQuery the user's text
   * @return the parsed intent; {@link ParsedIntent#EMPTY} for blank input
   */
  public ParsedIntent parse(@Nullable String rawQuery) {
    if (rawQuery == null || rawQuery.isBlank()) {
      return ParsedIntent.EMPTY;
    }
    log.info("Parsing query: {}", preview(rawQuery, 120));
    if (chatModel == null) {
      log.warn("No chat model configured (semanticcut.llm.api-key); using raw query as intent");
      return ParsedIntent.fallback(rawQuery);
    }

    String content;
    try {
      AiMessage reply =
          chatModel
              .chat(
                  ChatRequest.builder()
                      .messages(SystemMessage.from(systemPrompt()), UserMessage.from(rawQuery))
                      .build())
              .aiMessage();
      content = reply == null ? null : reply.text();
    } catch (RuntimeException e) {
      log.warn("Query understanding call failed: {}; using raw query as intent", e.getMessage());
      return ParsedIntent.fallback(rawQuery);
    }
    if (content == null || content.isBlank()) {
      log.warn("Query understanding returned no content; using raw query as intent");
      return ParsedIntent.fallback(rawQuery);
    }

    try {
      ParsedIntent parsed = toIntent(rawQuery, stripCodeFences(content.strip()));
      log.info(
          "Parsed intent={}, keywords={}, filters={}",
          preview(parsed.intent(), 80),
          parsed.keywords(),
          parsed.filters());
      return parsed;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Query understanding output unparseable: {}; using raw query as intent", e.getMessage());
      return ParsedIntent.fallback(rawQuery);
    }
  }

  private ParsedIntent toIntent(String rawQuery, String json) throws JsonProcessingException {
    JsonNode root = objectMapper.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("expected a JSON object");
    }

    JsonNode intentNode = root.get("intent");
    String intent = intentNode != null && intentNode.isTextual() ? intentNode.asText().strip() : "";
    if (intent.isEmpty()) {
      intent = rawQuery.strip();
    }

    List<String> keywords = new ArrayList<>();
    JsonNode keywordsNode = root.get("keywords");
    if (keywordsNode != null && keywordsNode.isArray()) {
      for (JsonNode keyword : keywordsNode) {
        String value = keyword.isNull() ? "" : keyword.asText().strip();
        if (!value.isEmpty() && keywords.size() < MAX_KEYWORDS) {
          keywords.add(value);
        }
      }
    }

    FilterClauseSet filters = FilterClauseSet.EMPTY;
    JsonNode filtersNode = root.get("filters");
    if (filtersNode != null && filtersNode.isObject()) {
      filters = FilterClauseParser.parseStructured(objectMapper.convertValue(filtersNode, MAP_TYPE));
    }
    return new ParsedIntent(intent, keywords, filters);
  }

  static String stripCodeFences(String content) {
    if (!content.startsWith("```")) {
      return content;
    }
    return content
        .lines()
        .filter(line -> !line.strip().startsWith("```"))
        .collect(Collectors.joining("\n"));
  }

  String systemPrompt() {
    FilterVocabulary v = vocabulary.get();
    return SYSTEM_PROMPT.formatted(
        String.join(", ", v.sceneIds().subList(0, Math.min(MAX_PROMPT_SCENE_IDS, v.sceneIds().size()))),
        quoted(v.locations(), MAX_PROMPT_LOCATIONS),
        String.join(", ", v.timesOfDay()),
        String.join(", ", v.intExt()),
        quoted(v.actors(), MAX_PROMPT_ACTORS));
  }

  private static String quoted(List<String> values, int max) {
    return values.stream().limit(max).map(s -> "'" + s + "'").collect(Collectors.joining(", "));
  }

  private static String preview(String text, int max) {
    return text.length() > max ? text.substring(0, max) + "..." : text;
  }

  private static final String SYSTEM_PROMPT =
      """
      You are a query understander for a film footage search engine. Editors describe the \
      footage they want in natural language.

      Output a single JSON object with exactly these keys:
      - "intent": one clear sentence describing what kind of footage to find (e.g. "someone \
      refusing a request firmly", "tense conversation in an office"). Use the user's words but \
      make it concrete and search-friendly. No preamble.
      - "keywords": a short list of 0 to 5 important phrases or words from the query. Can be [].
      - "filters": optional metadata with AND / OR / NOR logic. Use ONLY these exact values:
        scene_id: %s. location: %s. time_of_day: %s. int_ext: %s. actors: %s.

        "filters" is an object with up to three keys: "must", "should", "must_not". Each is an \
      object with optional keys scene_id, location, time_of_day, int_ext, actors (array). Omit \
      a key entirely if it is not needed.

        - "must" (AND): ALL of these must match, e.g. "in the office during the day" or "with \
      both Don and Sonny". Example: {"must": {"location": "DON'S OFFICE", "time_of_day": "DAY"}}.
        - "should" (OR): at least ONE must match, e.g. "Don Corleone or Sonny". Example: \
      {"should": {"actors": ["DON CORLEONE", "SONNY"]}}.
        - "must_not" (NOR): NONE of these may match, e.g. "not at night", "without Michael". \
      Example: {"must_not": {"time_of_day": "NIGHT"}}.

        Clauses combine: {"must": {"location": "DON'S OFFICE"}, "must_not": {"time_of_day": \
      "NIGHT"}}. If the user names no filter, use {}.

      Output only the JSON, no markdown or explanation.""";
}
