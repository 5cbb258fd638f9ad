package dev.semanticcut.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.semanticcut.filter.FilterClauseSet;
import dev.semanticcut.filter.FilterField;
import dev.semanticcut.filter.FilterValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryUnderstandingServiceTest {

  private static final String RAW = "Don Corleone refusing a request";

  @Mock private ChatModel chatModel;

  @Mock private CanonicalFilterVocabulary vocabulary;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private QueryUnderstandingService service() {
    return new QueryUnderstandingService(chatModel, vocabulary, objectMapper);
  }

  private void replyWith(String content) {
    when(vocabulary.get()).thenReturn(FilterVocabulary.DEFAULT);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(content)).build());
  }

  @Test
  void blankQueryReturnsEmptyIntentWithoutCallingModel() {
    ParsedIntent parsed = service().parse("   ");

    assertThat(parsed).isEqualTo(ParsedIntent.EMPTY);
    verifyNoInteractions(chatModel, vocabulary);
  }

  @Test
  void missingModelFallsBackToRawQuery() {
    var service = new QueryUnderstandingService((ChatModel) null, vocabulary, objectMapper);

    ParsedIntent parsed = service.parse("  " + RAW + " ");

    assertThat(parsed.intent()).isEqualTo(RAW);
    assertThat(parsed.keywords()).isEmpty();
    assertThat(parsed.filters()).isEqualTo(FilterClauseSet.EMPTY);
  }

  @Test
  void parsesIntentKeywordsAndStructuredFilters() {
    replyWith(
        """
        {"intent": "a powerful man firmly refusing a favour",
         "keywords": ["Don Corleone", " refusal ", ""],
         "filters": {"must": {"actors": ["DON CORLEONE"], "location": "DON'S OFFICE"},
                     "must_not": {"time_of_day": "NIGHT"}}}
        """);

    ParsedIntent parsed = service().parse(RAW);

    assertThat(parsed.intent()).isEqualTo("a powerful man firmly refusing a favour");
    assertThat(parsed.keywords()).containsExactly("Don Corleone", "refusal");
    assertThat(parsed.filters().must().entries())
        .containsEntry(FilterField.ACTORS, new FilterValue.AllOf(List.of("DON CORLEONE")))
        .containsEntry(FilterField.LOCATION, new FilterValue.Exact("DON'S OFFICE"));
    assertThat(parsed.filters().mustNot().entries())
        .containsEntry(FilterField.TIME_OF_DAY, new FilterValue.Exact("NIGHT"));
  }

  @Test
  void stripsMarkdownCodeFences() {
    replyWith("```json\n{\"intent\": \"tense office conversation\", \"keywords\": []}\n```");

    assertThat(service().parse(RAW).intent()).isEqualTo("tense office conversation");
  }

  @Test
  void malformedJsonFallsBackToRawQuery() {
    replyWith("Sure! Here is the intent: refusing");

    ParsedIntent parsed = service().parse(RAW);

    assertThat(parsed).isEqualTo(ParsedIntent.fallback(RAW));
    assertThat(parsed.filters().toWire()).isEmpty();
  }

  @Test
  void nonObjectJsonFallsBackToRawQuery() {
    replyWith("[\"refusing\"]");

    assertThat(service().parse(RAW)).isEqualTo(ParsedIntent.fallback(RAW));
  }

  @Test
  void blankIntentFallsBackToRawQueryButKeepsFilters() {
    replyWith("{\"intent\": \"  \", \"filters\": {\"should\": {\"actors\": [\"SONNY\"]}}}");

    ParsedIntent parsed = service().parse(RAW);

    assertThat(parsed.intent()).isEqualTo(RAW);
    assertThat(parsed.filters().toWire())
        .isEqualTo(Map.of("should", Map.of("actors", List.of("SONNY"))));
  }

  @Test
  void keepsAtMostFiveKeywords() {
    replyWith("{\"intent\": \"x\", \"keywords\": [\"a\", \"b\", \"c\", \"d\", \"e\", \"f\"]}");

    assertThat(service().parse(RAW).keywords()).containsExactly("a", "b", "c", "d", "e");
  }

  @Test
  void providerErrorFallsBackToRawQuery() {
    when(vocabulary.get()).thenReturn(FilterVocabulary.DEFAULT);
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("timeout"));

    assertThat(service().parse(RAW)).isEqualTo(ParsedIntent.fallback(RAW));
  }

  @Test
  void emptyReplyFallsBackToRawQuery() {
    replyWith("  ");

    assertThat(service().parse(RAW)).isEqualTo(ParsedIntent.fallback(RAW));
  }

  @Test
  void promptCarriesVocabularyAndUserQuery() {
    when(vocabulary.get())
        .thenReturn(
            new FilterVocabulary(
                List.of("scene_1"),
                List.of("DON'S OFFICE"),
                List.of("DAY", "NIGHT"),
                List.of("EXT", "INT"),
                List.of("DON CORLEONE", "SONNY")));
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("{\"intent\": \"x\"}")).build());

    service().parse(RAW);

    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    var messages = captor.getValue().messages();
    assertThat(messages).hasSize(2);
    String system = ((SystemMessage) messages.get(0)).text();
    assertThat(system)
        .contains("scene_id: scene_1.")
        .contains("location: 'DON'S OFFICE'.")
        .contains("time_of_day: DAY, NIGHT.")
        .contains("actors: 'DON CORLEONE', 'SONNY'.");
    assertThat(((UserMessage) messages.get(1)).singleText()).isEqualTo(RAW);
  }

  @Test
  void stripCodeFencesLeavesPlainJsonUntouched() {
    assertThat(QueryUnderstandingService.stripCodeFences("{\"a\":1}")).isEqualTo("{\"a\":1}");
    assertThat(QueryUnderstandingService.stripCodeFences("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
  }
}
