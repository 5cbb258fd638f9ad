package dev.semanticcut.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.semanticcut.config.GlobalExceptionHandler;
import dev.semanticcut.embedding.EmbeddingException;
import dev.semanticcut.ingest.ClipIndexingService;
import dev.semanticcut.ingest.IndexReport;
import dev.semanticcut.ingest.IndexRequest;
import dev.semanticcut.search.Confidence;
import dev.semanticcut.search.RankedResult;
import dev.semanticcut.search.SearchProgressListener;
import dev.semanticcut.search.SearchRequest;
import dev.semanticcut.search.SearchService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

    private static final String VALIDATION_MESSAGE =
        "Validation failed: scenes[0].sceneId: must not be blank";

    @Mock
    private SearchService searchService;

    @Mock
    private ClipIndexingService indexingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SearchController controller =
            new SearchController(searchService, indexingService, new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static RankedResult result() {
        return new RankedResult(
            "scene_2_clip_1", "scene_2", 12.5, 25.25, "Bonasera asks for justice.",
            0.91, 1.0, Confidence.HIGH, Map.of("location", "DON'S OFFICE"));
    }

    @Test
    void searchReturnsSnakeCaseResults() throws Exception {
        when(searchService.search(any(SearchRequest.class))).thenReturn(List.of(result()));

        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"Don Corleone refusing a request\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].clip_id").value("scene_2_clip_1"))
            .andExpect(jsonPath("$[0].video_id").value("scene_2"))
            .andExpect(jsonPath("$[0].match_score").value(1.0))
            .andExpect(jsonPath("$[0].confidence").value("High"))
            .andExpect(jsonPath("$[0].metadata.location").value("DON'S OFFICE"));
    }

    @Test
    void searchBindsCallerFiltersAndClampsLimit() throws Exception {
        when(searchService.search(any(SearchRequest.class))).thenReturn(List.of());
        String body = "{"
            + "\"query\":\"tense talk\","
            + "\"limit\":50,"
            + "\"location\":\"DON'S OFFICE\","
            + "\"time_of_day\":\"DAY\","
            + "\"actors\":[\"SONNY\"]"
            + "}";

        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchService).search(captor.capture());
        SearchRequest request = captor.getValue();
        assertThat(request.limit()).isEqualTo(20);
        assertThat(request.filters())
            .containsEntry("location", "DON'S OFFICE")
            .containsEntry("time_of_day", "DAY")
            .containsEntry("actors", List.of("SONNY"));
    }

    @Test
    void retrievalFailureMapsToBadGateway() throws Exception {
        when(searchService.search(any(SearchRequest.class)))
            .thenThrow(new EmbeddingException("Embedding request failed: connection refused"));

        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"wedding\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.title").value("Retrieval failed"))
            .andExpect(jsonPath("$.detail").value("Embedding request failed: connection refused"));
    }

    @Test
    void indexReturnsReport() throws Exception {
        when(indexingService.index(any(IndexRequest.class)))
            .thenReturn(new IndexReport(1, 0.42, "Successfully indexed 1 clips in 0.42 seconds."));
        String body = "{"
            + "\"recreate_collection\":true,"
            + "\"scenes\":[{\"scene_id\":\"scene_1\","
            + "\"scene_description\":{\"int_ext\":\"EXT\",\"location\":\"GARDEN\","
            + "\"time_of_day\":\"DAY\",\"actors_involved\":[\"CONNIE\"]},"
            + "\"clips\":[{\"clip_id\":\"scene_1_clip_1\","
            + "\"clip_description\":[\"Guests dance.\"]}]}]"
            + "}";

        mockMvc.perform(post("/api/v1/index")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.clips_indexed").value(1))
            .andExpect(jsonPath("$.duration_seconds").value(0.42));

        ArgumentCaptor<IndexRequest> captor = ArgumentCaptor.forClass(IndexRequest.class);
        verify(indexingService).index(captor.capture());
        assertThat(captor.getValue().recreateCollection()).isTrue();
        assertThat(captor.getValue().scenes().get(0).clips())
            .hasSize(1);
    }

    @Test
    void invalidIndexRequestMapsToBadRequest() throws Exception {
        when(indexingService.index(any(IndexRequest.class)))
            .thenThrow(new IllegalArgumentException(VALIDATION_MESSAGE));

        mockMvc.perform(post("/api/v1/index")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scenes\":[{\"scene_id\":\"\",\"scene_description\":{}}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value(VALIDATION_MESSAGE));
    }

    @Test
    void indexCatalogPassesRecreateFlag() throws Exception {
        when(indexingService.indexCatalog(true))
            .thenReturn(new IndexReport(0, 0.0, "No clips to index."));

        mockMvc.perform(post("/api/v1/index/catalog").param("recreate", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("No clips to index."));
    }

    @Test
    void streamStartsAsyncSearchWithStreamHeaders() throws Exception {
        when(searchService.search(any(SearchRequest.class), any(SearchProgressListener.class)))
            .thenReturn(List.of());

        mockMvc.perform(post("/api/v1/search/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"wedding\"}"))
            .andExpect(status().isOk())
            .andExpect(request().asyncStarted())
            .andExpect(header().string("x-vercel-ai-ui-message-stream", "v1"))
            .andExpect(header().string("X-Accel-Buffering", "no"));

        verify(searchService, timeout(1000))
            .search(any(SearchRequest.class), any(SearchProgressListener.class));
    }
}
