package com.flamingo.ai.climatechat.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.climatechat.api.dto.request.ChatRequest;
import com.flamingo.ai.climatechat.api.dto.request.HistoryTurnRequest;
import com.flamingo.ai.climatechat.domain.model.Citation;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import com.flamingo.ai.climatechat.exception.ApiError;
import com.flamingo.ai.climatechat.exception.GlobalExceptionHandler;
import com.flamingo.ai.climatechat.service.pipeline.FailureReason;
import com.flamingo.ai.climatechat.service.pipeline.PipelineResult;
import com.flamingo.ai.climatechat.service.pipeline.QueryPipelineService;
import com.flamingo.ai.climatechat.service.translation.LanguageRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatController Tests")
class ChatControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @Mock private QueryPipelineService queryPipelineService;
  @Captor private ArgumentCaptor<List<ConversationTurn>> historyCaptor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ChatController chatController =
        new ChatController(queryPipelineService, new LanguageRegistry());
    mockMvc =
        MockMvcBuilders.standaloneSetup(chatController)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Nested
  @DisplayName("POST /api/chat")
  class Chat {

    @Test
    @DisplayName("Should return the answer with citations and timings")
    void shouldReturnAnswer() throws Exception {
      PipelineResult.Success success =
          new PipelineResult.Success(
              "Climate change is a long-term shift in temperatures.",
              List.of(
                  new Citation(
                      "IPCC AR6",
                      "https://www.ipcc.ch",
                      "Climate change refers to long-term shifts.",
                      "Climate change refers to long-term shifts.")),
              0.85,
              false,
              false,
              ConversationTurn.of(
                  "What is climate change?",
                  "Climate change is a long-term shift in temperatures.",
                  "en"),
              Map.of("retrieval", Duration.ofMillis(120), "total", Duration.ofMillis(900)));
      when(queryPipelineService.process(eq("What is climate change?"), eq("english"), anyList()))
          .thenReturn(success);

      mockMvc
          .perform(
              post("/api/chat")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      objectMapper.writeValueAsString(
                          ChatRequest.builder().query("What is climate change?").build())))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.answer").value(success.answer()))
          .andExpect(jsonPath("$.citations[0].title").value("IPCC AR6"))
          .andExpect(jsonPath("$.citations[0].url").value("https://www.ipcc.ch"))
          .andExpect(jsonPath("$.faithfulnessScore").value(0.85))
          .andExpect(jsonPath("$.cacheHit").value(false))
          .andExpect(jsonPath("$.languageCode").value("en"))
          .andExpect(jsonPath("$.timings.total").value(900))
          .andExpect(jsonPath("$.reason").doesNotExist());
    }

    @Test
    @DisplayName("Should return pipeline rejections as a normal response")
    void shouldReturnRejection() throws Exception {
      when(queryPipelineService.process(anyString(), anyString(), anyList()))
          .thenReturn(
              new PipelineResult.Failure(
                  FailureReason.NOT_CLIMATE_RELATED,
                  FailureReason.NOT_CLIMATE_RELATED.message(),
                  "routing",
                  Map.of("total", Duration.ofMillis(40))));

      mockMvc
          .perform(
              post("/api/chat")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\"How do I change my car's oil?\",\"language\":\"en\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(false))
          .andExpect(jsonPath("$.reason").value("not_climate_related"))
          .andExpect(
              jsonPath("$.message")
                  .value("I apologize, but I can only help with climate-related questions."))
          .andExpect(jsonPath("$.answer").doesNotExist());
    }

    @Test
    @DisplayName("Should pass complete history turns to the pipeline")
    void shouldPassHistory() throws Exception {
      when(queryPipelineService.process(anyString(), anyString(), anyList()))
          .thenReturn(
              new PipelineResult.Failure(
                  FailureReason.OFF_TOPIC, FailureReason.OFF_TOPIC.message(), "context", Map.of()));
      ChatRequest request =
          ChatRequest.builder()
              .query("What else are they doing?")
              .history(
                  List.of(
                      HistoryTurnRequest.builder()
                          .query("What is Rexdale doing for climate change?")
                          .answer("Tree planting and a green energy co-op.")
                          .language("en")
                          .build(),
                      HistoryTurnRequest.builder().query("Unanswered").build()))
              .build();

      mockMvc
          .perform(
              post("/api/chat")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk());

      verify(queryPipelineService)
          .process(eq("What else are they doing?"), eq("english"), historyCaptor.capture());
      assertThat(historyCaptor.getValue())
          .singleElement()
          .extracting(ConversationTurn::query)
          .isEqualTo("What is Rexdale doing for climate change?");
    }

    @Test
    @DisplayName("Should reject a request without a query")
    void shouldRejectMissingQuery() throws Exception {
      mockMvc
          .perform(
              post("/api/chat")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"language\":\"english\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
          .andExpect(jsonPath("$.errorId").isNotEmpty())
          .andExpect(jsonPath("$.path").value("/api/chat"));

      verifyNoInteractions(queryPipelineService);
      assertThat(
              meterRegistry.counter("api_errors_total", "error_type", "validation_error").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an unreadable body")
    void shouldRejectMalformedBody() throws Exception {
      mockMvc
          .perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content("{query:"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.MALFORMED_REQUEST));

      verifyNoInteractions(queryPipelineService);
    }
  }

  @Test
  @DisplayName("GET /api/languages should list supported language names")
  void shouldListLanguages() throws Exception {
    mockMvc
        .perform(get("/api/languages"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@ == 'english')]").exists())
        .andExpect(jsonPath("$[?(@ == 'spanish')]").exists());
  }
}
