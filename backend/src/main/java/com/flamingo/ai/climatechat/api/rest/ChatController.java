package com.flamingo.ai.climatechat.api.rest;

import com.flamingo.ai.climatechat.api.dto.request.ChatRequest;
import com.flamingo.ai.climatechat.api.dto.response.ChatResponse;
import com.flamingo.ai.climatechat.service.pipeline.PipelineResult;
import com.flamingo.ai.climatechat.service.pipeline.QueryPipelineService;
import com.flamingo.ai.climatechat.service.translation.LanguageRegistry;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for climate questions. Rejections and pipeline failures are normal responses
 * with {@code success=false}; only malformed requests get an error status.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final QueryPipelineService queryPipelineService;
  private final LanguageRegistry languageRegistry;

  /** Answers a question, optionally in the context of earlier turns. */
  @PostMapping("/chat")
  public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
    log.info(
        "Chat request: language={}, historyTurns={}",
        request.getLanguage(),
        request.getHistory() == null ? 0 : request.getHistory().size());
    PipelineResult result =
        queryPipelineService.process(request.getQuery(), request.getLanguage(), request.toTurns());
    return ResponseEntity.ok(ChatResponse.from(result));
  }

  /** Lists the language names a question may be asked in. */
  @GetMapping("/languages")
  public ResponseEntity<List<String>> languages() {
    return ResponseEntity.ok(languageRegistry.supportedLanguages());
  }
}
