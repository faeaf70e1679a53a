package com.flamingo.ai.climatechat.service.rag.generation;

import com.flamingo.ai.climatechat.domain.model.Citation;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import com.flamingo.ai.climatechat.domain.model.Document;
import com.flamingo.ai.climatechat.exception.LlmServiceException;
import com.flamingo.ai.climatechat.exception.NoEvidenceException;
import com.flamingo.ai.climatechat.service.rag.query.ConversationHistoryFormatter;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Writes grounded answers. Builds one prompt from the persona, the documents and the conversation,
 * calls the generation model once and derives citations from the documents it was given.
 */
@Service
@Slf4j
public class AnswerGenerationService {

  private final ChatModel generationChatModel;
  private final MeterRegistry meterRegistry;

  public AnswerGenerationService(
      @Qualifier("generationChatModel") ChatModel generationChatModel,
      MeterRegistry meterRegistry) {
    this.generationChatModel = generationChatModel;
    this.meterRegistry = meterRegistry;
  }

  @Timed(value = "rag.generation", description = "Time to generate an answer")
  public GeneratedAnswer generate(
      String query, List<Document> documents, List<ConversationTurn> history) {
    return generate(query, documents, history, null);
  }

  /**
   * Generates an answer grounded on the given documents.
   *
   * @param query the (possibly rewritten) question in the pivot language
   * @param documents grounding documents, most relevant first
   * @param history prior turns, oldest first
   * @param instructions optional extra instructions placed before the documents
   * @return the answer with citations for every document used
   * @throws NoEvidenceException if no document has content
   * @throws LlmServiceException if the model fails or returns nothing
   */
  @Timed(value = "rag.generation", description = "Time to generate an answer")
  public GeneratedAnswer generate(
      String query, List<Document> documents, List<ConversationTurn> history, String instructions) {
    List<Document> grounding =
        documents == null ? List.of() : documents.stream().filter(Document::hasContent).toList();
    if (grounding.isEmpty()) {
      throw new NoEvidenceException("No documents with content to ground an answer on");
    }

    String prompt = buildPrompt(query, grounding, history, instructions);
    log.debug(
        "Generating answer from {} documents, prompt length {}", grounding.size(), prompt.length());

    String text;
    try {
      ChatResponse response =
          generationChatModel.chat(
              SystemMessage.from(ClimatePrompts.SYSTEM_MESSAGE), UserMessage.from(prompt));
      text = response.aiMessage() != null ? response.aiMessage().text() : null;
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.generation.error").increment();
      throw new LlmServiceException("Answer generation failed", e);
    }

    if (text == null || text.isBlank()) {
      meterRegistry.counter("rag.generation.error").increment();
      throw new LlmServiceException("Generation model returned an empty answer");
    }

    List<Citation> citations = grounding.stream().map(Citation::from).toList();
    meterRegistry.counter("rag.generation.success").increment();
    return new GeneratedAnswer(MarkdownHeadings.normalize(text.trim()), citations, grounding);
  }

  String buildPrompt(
      String query, List<Document> documents, List<ConversationTurn> history, String instructions) {
    StringBuilder sb = new StringBuilder();
    if (instructions != null && !instructions.isBlank()) {
      sb.append("Instructions: ").append(instructions.trim()).append("\n\n");
    }

    sb.append(ClimatePrompts.DOCUMENTS_INTRO).append("\n\n");
    for (int i = 0; i < documents.size(); i++) {
      Document doc = documents.get(i);
      sb.append("Document ").append(i + 1).append(":\n");
      if (!doc.title().isBlank()) {
        sb.append("Title: ").append(doc.title()).append("\n");
      }
      sb.append(doc.content()).append("\n\n");
    }

    if (history != null && !history.isEmpty()) {
      sb.append("Conversation so far:\n")
          .append(ConversationHistoryFormatter.format(history))
          .append("\n\n");
    }

    sb.append("Question: ").append(query);
    return sb.toString();
  }
}
