package com.flamingo.ai.climatechat.service.pipeline;

/** Why a pipeline run ended without an answer, with the message shown to the user. */
public enum FailureReason {
  UNSUPPORTED_LANGUAGE("unsupported_language", "Sorry, that language is not supported yet."),
  TOO_SHORT("too_short", "Please provide a more detailed question."),
  TOO_LONG("too_long", "Your question is too long. Please keep it under 1000 characters."),
  TRANSLATION_ERROR(
      "translation_error",
      "Sorry, I couldn't translate your message. Please try again or ask in English."),
  HARMFUL_CONTENT(
      "harmful_content",
      "I cannot provide information on harmful actions. Please ask a question about climate"
          + " change."),
  MISINFORMATION(
      "misinformation",
      "I provide factual information about climate change based on scientific consensus."),
  NOT_CLIMATE_RELATED(
      "not_climate_related", "I apologize, but I can only help with climate-related questions."),
  OFF_TOPIC(
      "off_topic",
      "I apologize, but I can only help with climate-related questions. Feel free to ask about"
          + " climate change, its impacts or solutions."),
  HARMFUL("harmful", "I can't help with that request. Please ask a question about climate change."),
  NO_EVIDENCE(
      "no_evidence",
      "I couldn't find enough information to answer that question. Please try rephrasing it."),
  RETRIEVAL_ERROR("retrieval_error", "Search is temporarily unavailable. Please try again."),
  GENERATION_ERROR(
      "generation_error", "AI service is temporarily unavailable. Please try again later."),
  TIMEOUT("timeout", "The request took too long to process. Please try again."),
  INTERNAL_ERROR(
      "internal_error",
      "Something went wrong while processing your question. Please try again.");

  private final String code;
  private final String message;

  FailureReason(String code, String message) {
    this.code = code;
    this.message = message;
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }
}
