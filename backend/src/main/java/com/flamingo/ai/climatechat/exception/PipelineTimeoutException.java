package com.flamingo.ai.climatechat.exception;

/** Thrown when a pipeline stage does not finish before the request deadline. */
public class PipelineTimeoutException extends RuntimeException {

  private final String stage;

  public PipelineTimeoutException(String stage, String message) {
    super(message);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
