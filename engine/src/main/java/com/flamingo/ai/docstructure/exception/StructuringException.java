package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when a document cannot be structured. Identifies the failing stage. */
public class StructuringException extends RuntimeException {

  private final Stage stage;
  private final String userMessage;

  public StructuringException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.userMessage = "Failed to structure document";
  }

  public StructuringException(Stage stage, String message, String userMessage) {
    super(message);
    this.stage = stage;
    this.userMessage = userMessage;
  }

  public Stage getStage() {
    return stage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
