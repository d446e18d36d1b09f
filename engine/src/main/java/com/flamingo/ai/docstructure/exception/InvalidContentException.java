package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when the input has no pages or no spans at all. */
public class InvalidContentException extends StructuringException {

  public InvalidContentException(String message) {
    super(Stage.VALIDATION, message, "Document has no extractable content");
  }
}
