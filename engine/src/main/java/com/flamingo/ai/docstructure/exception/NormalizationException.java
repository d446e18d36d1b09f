package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when normalization fails. */
public class NormalizationException extends StructuringException {

  public NormalizationException(String message, Throwable cause) {
    super(Stage.NORMALIZATION, message, cause);
  }
}
