package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when header/footer removal fails. */
public class NoiseRemovalException extends StructuringException {

  public NoiseRemovalException(String message, Throwable cause) {
    super(Stage.NOISE_REMOVAL, message, cause);
  }
}
