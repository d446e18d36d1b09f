package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when section segmentation fails. */
public class SegmentationException extends StructuringException {

  public SegmentationException(String message, Throwable cause) {
    super(Stage.SEGMENTATION, message, cause);
  }
}
