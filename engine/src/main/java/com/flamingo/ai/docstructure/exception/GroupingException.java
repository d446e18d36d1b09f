package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.model.Stage;

/** Exception thrown when functional grouping fails. */
public class GroupingException extends StructuringException {

  public GroupingException(String message, Throwable cause) {
    super(Stage.GROUPING, message, cause);
  }
}
