package com.shopfloor.backend.service;

import java.util.List;

/** An inspection is missing fields it needs before it can be saved. */
public class InspectionValidationException extends RuntimeException {
  private final List<String> errors;

  public InspectionValidationException(List<String> errors) {
    super("inspection is incomplete: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
