package com.shopfloor.backend.service;

import java.util.ArrayList;
import java.util.List;

import com.shopfloor.backend.inspection.InspectionResult;

final class InspectionValidator {
  private InspectionValidator() {}

  static List<String> problems(InspectionResult inspection) {
    List<String> errors = new ArrayList<>();
    if (isBlank(inspection.getInspector())) {
      errors.add("inspector is required");
    }
    if (isBlank(inspection.getOrderId())) {
      errors.add("orderId is required");
    }
    if (inspection.getChecklistId() == null) {
      errors.add("checklistId is required");
    }
    return errors;
  }

  static void requireValid(InspectionResult inspection) {
    List<String> errors = problems(inspection);
    if (!errors.isEmpty()) {
      throw new InspectionValidationException(errors);
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.trim().isEmpty();
  }
}
