package com.shopfloor.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.shopfloor.backend.inspection.InspectionResult;

class InspectionValidatorTest {

  @Test
  void blankInspectorBlocksSave() {
    InspectionResult r = new InspectionResult();
    r.setOrderId("OP-1");
    r.setChecklistId(1L);
    r.setInspector("   ");

    assertThat(InspectionValidator.problems(r)).containsExactly("inspector is required");
    assertThatThrownBy(() -> InspectionValidator.requireValid(r))
        .isInstanceOf(InspectionValidationException.class)
        .hasMessageContaining("inspector is required");
  }

  @Test
  void reportsEveryMissingField() {
    assertThat(InspectionValidator.problems(new InspectionResult()))
        .containsExactly("inspector is required", "orderId is required", "checklistId is required");
  }

  @Test
  void completeInspectionPasses() {
    InspectionResult r = new InspectionResult();
    r.setOrderId("OP-1");
    r.setChecklistId(1L);
    r.setInspector("Ana");

    assertThat(InspectionValidator.problems(r)).isEmpty();
  }
}
