package com.shopfloor.backend.inspection;

import static com.shopfloor.backend.inspection.Checklists.bool;
import static com.shopfloor.backend.inspection.Checklists.section;
import static com.shopfloor.backend.inspection.Checklists.template;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;

import org.junit.jupiter.api.Test;

class InspectionSummaryTest {

  @Test
  void countsItemsPerInspectionAndSection() {
    ChecklistTemplate t = template(1,
        section("a", bool("a1", true), bool("a2", false), bool("a3", false)),
        section("b", bool("b1", false)));
    InspectionEditor editor = InspectionEditor.start(t, "OP-1", null, "Ana", OffsetDateTime.now());
    editor.recordValue("a", "a2", true);
    editor.recordValue("a", "a3", true);
    editor.recordValue("b", "b1", true);

    InspectionSummary summary = InspectionSummary.of(editor.inspection());

    assertThat(summary.total()).isEqualTo(4);
    assertThat(summary.passed()).isEqualTo(3);
    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.passRatePercent()).isEqualTo(75);
    assertThat(summary.critical()).isEqualTo(1);
    assertThat(summary.failedCritical()).isEqualTo(1);
    assertThat(summary.status()).isEqualTo(InspectionStatus.FAILED);
    assertThat(summary.sections()).extracting(InspectionSummary.SectionSummary::passRatePercent)
        .containsExactly(67, 100);
  }

  @Test
  void emptyInspectionReadsAsZeroPercentButPassed() {
    InspectionEditor editor = InspectionEditor.start(template(2), "OP-2", null, "Ana", OffsetDateTime.now());

    InspectionSummary summary = InspectionSummary.of(editor.inspection());

    assertThat(summary.total()).isZero();
    assertThat(summary.passRatePercent()).isZero();
    assertThat(summary.status()).isEqualTo(InspectionStatus.PASSED);
  }
}
