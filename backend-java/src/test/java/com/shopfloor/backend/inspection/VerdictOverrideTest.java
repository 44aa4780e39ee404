package com.shopfloor.backend.inspection;

import static com.shopfloor.backend.inspection.Checklists.bool;
import static com.shopfloor.backend.inspection.Checklists.numeric;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VerdictOverrideTest {

  @Test
  void approvingBooleanItemAlsoRewritesItsValue() {
    InspectionResultItem item = new InspectionResultItem("b", "guard fitted", false, false);

    VerdictOverride.apply(bool("b", false), item, Verdict.APPROVED);

    assertThat(item.isPassed()).isTrue();
    assertThat(item.getResult()).isEqualTo(true);
    assertThat(item.getVerdictSource()).isEqualTo(VerdictSource.MANUAL);
    assertThat(item.getManualVerdict()).isEqualTo(Verdict.APPROVED);
  }

  @Test
  void reworkOnBooleanItemRewritesValueToFalse() {
    InspectionResultItem item = new InspectionResultItem("b", "guard fitted", true, false);
    item.setPassed(true);

    VerdictOverride.apply(bool("b", false), item, Verdict.REWORK);

    assertThat(item.isPassed()).isFalse();
    assertThat(item.getResult()).isEqualTo(false);
    assertThat(item.getManualVerdict()).isEqualTo(Verdict.REWORK);
  }

  @Test
  void rejectingNumericItemKeepsRecordedValue() {
    InspectionResultItem item = new InspectionResultItem("d", "bore", 10.0, false);
    item.setPassed(true);

    VerdictOverride.apply(numeric("d", 10, 0.5), item, Verdict.REJECTED);

    assertThat(item.isPassed()).isFalse();
    assertThat(item.getResult()).isEqualTo(10.0);
  }

  @Test
  void approvingNumericItemWithoutTargetPassesIt() {
    InspectionResultItem item = new InspectionResultItem("d", "flatness", 0.3, false);

    VerdictOverride.apply(numeric("d", null, null), item, Verdict.APPROVED);

    assertThat(item.isPassed()).isTrue();
    assertThat(item.getResult()).isEqualTo(0.3);
  }

  @Test
  void applyingSameVerdictTwiceIsIdempotent() {
    InspectionResultItem once = new InspectionResultItem("b", "x", false, true);
    InspectionResultItem twice = new InspectionResultItem("b", "x", false, true);

    VerdictOverride.apply(bool("b", true), once, Verdict.APPROVED);
    VerdictOverride.apply(bool("b", true), twice, Verdict.APPROVED);
    VerdictOverride.apply(bool("b", true), twice, Verdict.APPROVED);

    assertThat(twice).usingRecursiveComparison().isEqualTo(once);
  }

  @Test
  void unknownDefinitionOnlyChangesVerdict() {
    InspectionResultItem item = new InspectionResultItem("b", "x", "kept", false);

    VerdictOverride.apply(null, item, Verdict.APPROVED);

    assertThat(item.isPassed()).isTrue();
    assertThat(item.getResult()).isEqualTo("kept");
  }
}
