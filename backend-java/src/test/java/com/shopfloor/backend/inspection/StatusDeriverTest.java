package com.shopfloor.backend.inspection;

import static com.shopfloor.backend.inspection.Checklists.item;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class StatusDeriverTest {

  private static List<InspectionResultItem> items(int passed, int total) {
    List<InspectionResultItem> out = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      out.add(item(i < passed, false));
    }
    return out;
  }

  @Test
  void failedCriticalItemFailsInspectionDespiteHighPassRate() {
    List<InspectionResultItem> all = items(9, 9);
    all.add(item(false, true));

    assertThat(StatusDeriver.passRate(all)).isEqualTo(0.9);
    assertThat(StatusDeriver.derive(all)).isEqualTo(InspectionStatus.FAILED);
  }

  @Test
  void passedCriticalItemDoesNotForceFailure() {
    List<InspectionResultItem> all = items(9, 9);
    all.add(item(true, true));

    assertThat(StatusDeriver.derive(all)).isEqualTo(InspectionStatus.PASSED);
  }

  @Test
  void seventyPercentIsPartial() {
    assertThat(StatusDeriver.derive(items(7, 10))).isEqualTo(InspectionStatus.PARTIAL);
  }

  @Test
  void belowSeventyPercentFails() {
    assertThat(StatusDeriver.derive(items(6, 10))).isEqualTo(InspectionStatus.FAILED);
    assertThat(StatusDeriver.derive(items(69, 100))).isEqualTo(InspectionStatus.FAILED);
    assertThat(StatusDeriver.derive(items(2, 3))).isEqualTo(InspectionStatus.FAILED);
  }

  @Test
  void onlyFullPassRatePasses() {
    assertThat(StatusDeriver.derive(items(10, 10))).isEqualTo(InspectionStatus.PASSED);
    assertThat(StatusDeriver.derive(items(99, 100))).isEqualTo(InspectionStatus.PARTIAL);
  }

  @Test
  void emptyChecklistPasses() {
    assertThat(StatusDeriver.derive(List.of())).isEqualTo(InspectionStatus.PASSED);
    assertThat(StatusDeriver.passRate(List.of())).isEqualTo(1.0);
  }

  @Test
  void refreshPoolsItemsAcrossSections() {
    InspectionResult inspection = new InspectionResult();
    inspection.setSections(List.of(
        new InspectionResultSection("a", "A", items(3, 3)),
        new InspectionResultSection("b", "B", items(0, 2))));

    assertThat(StatusDeriver.refresh(inspection)).isEqualTo(InspectionStatus.FAILED);
    assertThat(inspection.getStatus()).isEqualTo(InspectionStatus.FAILED);

    inspection.getSections().get(1).getItems().forEach(i -> i.setPassed(true));
    assertThat(StatusDeriver.refresh(inspection)).isEqualTo(InspectionStatus.PASSED);
  }
}
