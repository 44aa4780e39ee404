package com.shopfloor.backend.inspection;

import java.util.List;

/**
 * Counts behind an inspection's status, as shown on reports. Percentages are rounded and an empty
 * item set reads as 0 %.
 */
public record InspectionSummary(
    int total,
    int passed,
    int failed,
    int passRatePercent,
    int critical,
    int failedCritical,
    InspectionStatus status,
    List<SectionSummary> sections
) {
  public record SectionSummary(String id, String name, int total, int passed, int passRatePercent) {}

  public static InspectionSummary of(InspectionResult inspection) {
    List<InspectionResultItem> items = inspection.allItems();
    int passed = (int) items.stream().filter(InspectionResultItem::isPassed).count();
    int critical = (int) items.stream().filter(InspectionResultItem::isCriticalItem).count();
    int failedCritical = (int) items.stream().filter(i -> i.isCriticalItem() && !i.isPassed()).count();

    List<SectionSummary> sections = inspection.getSections().stream()
        .map(s -> {
          int sectionPassed = (int) s.getItems().stream().filter(InspectionResultItem::isPassed).count();
          return new SectionSummary(s.getId(), s.getName(), s.getItems().size(), sectionPassed,
              percent(s.getItems()));
        })
        .toList();

    return new InspectionSummary(
        items.size(),
        passed,
        items.size() - passed,
        percent(items),
        critical,
        failedCritical,
        StatusDeriver.derive(items),
        sections
    );
  }

  private static int percent(List<InspectionResultItem> items) {
    return items.isEmpty() ? 0 : (int) Math.round(StatusDeriver.passRate(items) * 100);
  }
}
