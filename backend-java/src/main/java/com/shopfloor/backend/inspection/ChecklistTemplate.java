package com.shopfloor.backend.inspection;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reusable inspection checklist: ordered sections of typed items. Read-only to the engine; results
 * copy what they need from it when they are bound.
 */
public record ChecklistTemplate(
    Long id,
    String name,
    String description,
    List<ChecklistTemplateSection> sections,
    List<String> applicableToStages,
    Boolean active,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
  public ChecklistTemplate {
    sections = sections == null ? List.of() : List.copyOf(sections);
    applicableToStages = applicableToStages == null ? List.of() : List.copyOf(applicableToStages);
    active = active == null ? Boolean.TRUE : active;
  }

  public Optional<ChecklistTemplateItem> findItem(String sectionId, String itemId) {
    return sections.stream()
        .filter(s -> s.id() != null && s.id().equals(sectionId))
        .findFirst()
        .flatMap(s -> s.items().stream()
            .filter(i -> i.id() != null && i.id().equals(itemId))
            .findFirst());
  }
}
