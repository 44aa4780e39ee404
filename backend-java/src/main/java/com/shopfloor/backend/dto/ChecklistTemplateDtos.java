package com.shopfloor.backend.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.shopfloor.backend.inspection.ChecklistTemplateSection;

import jakarta.validation.constraints.NotBlank;

public final class ChecklistTemplateDtos {
  private ChecklistTemplateDtos() {}

  public record ChecklistTemplateIn(
      @NotBlank String name,
      String description,
      List<ChecklistTemplateSection> sections,
      List<String> applicableToStages,
      Boolean active
  ) {
    public ChecklistTemplateIn {
      if (sections == null) {
        sections = List.of();
      }
      if (applicableToStages == null) {
        applicableToStages = List.of();
      }
    }
  }

  public record ChecklistTemplateListOut(
      long id,
      String name,
      String description,
      int sectionCount,
      int itemCount,
      int criticalItemCount,
      boolean active,
      OffsetDateTime updatedAt
  ) {}
}
