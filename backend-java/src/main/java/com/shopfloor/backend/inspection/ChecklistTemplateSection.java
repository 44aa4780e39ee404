package com.shopfloor.backend.inspection;

import java.util.List;

public record ChecklistTemplateSection(
    String id,
    String name,
    List<ChecklistTemplateItem> items
) {
  public ChecklistTemplateSection {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public ChecklistTemplateSection withIdAndItems(String newId, List<ChecklistTemplateItem> newItems) {
    return new ChecklistTemplateSection(newId, name, newItems);
  }
}
