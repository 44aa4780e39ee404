package com.shopfloor.backend.inspection;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds an inspection to a checklist template by building a fresh result item for every template
 * item. Binding an inspection that has already been persisted is refused.
 */
public final class TemplateBinder {
  private static final Logger logger = LoggerFactory.getLogger(TemplateBinder.class);

  private TemplateBinder() {}

  /**
   * Rebuilds {@code inspection}'s sections from {@code template}, discarding anything recorded so
   * far, and re-derives the status.
   *
   * @return false (and {@code inspection} untouched) when it is already persisted
   */
  public static boolean bind(InspectionResult inspection, ChecklistTemplate template) {
    if (inspection.isPersisted()) {
      logger.warn("Refusing to bind persisted inspection {} to checklist {}", inspection.getId(), template.id());
      return false;
    }

    List<InspectionResultSection> sections = new ArrayList<>();
    for (ChecklistTemplateSection section : template.sections()) {
      List<InspectionResultItem> items = new ArrayList<>();
      for (ChecklistTemplateItem item : section.items()) {
        items.add(new InspectionResultItem(item.id(), item.description(), defaultResult(item), item.criticalItem()));
      }
      sections.add(new InspectionResultSection(section.id(), section.name(), items));
    }

    inspection.setChecklistId(template.id());
    inspection.setChecklistName(template.name());
    inspection.setSections(sections);
    StatusDeriver.refresh(inspection);
    logger.debug("Bound inspection to checklist {} ({} sections)", template.id(), sections.size());
    return true;
  }

  static Object defaultResult(ChecklistTemplateItem item) {
    if (item.type() == null) {
      return Boolean.FALSE;
    }
    return switch (item.type()) {
      case BOOLEAN -> Boolean.FALSE;
      case NUMERIC -> {
        double expected = ItemEvaluator.toNumber(item.expectedValue());
        yield Double.isNaN(expected) ? 0d : expected;
      }
      case TEXT -> ItemEvaluator.toText(item.expectedValue());
    };
  }
}
