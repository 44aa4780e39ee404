package com.shopfloor.backend.inspection;

/**
 * One verification point of a checklist template.
 *
 * <p>{@code expectedValue} is a {@link Boolean}, {@link Number} or {@link String} depending on
 * {@code type}. {@code tolerance} is an absolute band around the expected value and is only read
 * for {@link ItemType#NUMERIC} items. {@code unit} is for display.
 */
public record ChecklistTemplateItem(
    String id,
    String description,
    ItemType type,
    Object expectedValue,
    Double tolerance,
    String unit,
    boolean criticalItem,
    boolean required
) {
  public ChecklistTemplateItem withId(String newId) {
    return new ChecklistTemplateItem(newId, description, type, expectedValue, tolerance, unit, criticalItem, required);
  }
}
