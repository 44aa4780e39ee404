package com.shopfloor.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.shopfloor.backend.inspection.ChecklistTemplateItem;
import com.shopfloor.backend.inspection.ChecklistTemplateSection;
import com.shopfloor.backend.inspection.ItemType;

class ChecklistTemplateServiceTest {

  @Test
  void withIds_fillsBlankIdsAndKeepsExistingOnes() {
    var sections = List.of(
        new ChecklistTemplateSection(null, "Visual", List.of(
            new ChecklistTemplateItem("", "No cracks", ItemType.BOOLEAN, null, null, null, true, true),
            new ChecklistTemplateItem("keep-me", "Length", ItemType.NUMERIC, 120, 0.5, "mm", false, true))));

    List<ChecklistTemplateSection> out = ChecklistTemplateService.withIds(sections);

    assertThat(out.get(0).id()).isNotBlank();
    assertThat(out.get(0).name()).isEqualTo("Visual");
    assertThat(out.get(0).items().get(0).id()).isNotBlank();
    assertThat(out.get(0).items().get(1).id()).isEqualTo("keep-me");
    assertThat(out.get(0).items().get(1).tolerance()).isEqualTo(0.5);
  }

  @Test
  void withIds_rejectsUntypedItems() {
    var sections = List.of(new ChecklistTemplateSection("s", "S", List.of(
        new ChecklistTemplateItem("i", "What is this", null, null, null, null, false, false))));

    assertThatThrownBy(() -> ChecklistTemplateService.withIds(sections))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("item type is required");
  }
}
