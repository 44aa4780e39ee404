package com.shopfloor.backend.service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.shopfloor.backend.domain.ChecklistTemplateEntity;
import com.shopfloor.backend.dto.ChecklistTemplateDtos.ChecklistTemplateIn;
import com.shopfloor.backend.inspection.ChecklistTemplate;
import com.shopfloor.backend.inspection.ChecklistTemplateItem;
import com.shopfloor.backend.inspection.ChecklistTemplateSection;
import com.shopfloor.backend.repo.ChecklistTemplateRepository;

@Service
public class ChecklistTemplateService {
  private static final Logger logger = LoggerFactory.getLogger(ChecklistTemplateService.class);

  private final ChecklistTemplateRepository templateRepository;
  private final SectionTreeCodec codec;

  public ChecklistTemplateService(ChecklistTemplateRepository templateRepository, SectionTreeCodec codec) {
    this.templateRepository = templateRepository;
    this.codec = codec;
  }

  @Transactional(readOnly = true)
  public List<ChecklistTemplate> list(boolean activeOnly) {
    var rows = activeOnly
        ? templateRepository.findByActiveTrueOrderByNameAsc()
        : templateRepository.findAllByOrderByNameAsc();
    return rows.stream().map(this::toModel).toList();
  }

  @Transactional(readOnly = true)
  public ChecklistTemplate get(long templateId) {
    return templateRepository.findById(templateId).map(this::toModel).orElse(null);
  }

  @Transactional
  public ChecklistTemplate create(ChecklistTemplateIn payload) {
    ChecklistTemplateEntity row = new ChecklistTemplateEntity();
    apply(row, payload);
    row = templateRepository.save(row);
    logger.info("Created checklist template {} '{}'", row.getId(), row.getName());
    return toModel(row);
  }

  @Transactional
  public ChecklistTemplate update(long templateId, ChecklistTemplateIn payload) {
    ChecklistTemplateEntity row = templateRepository.findById(templateId).orElse(null);
    if (row == null) {
      return null;
    }
    apply(row, payload);
    row = templateRepository.save(row);
    logger.info("Updated checklist template {} '{}'", row.getId(), row.getName());
    return toModel(row);
  }

  private void apply(ChecklistTemplateEntity row, ChecklistTemplateIn payload) {
    String name = payload.name() == null ? "" : payload.name().trim();
    if (name.isEmpty()) {
      throw new IllegalArgumentException("checklist name is empty");
    }
    row.setName(name);
    row.setDescription(payload.description());
    row.setSectionsJson(codec.writeTemplateSections(withIds(payload.sections())));
    row.setStagesJson(codec.writeStrings(payload.applicableToStages()));
    row.setActive(payload.active() == null || payload.active());
  }

  /** Fills blank section and item ids with fresh UUIDs; rejects items without a type. */
  static List<ChecklistTemplateSection> withIds(List<ChecklistTemplateSection> sections) {
    List<ChecklistTemplateSection> out = new ArrayList<>();
    for (ChecklistTemplateSection section : sections) {
      List<ChecklistTemplateItem> items = new ArrayList<>();
      for (ChecklistTemplateItem item : section.items()) {
        if (item.type() == null) {
          throw new IllegalArgumentException("item type is required: " + item.description());
        }
        items.add(item.withId(idOrNew(item.id())));
      }
      out.add(section.withIdAndItems(idOrNew(section.id()), items));
    }
    return out;
  }

  private static String idOrNew(String id) {
    return id == null || id.isBlank() ? UUID.randomUUID().toString() : id.trim();
  }

  private ChecklistTemplate toModel(ChecklistTemplateEntity row) {
    return new ChecklistTemplate(
        row.getId(),
        row.getName(),
        row.getDescription(),
        codec.readTemplateSections(row.getSectionsJson()),
        codec.readStrings(row.getStagesJson()),
        row.isActive(),
        row.getCreatedAt(),
        row.getUpdatedAt()
    );
  }
}
