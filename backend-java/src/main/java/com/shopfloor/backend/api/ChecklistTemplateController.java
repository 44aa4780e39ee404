package com.shopfloor.backend.api;

import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shopfloor.backend.dto.ChecklistTemplateDtos.ChecklistTemplateIn;
import com.shopfloor.backend.dto.ChecklistTemplateDtos.ChecklistTemplateListOut;
import com.shopfloor.backend.inspection.ChecklistTemplate;
import com.shopfloor.backend.inspection.ChecklistTemplateItem;
import com.shopfloor.backend.service.ChecklistTemplateService;

import jakarta.validation.Valid;

@RestController
public class ChecklistTemplateController {
  private final ChecklistTemplateService templateService;

  public ChecklistTemplateController(ChecklistTemplateService templateService) {
    this.templateService = templateService;
  }

  @GetMapping("/v1/checklist-templates")
  public List<ChecklistTemplateListOut> listTemplates(
      @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
    return templateService.list(activeOnly).stream()
        .map(t -> {
          List<ChecklistTemplateItem> items = t.sections().stream().flatMap(s -> s.items().stream()).toList();
          return new ChecklistTemplateListOut(
              t.id(),
              t.name(),
              t.description(),
              t.sections().size(),
              items.size(),
              (int) items.stream().filter(ChecklistTemplateItem::criticalItem).count(),
              t.active(),
              t.updatedAt()
          );
        })
        .toList();
  }

  @GetMapping("/v1/checklist-templates/{templateId}")
  public ChecklistTemplate getTemplate(@PathVariable("templateId") long templateId) {
    var t = templateService.get(templateId);
    if (t == null) {
      throw new ApiNotFoundException("checklist template not found");
    }
    return t;
  }

  @PostMapping("/v1/checklist-templates")
  public Map<String, Object> createTemplate(@Valid @RequestBody ChecklistTemplateIn payload) {
    var t = templateService.create(payload);
    return Map.of("id", t.id());
  }

  @PutMapping("/v1/checklist-templates/{templateId}")
  public ChecklistTemplate updateTemplate(
      @PathVariable("templateId") long templateId,
      @Valid @RequestBody ChecklistTemplateIn payload) {
    var t = templateService.update(templateId, payload);
    if (t == null) {
      throw new ApiNotFoundException("checklist template not found");
    }
    return t;
  }
}
