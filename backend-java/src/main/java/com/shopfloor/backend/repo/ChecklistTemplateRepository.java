package com.shopfloor.backend.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.shopfloor.backend.domain.ChecklistTemplateEntity;

public interface ChecklistTemplateRepository extends JpaRepository<ChecklistTemplateEntity, Long> {
  List<ChecklistTemplateEntity> findAllByOrderByNameAsc();

  List<ChecklistTemplateEntity> findByActiveTrueOrderByNameAsc();
}
