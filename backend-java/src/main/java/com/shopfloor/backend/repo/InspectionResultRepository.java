package com.shopfloor.backend.repo;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.shopfloor.backend.domain.InspectionResultEntity;

public interface InspectionResultRepository extends JpaRepository<InspectionResultEntity, Long> {
  List<InspectionResultEntity> findByOrderIdOrderByInspectionDateDescIdDesc(String orderId, Pageable pageable);

  List<InspectionResultEntity> findByOrderIdAndItemIdOrderByInspectionDateDescIdDesc(String orderId, String itemId, Pageable pageable);

  List<InspectionResultEntity> findAllByOrderByInspectionDateDescIdDesc(Pageable pageable);
}
