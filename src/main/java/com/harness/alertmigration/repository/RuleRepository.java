package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.ObjectStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleRepository extends JpaRepository<RuleEntity, Long> {

  List<RuleEntity> findByProjectIdAndStatusOrderByIdAsc(Long projectId, ObjectStatus status);
}
