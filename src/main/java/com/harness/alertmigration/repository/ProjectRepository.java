package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.ObjectStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<ProjectEntity, Long> {

  List<ProjectEntity> findByOrganizationIdAndStatusOrderByIdAsc(Long organizationId, ObjectStatus status);
}
