package com.harness.alertmigration.repository;

import com.harness.alertmigration.enums.ObjectStatus;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<OrganizationEntity, Long> {

  /** Keyset page of organizations with an id above {@code afterId}, in id order. */
  List<OrganizationEntity> findByStatusAndIdGreaterThanOrderByIdAsc(
      ObjectStatus status, Long afterId, Pageable pageable);
}
