package com.harness.alertmigration.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alertmigration.config.MigrationProperties;
import com.harness.alertmigration.enums.ObjectStatus;
import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.NewRuleRequest;
import com.harness.alertmigration.model.OrganizationDto;
import com.harness.alertmigration.model.ProjectDto;
import com.harness.alertmigration.model.RuleData;
import com.harness.alertmigration.repository.OrganizationEntity;
import com.harness.alertmigration.repository.OrganizationRepository;
import com.harness.alertmigration.repository.ProjectEntity;
import com.harness.alertmigration.repository.ProjectRepository;
import com.harness.alertmigration.repository.RuleEntity;
import com.harness.alertmigration.repository.RuleRepository;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class JpaAlertRuleStore implements AlertRuleStore {

  private final OrganizationRepository organizationRepository;
  private final ProjectRepository projectRepository;
  private final RuleRepository ruleRepository;
  private final ObjectMapper objectMapper;
  private final TransactionTemplate transactionTemplate;
  private final int organizationBatchSize;

  public JpaAlertRuleStore(OrganizationRepository organizationRepository,
                           ProjectRepository projectRepository,
                           RuleRepository ruleRepository,
                           ObjectMapper objectMapper,
                           PlatformTransactionManager transactionManager,
                           MigrationProperties properties) {
    this.organizationRepository = organizationRepository;
    this.projectRepository = projectRepository;
    this.ruleRepository = ruleRepository;
    this.objectMapper = objectMapper;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.organizationBatchSize = properties.organizationBatchSize();
  }

  @Override
  public Iterable<OrganizationDto> listActiveOrganizations() {
    return OrganizationPageIterator::new;
  }

  @Override
  public List<ProjectDto> listActiveProjects(OrganizationDto organization) {
    return projectRepository
        .findByOrganizationIdAndStatusOrderByIdAsc(organization.id(), ObjectStatus.ACTIVE)
        .stream()
        .map(this::toDto)
        .toList();
  }

  @Override
  public List<AlertRule> listActiveRules(ProjectDto project) {
    return ruleRepository.findByProjectIdAndStatusOrderByIdAsc(project.id(), ObjectStatus.ACTIVE)
        .stream()
        .map(this::toDto)
        .toList();
  }

  @Override
  public Optional<ProjectDto> findProject(Long projectId) {
    return projectRepository.findById(projectId).map(this::toDto);
  }

  @Override
  public AlertRule createRule(Long projectId, NewRuleRequest request) {
    RuleEntity entity = new RuleEntity();
    entity.setProjectId(projectId);
    entity.setEnvironmentId(request.environmentId());
    entity.setLabel(request.label());
    entity.setStatus(ObjectStatus.ACTIVE);
    entity.setDataJson(serializeData(request.data()));
    entity.setDateAdded(Instant.now());
    return toDto(ruleRepository.save(entity));
  }

  @Override
  public AlertRule saveRule(AlertRule rule) {
    RuleEntity entity = ruleRepository.findById(rule.id())
        .orElseThrow(() -> new IllegalStateException("Rule " + rule.id() + " no longer exists"));
    entity.setLabel(rule.label());
    entity.setDataJson(serializeData(rule.data()));
    return toDto(ruleRepository.save(entity));
  }

  @Override
  public ProjectDto saveProject(ProjectDto project) {
    ProjectEntity entity = projectRepository.findById(project.id())
        .orElseThrow(() -> new IllegalStateException("Project " + project.id() + " no longer exists"));
    entity.setHasAlertFilters(project.hasAlertFilters());
    return toDto(projectRepository.save(entity));
  }

  @Override
  public <T> T withTransaction(boolean rollbackOnly, Supplier<T> work) {
    return transactionTemplate.execute(status -> {
      T result = work.get();
      if (rollbackOnly) {
        status.setRollbackOnly();
      }
      return result;
    });
  }

  private String serializeData(RuleData data) {
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize rule data", e);
    }
  }

  private RuleData deserializeData(Long ruleId, String json) {
    try {
      return objectMapper.readValue(json, RuleData.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to deserialize data of rule " + ruleId, e);
    }
  }

  private OrganizationDto toDto(OrganizationEntity entity) {
    return new OrganizationDto(entity.getId(), entity.getSlug(), entity.getName());
  }

  private ProjectDto toDto(ProjectEntity entity) {
    return new ProjectDto(
        entity.getId(),
        entity.getOrganizationId(),
        entity.getSlug(),
        entity.getName(),
        entity.isHasAlertFilters()
    );
  }

  private AlertRule toDto(RuleEntity entity) {
    return new AlertRule(
        entity.getId(),
        entity.getProjectId(),
        entity.getEnvironmentId(),
        entity.getLabel(),
        deserializeData(entity.getId(), entity.getDataJson())
    );
  }

  /** Walks active organizations by id range, one page per query. */
  private final class OrganizationPageIterator implements Iterator<OrganizationDto> {

    private Iterator<OrganizationEntity> page = List.<OrganizationEntity>of().iterator();
    private long lastId = 0L;
    private boolean exhausted;

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      List<OrganizationEntity> next = organizationRepository.findByStatusAndIdGreaterThanOrderByIdAsc(
          ObjectStatus.ACTIVE, lastId, PageRequest.of(0, organizationBatchSize));
      if (next.size() < organizationBatchSize) {
        exhausted = true;
      }
      page = next.iterator();
      return page.hasNext();
    }

    @Override
    public OrganizationDto next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      OrganizationEntity entity = page.next();
      lastId = entity.getId();
      return toDto(entity);
    }
  }
}
