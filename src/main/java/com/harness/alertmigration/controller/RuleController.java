package com.harness.alertmigration.controller;

import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.store.AlertRuleStore;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/rules")
public class RuleController {

  private final AlertRuleStore store;

  public RuleController(AlertRuleStore store) {
    this.store = store;
  }

  @GetMapping
  public ResponseEntity<List<AlertRule>> listRules(@PathVariable Long projectId) {
    return store.findProject(projectId)
        .map(project -> ResponseEntity.ok(store.listActiveRules(project)))
        .orElse(ResponseEntity.notFound().build());
  }
}
