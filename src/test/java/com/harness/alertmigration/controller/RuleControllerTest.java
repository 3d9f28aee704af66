package com.harness.alertmigration.controller;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.ProjectDto;
import com.harness.alertmigration.model.RuleData;
import com.harness.alertmigration.store.AlertRuleStore;
import com.harness.alertmigration.support.RuleFixtures;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private AlertRuleStore store;

  @Test
  void listsActiveRulesOfProject() throws Exception {
    ProjectDto project = new ProjectDto(10L, 1L, "backend", "Backend", true);
    AlertRule rule = new AlertRule(100L, 10L, null, "Errors (2)",
        new RuleData(MatchMode.ANY, MatchMode.ANY,
            List.of(RuleFixtures.tagged("env", "prod").withId("sentry.rules.filters.tagged_event.TaggedEventFilter")),
            RuleFixtures.notifyActions(), 30));
    given(store.findProject(10L)).willReturn(Optional.of(project));
    given(store.listActiveRules(project)).willReturn(List.of(rule));

    mockMvc.perform(get("/api/v1/projects/10/rules"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(100))
        .andExpect(jsonPath("$[0].label").value("Errors (2)"))
        .andExpect(jsonPath("$[0].data.action_match").value("any"))
        .andExpect(jsonPath("$[0].data.filter_match").value("any"))
        .andExpect(jsonPath("$[0].data.conditions[0].id").value("sentry.rules.filters.tagged_event.TaggedEventFilter"))
        .andExpect(jsonPath("$[0].data.conditions[0].key").value("env"));
  }

  @Test
  void unknownProjectReturns404() throws Exception {
    given(store.findProject(99L)).willReturn(Optional.empty());

    mockMvc.perform(get("/api/v1/projects/99/rules"))
        .andExpect(status().isNotFound());
  }
}
