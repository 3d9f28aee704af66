package com.harness.alertmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.harness.alertmigration.enums.PredicateKind;
import com.harness.alertmigration.migration.ConditionFilterMapping;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a rule's condition list. Stored as a flat JSON object: {@code id} names the
 * predicate implementation and every other key is a parameter of that predicate
 * ({@code key}, {@code match}, {@code value}, ...).
 */
public record ConditionDto(
    String id,
    Map<String, Object> params
) {

  public ConditionDto {
    Objects.requireNonNull(id, "condition id");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (params != null) {
      copy.putAll(params);
    }
    copy.remove("id");
    params = Collections.unmodifiableMap(copy);
  }

  public static ConditionDto of(String id) {
    return new ConditionDto(id, Map.of());
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ConditionDto fromJson(Map<String, Object> json) {
    Object id = json == null ? null : json.get("id");
    if (!(id instanceof String value)) {
      throw new IllegalArgumentException("Condition is missing a string id: " + json);
    }
    return new ConditionDto(value, json);
  }

  @JsonValue
  public Map<String, Object> toJson() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("id", id);
    json.putAll(params);
    return json;
  }

  public PredicateKind kind() {
    return ConditionFilterMapping.kindOf(id);
  }

  public ConditionDto withId(String newId) {
    return new ConditionDto(newId, params);
  }
}
