package com.harness.alertmigration.model;

public record OrganizationDto(
    Long id,
    String slug,
    String name
) {}
