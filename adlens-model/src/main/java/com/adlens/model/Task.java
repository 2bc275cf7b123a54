package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One analysis task of a plan. Lower {@code priority} runs earlier; {@code dependsOn} names other task ids
 * of the same run. Ids that do not resolve to a task of the run are tolerated by the scheduler.
 * <p>
 * Defaults applied at construction: name = id, type {@value #DEFAULT_TYPE}, target {@value #DEFAULT_TARGET},
 * scope {@value #SCOPE_ALL}, no dependencies.
 */
public record Task(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("target") String target,
        @JsonProperty("scope") String scope,
        @JsonProperty("priority") int priority,
        @JsonProperty("depends_on") List<String> dependsOn) {

    public static final String DEFAULT_TYPE = "metric_check";
    public static final String DEFAULT_TARGET = "roas";
    /** Scope that selects every campaign of the dataset. */
    public static final String SCOPE_ALL = "all_campaigns";
    public static final int DEFAULT_PRIORITY = 5;

    @JsonCreator
    public Task {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("task id must not be blank");
        }
        id = id.trim();
        name = isBlank(name) ? id : name.trim();
        type = isBlank(type) ? DEFAULT_TYPE : type.trim();
        target = isBlank(target) ? DEFAULT_TARGET : target.trim();
        scope = isBlank(scope) ? SCOPE_ALL : scope.trim();
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependsOn));
    }

    public Task(String id, int priority, List<String> dependsOn) {
        this(id, null, null, null, null, priority, dependsOn);
    }

    /** True when the scope selects the whole dataset rather than one campaign. */
    public static boolean isAllScope(String scope) {
        return isBlank(scope) || SCOPE_ALL.equalsIgnoreCase(scope.trim()) || "all".equalsIgnoreCase(scope.trim());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
