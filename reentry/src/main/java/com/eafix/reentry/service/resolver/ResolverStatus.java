package com.eafix.reentry.service.resolver;

import com.eafix.reentry.domain.resolver.Tier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Resolver status for health reports and the CLI.
 */
public record ResolverStatus(
    int totalParameterSets,
    int activeParameterSets,
    List<Tier> tierHierarchy,
    Map<Tier, Integer> tierCounts,
    Instant loadedAt,
    String source
) {}
