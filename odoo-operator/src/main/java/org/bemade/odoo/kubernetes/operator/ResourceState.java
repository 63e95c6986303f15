/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.ConditionBuilder;
import org.bemade.odoo.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

import static java.util.function.Function.identity;

/**
 * The conditions of a resource, at most one per type.
 */
public class ResourceState {

    // generation, then transition time
    private static final Comparator<Condition> MOST_RECENT = Comparator.comparing(Condition::getObservedGeneration, Comparator.nullsFirst(Long::compareTo))
            .thenComparing(Condition::getLastTransitionTime, Comparator.nullsFirst(Instant::compareTo));

    // deterministic ordering among conditions read from one status: status breaks ties
    @VisibleForTesting
    static final Comparator<Condition> FRESHEST_CONDITION = MOST_RECENT
            .thenComparing(Condition::getStatus, Comparator.nullsFirst(Condition.Status::compareTo));

    private final SortedMap<Condition.Type, Condition> conditions;

    ResourceState(Map<Condition.Type, Condition> conditions) {
        Objects.requireNonNull(conditions, "conditions cannot be null");
        this.conditions = new TreeMap<>(conditions);
    }

    static ResourceState of(Condition... conditions) {
        return new ResourceState(Stream.of(conditions).collect(Collectors.toMap(Condition::getType, identity())));
    }

    /**
     * Collapses the conditions of a status to the freshest one per type.
     *
     * @param conditionsList conditions from a CR's status, possibly null
     * @return the state
     */
    static ResourceState fromList(@Nullable List<Condition> conditionsList) {
        if (conditionsList == null) {
            return new ResourceState(Map.of());
        }
        Map<Condition.Type, List<Condition>> byType = conditionsList.stream()
                .filter(condition -> condition.getType() != null)
                .collect(Collectors.groupingBy(Condition::getType));
        Map<Condition.Type, Condition> freshestConditionPerType = byType.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey,
                        entry -> entry.getValue().stream()
                                .max(FRESHEST_CONDITION)
                                .orElseThrow()));
        return new ResourceState(freshestConditionPerType);
    }

    /**
     * Merges this, newly computed, state over an existing one. Per type, the new condition wins unless the
     * existing one is strictly more recent.
     */
    public ResourceState replacementFor(ResourceState existingState) {
        Map<Condition.Type, Condition> merged = new TreeMap<>(existingState.conditions);
        this.conditions.forEach((type, replacement) -> merged.merge(type, replacement, (existing, newer) -> buildNewCondition(newer, existing)));
        return new ResourceState(merged);
    }

    Condition buildNewCondition(Condition replacement, Condition existing) {
        Condition winner = MOST_RECENT.compare(existing, replacement) > 0 ? existing : replacement;
        Condition loser = winner == replacement ? existing : replacement;
        ConditionBuilder builder = winner.edit();
        if (Objects.equals(winner.getStatus(), loser.getStatus()) && loser.getLastTransitionTime() != null) {
            // the status did not transition
            builder.withLastTransitionTime(loser.getLastTransitionTime());
        }
        return builder.build();
    }

    public List<Condition> toList() {
        return conditions.values().stream().toList();
    }

    static List<Condition> newConditions(@Nullable List<Condition> oldConditions, ResourceState newStatus) {
        ResourceState existingConditions = fromList(oldConditions);
        ResourceState replacement = newStatus.replacementFor(existingConditions);
        return replacement.toList();
    }

}
