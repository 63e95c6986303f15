/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims on instances, so that at most one backup or restore is active per instance.
 * Claims live in memory: after a restart no job is running, so none is needed.
 */
public class JobCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobCoordinator.class);

    private final Map<String, String> claims = new ConcurrentHashMap<>();

    /**
     * Claims {@code instance} for {@code job}. Claiming an instance already held by the same job succeeds.
     *
     * @param instance {@code namespace/name} of the instance
     * @param job display name of the job, unique among jobs
     * @return the job holding the instance, if it is not {@code job}
     */
    public Optional<String> claim(String instance, String job) {
        String holder = claims.putIfAbsent(instance, job);
        if (holder == null) {
            LOGGER.debug("{} claimed {}", job, instance);
            return Optional.empty();
        }
        return holder.equals(job) ? Optional.empty() : Optional.of(holder);
    }

    /**
     * Releases the claim of {@code job}. Claims held by other jobs are left alone.
     */
    public void release(String instance, String job) {
        Objects.requireNonNull(job);
        if (claims.remove(instance, job)) {
            LOGGER.debug("{} released {}", job, instance);
        }
    }

    public Optional<String> holderOf(String instance) {
        return Optional.ofNullable(claims.get(instance));
    }
}
