/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.ConditionBuilder;
import org.bemade.odoo.kubernetes.api.common.JobStatus;
import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatusBuilder;
import org.bemade.odoo.kubernetes.operator.Labels;
import org.bemade.odoo.kubernetes.operator.OperatorTestUtils;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;

import static org.awaitility.Awaitility.await;

/**
 * Fixtures for driving jobs through their reconcilers.
 */
final class JobTestSupport {

    static final String CREDENTIALS_SECRET = "backup-credentials";

    private JobTestSupport() {
    }

    static OdooInstance readyInstance(String name) {
        OdooInstance instance = OperatorTestUtils.minimalInstance(name);
        instance.setStatus(new OdooInstanceStatusBuilder()
                .withObservedGeneration(1L)
                .withPhase(OdooInstanceStatus.Phase.READY)
                .withReadyReplicas(1)
                .withConditions(new ConditionBuilder()
                        .withType(Condition.Type.Ready)
                        .withStatus(Condition.Status.TRUE)
                        .withObservedGeneration(1L)
                        .withLastTransitionTime(Instant.EPOCH)
                        .withReason("Ready")
                        .withMessage("")
                        .build())
                .build());
        return instance;
    }

    static Secret credentialsSecret() {
        return new SecretBuilder()
                .withNewMetadata()
                    .withName(CREDENTIALS_SECRET)
                    .withNamespace(OperatorTestUtils.NAMESPACE)
                .endMetadata()
                .withData(Map.of(
                        ObjectStorageLocation.ACCESS_KEY_ID_KEY, ResourcesUtil.base64("AKIDEXAMPLE"),
                        ObjectStorageLocation.SECRET_ACCESS_KEY_KEY, ResourcesUtil.base64("wJalrXUtnFEMI")))
                .build();
    }

    static Pod runningPod(OdooInstance instance) {
        return new PodBuilder()
                .withNewMetadata()
                    .withName("odoo-" + ResourcesUtil.name(instance) + "-7d9f8")
                    .withNamespace(ResourcesUtil.namespace(instance))
                    .withLabels(Labels.podSelector(instance))
                .endMetadata()
                .withNewStatus()
                    .withPhase("Running")
                .endStatus()
                .build();
    }

    /**
     * Applies the status patch of {@code control}, if any, to {@code job}.
     */
    static <J extends CustomResource<?, JobStatus>> J applyStatus(J job, UpdateControl<J> control) {
        if (control.isPatchStatus()) {
            job.setStatus(control.getResource().orElseThrow().getStatus());
        }
        return job;
    }

    /**
     * Reconciles {@code job} until it reaches a terminal phase.
     */
    static <J extends CustomResource<?, JobStatus>> J runToCompletion(AbstractJobReconciler<J> reconciler, J job, Context<J> context) {
        await().atMost(10, TimeUnit.SECONDS).pollInterval(20, TimeUnit.MILLISECONDS).until(() -> {
            applyStatus(job, reconciler.reconcile(job, context));
            return job.getStatus() != null && job.getStatus().getPhase().isTerminal();
        });
        return job;
    }

    static String sha256Hex(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
