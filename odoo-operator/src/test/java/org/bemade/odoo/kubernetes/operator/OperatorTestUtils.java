/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.nio.file.Path;
import java.time.Duration;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceBuilder;
import org.bemade.odoo.kubernetes.operator.dispatch.RetryPolicy;

/**
 * Instances and configuration shared by the operator's tests.
 */
public final class OperatorTestUtils {

    public static final String NAMESPACE = "shop";
    public static final String RELEASE = "odoo";

    private OperatorTestUtils() {
    }

    /**
     * @return an instance with only the required fields set
     */
    public static OdooInstance minimalInstance(String name) {
        return new OdooInstanceBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(NAMESPACE)
                    .withUid(name + "-uid")
                    .withGeneration(1L)
                .endMetadata()
                .withNewSpec()
                    .withImage("odoo:17.0")
                .endSpec()
                .build();
    }

    public static OperatorConfig config(Path workDir) {
        return new OperatorConfig(
                "127.0.0.1:0",
                RELEASE,
                "postgres",
                5432,
                "postgres",
                "admin",
                null,
                "alpine/git:2.47.1",
                300,
                Duration.ofMinutes(10),
                new RetryPolicy(Duration.ofSeconds(2), 2.0, Duration.ofMinutes(5), 3),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofMinutes(1),
                Duration.ofMinutes(1),
                Duration.ofMinutes(5),
                Duration.ofSeconds(15),
                2,
                workDir,
                OperatorConfig.NeutralizationPolicyType.SQL,
                false,
                Duration.ofHours(1),
                "127.0.0.1:0",
                workDir.resolve("webhook/tls.crt"),
                workDir.resolve("webhook/tls.key"));
    }

    public static OperatorConfig config() {
        return config(Path.of(System.getProperty("java.io.tmpdir"), "odoo-operator-test"));
    }
}
