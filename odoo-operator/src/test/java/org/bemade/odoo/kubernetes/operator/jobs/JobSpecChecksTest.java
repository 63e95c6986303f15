/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;
import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocationBuilder;

import static org.assertj.core.api.Assertions.assertThat;

class JobSpecChecksTest {

    @Test
    void shouldAcceptCompleteLocation() {
        // Given
        List<String> violations = new ArrayList<>();
        ObjectStorageLocation location = new ObjectStorageLocationBuilder()
                .withBucket("backups")
                .withKey("demo/backup.zip")
                .withCredentialsSecret("backup-credentials")
                .withEndpoint("https://minio.example.com:9000")
                .build();

        // When
        JobSpecChecks.checkLocation("spec.destination", location, violations);

        // Then
        assertThat(violations).isEmpty();
    }

    @Test
    void shouldReportEveryMissingField() {
        // Given
        List<String> violations = new ArrayList<>();

        // When
        JobSpecChecks.checkLocation("spec.source.objectStorage", new ObjectStorageLocation(), violations);

        // Then
        assertThat(violations).containsExactly(
                "spec.source.objectStorage.bucket is required",
                "spec.source.objectStorage.key is required",
                "spec.source.objectStorage.credentialsSecret is required");
    }

    @ParameterizedTest
    @CsvSource({
            "http://minio:9000, true",
            "HTTPS://s3.eu-west-1.amazonaws.com, true",
            "minio:9000, false",
            "ftp://minio:21, false",
            "http://, false",
            "'http://bad host', false"
    })
    void shouldRecogniseHttpUrls(String value, boolean expected) {
        assertThat(JobSpecChecks.isHttpUrl(value)).isEqualTo(expected);
    }
}
