/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.dispatch;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import io.fabric8.kubernetes.client.KubernetesClientException;

import org.bemade.odoo.kubernetes.operator.InvalidResourceException;
import org.bemade.odoo.kubernetes.operator.MissingReferenceException;
import org.bemade.odoo.kubernetes.operator.PreconditionFailedException;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminException;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadCommandException;

/**
 * Maps exceptions onto an {@link ErrorKind}.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static ErrorKind classify(Throwable failure) {
        Throwable t = unwrap(failure);
        if (t instanceof InvalidResourceException) {
            return ErrorKind.VALIDATION;
        }
        else if (t instanceof DatabaseAdminException dae) {
            return switch (dae.getKind()) {
                case TRANSIENT -> ErrorKind.TRANSIENT;
                case CONFLICT, SOURCE_IN_USE -> ErrorKind.CONFLICT;
                case FATAL -> ErrorKind.FATAL;
            };
        }
        else if (t instanceof MissingReferenceException
                || t instanceof PreconditionFailedException
                || t instanceof WorkloadCommandException) {
            return ErrorKind.FATAL;
        }
        else if (t instanceof KubernetesClientException kce) {
            return classifyHttpCode(kce.getCode());
        }
        else if (t instanceof IOException || t instanceof TimeoutException) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.TRANSIENT;
    }

    private static ErrorKind classifyHttpCode(int code) {
        if (code == 409) {
            return ErrorKind.CONFLICT;
        }
        else if (code == 0 || code == 429 || code >= 500) {
            return ErrorKind.TRANSIENT;
        }
        else if (code >= 400) {
            return ErrorKind.FATAL;
        }
        return ErrorKind.TRANSIENT;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
