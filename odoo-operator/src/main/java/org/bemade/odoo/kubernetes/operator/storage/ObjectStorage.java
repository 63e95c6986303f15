/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.storage;

import java.io.IOException;
import java.nio.file.Path;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;

/**
 * Moves whole archive files to and from a bucket. A transfer that fails or is interrupted
 * leaves nothing behind in the bucket.
 */
public interface ObjectStorage {

    void upload(ObjectStorageLocation location, ObjectStorageCredentials credentials, Path file) throws IOException, InterruptedException;

    /**
     * Downloads the object to {@code target}, replacing it.
     */
    void download(ObjectStorageLocation location, ObjectStorageCredentials credentials, Path target) throws IOException, InterruptedException;
}
