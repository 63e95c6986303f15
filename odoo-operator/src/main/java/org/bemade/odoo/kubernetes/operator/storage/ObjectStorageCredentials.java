/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.storage;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;
import org.bemade.odoo.kubernetes.operator.MissingReferenceException;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;

/**
 * Static credentials for one transfer, read from the secret a job references.
 *
 * @param accessKeyId access key id
 * @param secretAccessKey secret access key
 */
public record ObjectStorageCredentials(String accessKeyId, String secretAccessKey) {

    public ObjectStorageCredentials {
        Objects.requireNonNull(accessKeyId);
        Objects.requireNonNull(secretAccessKey);
    }

    /**
     * @throws MissingReferenceException if the secret, or one of its keys, is absent
     */
    public static ObjectStorageCredentials resolve(KubernetesClient client, String namespace, ObjectStorageLocation location) {
        String secretName = location.getCredentialsSecret();
        Secret secret = client.secrets().inNamespace(namespace).withName(secretName).get();
        if (secret == null) {
            throw new MissingReferenceException("Secret " + namespace + "/" + secretName + " does not exist");
        }
        return new ObjectStorageCredentials(
                requiredKey(secret, ObjectStorageLocation.ACCESS_KEY_ID_KEY),
                requiredKey(secret, ObjectStorageLocation.SECRET_ACCESS_KEY_KEY));
    }

    private static String requiredKey(Secret secret, String key) {
        return ResourcesUtil.secretValue(secret, key)
                .orElseThrow(() -> new MissingReferenceException("Secret " + ResourcesUtil.namespace(secret) + "/" + ResourcesUtil.name(secret)
                        + " has no key '" + key + "'"));
    }

    @Override
    public String toString() {
        return "ObjectStorageCredentials[accessKeyId=" + accessKeyId + ", secretAccessKey=***]";
    }
}
