/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Secret;

import edu.umd.cs.findbugs.annotations.Nullable;

public class ResourcesUtil {

    private ResourcesUtil() {
    }

    private static boolean inRange(char ch, char start, char end) {
        return start <= ch && ch <= end;
    }

    private static boolean isAlnum(char ch) {
        return inRange(ch, 'a', 'z')
                || inRange(ch, '0', '9');
    }

    /**
     * @param string candidate
     * @param rfc1035 if true, the label must start with a letter
     * @return true if {@code string} is a lower case DNS label of at most 63 characters
     */
    public static boolean isDnsLabel(String string, boolean rfc1035) {
        int length = string.length();
        if (length == 0 || length > 63) {
            return false;
        }
        var ch = string.charAt(0);
        if (!(rfc1035 ? inRange(ch, 'a', 'z') : isAlnum(ch))) {
            return false;
        }
        if (length > 1) {
            if (length > 2) {
                for (int index = 1; index < length - 1; index++) {
                    ch = string.charAt(index);
                    if (!(isAlnum(ch) || ch == '-')) {
                        return false;
                    }
                }
            }
            ch = string.charAt(length - 1);
            return isAlnum(ch);
        }
        return true;
    }

    /**
     * @param string candidate
     * @return true if {@code string} is a DNS subdomain: dot separated DNS labels, at most 253 characters
     */
    public static boolean isDnsSubdomain(String string) {
        if (string.isEmpty() || string.length() > 253) {
            return false;
        }
        for (String label : string.split("\\.", -1)) {
            if (!isDnsLabel(label, false)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A controller owner reference, so that deleting the owner garbage collects the object.
     */
    public static <O extends HasMetadata> OwnerReference newOwnerReferenceTo(O owner) {
        return new OwnerReferenceBuilder()
                .withKind(owner.getKind())
                .withApiVersion(owner.getApiVersion())
                .withName(name(owner))
                .withUid(uid(owner))
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    public static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    public static String namespace(HasMetadata resource) {
        return resource.getMetadata().getNamespace();
    }

    public static String uid(HasMetadata resource) {
        return resource.getMetadata().getUid();
    }

    /**
     * Extract generation from a resource's {@code metadata} object.
     *
     * @param resource the object from which to extract the metadata generation.
     * @return the metadata generation or <code>0</code> if the metadata or the generation itself is null.
     */
    public static long generation(HasMetadata resource) {
        ObjectMeta metadata = resource.getMetadata();
        if (metadata == null || metadata.getGeneration() == null) {
            return 0L;
        }
        return metadata.getGeneration();
    }

    public static String namespacedSlug(HasMetadata resource) {
        return resource.getKind() + "[" + namespace(resource) + "/" + name(resource) + "]";
    }

    public static Map<String, String> annotations(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .orElse(Map.of());
    }

    /**
     * Reads a key of a secret, whether it was written through {@code data} or {@code stringData}.
     *
     * @param secret the secret
     * @param key the key
     * @return the decoded value, if present
     */
    public static Optional<String> secretValue(@Nullable Secret secret, String key) {
        if (secret == null) {
            return Optional.empty();
        }
        if (secret.getData() != null && secret.getData().containsKey(key)) {
            byte[] decoded = Base64.getDecoder().decode(secret.getData().get(key));
            return Optional.of(new String(decoded, StandardCharsets.UTF_8));
        }
        if (secret.getStringData() != null && secret.getStringData().containsKey(key)) {
            return Optional.of(secret.getStringData().get(key));
        }
        return Optional.empty();
    }

    public static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
