/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * SHA-256 of the canonical JSON form of a {@link DesiredSpec}, Base64url encoded without padding.
 * Object keys are sorted at every level.
 */
public final class SpecFingerprint {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SpecFingerprint() {
    }

    public static String of(DesiredSpec spec) {
        try {
            byte[] canonical = MAPPER.writeValueAsBytes(canonicalize(MAPPER.valueToTree(spec)));
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize desired spec", e);
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String canonicalJson(DesiredSpec spec) throws JsonProcessingException {
        return new String(MAPPER.writeValueAsBytes(canonicalize(MAPPER.valueToTree(spec))), StandardCharsets.UTF_8);
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext();) {
                names.add(it.next());
            }
            names.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        else if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> array.add(canonicalize(element)));
            return array;
        }
        return node;
    }
}
