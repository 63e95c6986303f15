/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.webhook;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponse;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponseBuilder;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceSpec;
import org.bemade.odoo.kubernetes.operator.InvalidResourceException;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;
import org.bemade.odoo.kubernetes.operator.model.OdooInstanceValidator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Admission decisions for {@code OdooInstance}: validation rejects what reconciliation would
 * reject, mutation writes the spec defaults into the stored object.
 */
public class OdooInstanceAdmission {

    private static final Logger LOGGER = LoggerFactory.getLogger(OdooInstanceAdmission.class);

    static final String JSON_PATCH = "JSONPatch";
    static final int REJECTED = 400;

    /**
     * One RFC 6902 operation.
     */
    record PatchOperation(String op, String path, Object value) {

        static PatchOperation add(String path, Object value) {
            return new PatchOperation("add", path, value);
        }
    }

    private final OdooInstanceValidator validator;
    private final KubernetesSerialization serialization;

    public OdooInstanceAdmission(OdooInstanceValidator validator, KubernetesSerialization serialization) {
        this.validator = validator;
        this.serialization = serialization;
    }

    /**
     * Allows the request unless the instance fails validation, or an update changes the filestore size.
     */
    public AdmissionResponse validate(AdmissionRequest request) {
        try {
            OdooInstance instance = instance(request.getObject());
            validator.validate(instance, null);
            if (request.getOldObject() != null) {
                validator.validateUpdate(instance(request.getOldObject()), instance);
            }
            LOGGER.debug("Admitting {} of OdooInstance {}/{}", request.getOperation(), request.getNamespace(), request.getName());
            return allowed(request).build();
        }
        catch (InvalidResourceException e) {
            LOGGER.info("Rejecting {} of OdooInstance {}/{}: {}", request.getOperation(), request.getNamespace(), request.getName(), e.getMessage());
            return denied(request.getUid(), e.getMessage());
        }
    }

    /**
     * Allows the request, with a JSON patch setting the defaults the submitted spec leaves out.
     * An instance without a spec is passed on untouched for validation to reject.
     */
    public AdmissionResponse mutate(AdmissionRequest request) {
        try {
            List<PatchOperation> patch = defaults(instance(request.getObject()));
            AdmissionResponseBuilder response = allowed(request);
            if (!patch.isEmpty()) {
                LOGGER.debug("Defaulting {} field(s) of OdooInstance {}/{}", patch.size(), request.getNamespace(), request.getName());
                response.withPatchType(JSON_PATCH)
                        .withPatch(Base64.getEncoder().encodeToString(serialization.asJson(patch).getBytes(StandardCharsets.UTF_8)));
            }
            return response.build();
        }
        catch (InvalidResourceException e) {
            LOGGER.info("Rejecting {} of OdooInstance {}/{}: {}", request.getOperation(), request.getNamespace(), request.getName(), e.getMessage());
            return denied(request.getUid(), e.getMessage());
        }
    }

    List<PatchOperation> defaults(OdooInstance instance) {
        List<PatchOperation> patch = new ArrayList<>();
        OdooInstanceSpec spec = instance.getSpec();
        if (spec == null) {
            return patch;
        }
        if (spec.getReplicas() == null) {
            patch.add(PatchOperation.add("/spec/replicas", 1));
        }
        if (spec.getResources() == null) {
            patch.add(PatchOperation.add("/spec/resources", DesiredSpec.defaultResources()));
        }
        if (spec.getIngress() != null && spec.getIngress().getTls() == null) {
            patch.add(PatchOperation.add("/spec/ingress/tls", true));
        }
        return patch;
    }

    private OdooInstance instance(@Nullable Object object) {
        if (object == null) {
            throw new InvalidResourceException("the admission request carries no object");
        }
        try {
            return serialization.convertValue(object, OdooInstance.class);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidResourceException("the admission request object is not an OdooInstance: " + e.getMessage());
        }
    }

    private static AdmissionResponseBuilder allowed(AdmissionRequest request) {
        return new AdmissionResponseBuilder()
                .withUid(request.getUid())
                .withAllowed(true);
    }

    static AdmissionResponse denied(@Nullable String uid, String message) {
        return new AdmissionResponseBuilder()
                .withUid(uid == null ? "" : uid)
                .withAllowed(false)
                .withStatus(new StatusBuilder().withCode(REJECTED).withMessage(message).build())
                .build();
    }
}
