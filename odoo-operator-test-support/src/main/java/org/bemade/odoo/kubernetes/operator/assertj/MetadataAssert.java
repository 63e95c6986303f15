/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import java.util.Map;
import java.util.function.Consumer;

import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.Assertions;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.MapAssert;
import org.assertj.core.api.ObjectAssert;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;

@SuppressWarnings("UnusedReturnValue")
public class MetadataAssert<T extends HasMetadata> extends AbstractObjectAssert<MetadataAssert<T>, T> {
    private MetadataAssert(T actual) {
        super(actual, MetadataAssert.class);
    }

    public static <T extends HasMetadata> MetadataAssert<T> assertThat(T actual) {
        return new MetadataAssert<>(actual);
    }

    public MapAssert<String, String> hasAnnotationSatisfying(String annotationName, Consumer<String> expectedValueConsumer) {
        return hasAnnotations()
                .hasEntrySatisfying(annotationName, expectedValueConsumer);
    }

    public MapAssert<String, String> hasAnnotations() {
        return annotations().isNotEmpty();
    }

    public MapAssert<String, String> doesNotHaveAnnotation(String annotationName) {
        return annotations().doesNotContainKey(annotationName);
    }

    public MetadataAssert<T> hasLabels(Map<String, String> expected) {
        assertHasObjectMeta().extracting(ObjectMeta::getLabels)
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, String.class))
                .containsAllEntriesOf(expected);
        return this;
    }

    public MetadataAssert<T> hasOwnerRefs(OwnerReference... ownerReferences) {
        Assertions.assertThat(actual.getMetadata().getOwnerReferences()).containsExactly(ownerReferences);
        return this;
    }

    public MetadataAssert<T> hasNoOwnerRefs() {
        assertHasObjectMeta();
        Assertions.assertThat(actual.getMetadata().getOwnerReferences()).isNullOrEmpty();
        return this;
    }

    private MapAssert<String, String> annotations() {
        return assertHasObjectMeta()
                .extracting(ObjectMeta::getAnnotations)
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, String.class));
    }

    ObjectAssert<ObjectMeta> assertHasObjectMeta() {
        return Assertions.assertThat(actual)
                .isNotNull()
                .asInstanceOf(InstanceOfAssertFactories.type(HasMetadata.class))
                .extracting(HasMetadata::getMetadata)
                .isNotNull()
                .asInstanceOf(InstanceOfAssertFactories.type(ObjectMeta.class));
    }
}
