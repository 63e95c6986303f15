/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.tag;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Documents which thread (or thread pool) executes the annotated code.
 * Reconciler callbacks run on operator-sdk threads, long running job
 * steps on the job worker pool.
 */
@Documented
@Target({ ElementType.METHOD,
        ElementType.CONSTRUCTOR })
@Retention(RetentionPolicy.SOURCE)
public @interface RunsOnThread {
    /**
     * A description of the thread or pool executing the annotated code.
     * @return the thread description
     */
    String value();
}
