/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * What a finished workflow reports.
 *
 * @param archiveSize size in bytes of the archive written or read
 * @param archiveChecksum lower case hex SHA-256 of that archive
 */
public record JobOutcome(@Nullable Long archiveSize, @Nullable String archiveChecksum) {}
