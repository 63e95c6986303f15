/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * AssertJ assertions for the statuses and metadata of Odoo operator resources.
 */
package org.bemade.odoo.kubernetes.operator.assertj;
