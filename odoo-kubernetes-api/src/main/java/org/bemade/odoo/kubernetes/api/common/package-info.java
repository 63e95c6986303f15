/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Types shared between the Odoo custom resources.
 */
package org.bemade.odoo.kubernetes.api.common;
