/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Documentation-only annotations.
 */
package org.bemade.odoo.tag;
