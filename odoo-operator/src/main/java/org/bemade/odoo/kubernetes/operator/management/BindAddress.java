/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.management;

import java.net.InetSocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.bemade.odoo.kubernetes.operator.OperatorConfigurationException;

/**
 * Parses the {@code host:port} a server listens on.
 */
public final class BindAddress {

    private static final Logger LOGGER = LoggerFactory.getLogger(BindAddress.class);

    private BindAddress() {
    }

    /**
     * @param variable the variable the value came from, for messages
     * @param value {@code host:port}, a bare host, or empty for every interface
     * @param defaultPort port used when {@code value} names none
     * @return the address
     * @throws OperatorConfigurationException if the port is not a number
     */
    public static InetSocketAddress parse(String variable, String value, int defaultPort) {
        int colon = value.lastIndexOf(':');
        if (colon >= 0) {
            try {
                return new InetSocketAddress(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)));
            }
            catch (NumberFormatException e) {
                throw new OperatorConfigurationException(variable + " must be host:port, got '" + value + "'", e);
            }
        }
        if (value.isEmpty()) {
            return new InetSocketAddress("0.0.0.0", defaultPort);
        }
        LOGGER.warn("{} does not contain `:` assuming hostname only and binding to default port ({})", variable, defaultPort);
        return new InetSocketAddress(value, defaultPort);
    }
}
