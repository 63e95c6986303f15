/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.checksum;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HexFormat;
import java.util.zip.CRC32C;
import java.util.zip.Checksum;

import javax.annotation.concurrent.NotThreadSafe;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A short, stable checksum of the parts that make up a derived resource, recorded in an
 * annotation so that drift can be spotted without a field-by-field comparison.
 * <p>
 * Parts are fed in order; null parts are skipped.
 */
@NotThreadSafe
public final class ResourceChecksum {

    /** The encoding of a checksum that nothing was added to. */
    public static final String EMPTY = "";

    private static final HexFormat HEX = HexFormat.of();

    private final Checksum crc = new CRC32C();
    private boolean fed;

    private ResourceChecksum() {
    }

    public static ResourceChecksum start() {
        return new ResourceChecksum();
    }

    public ResourceChecksum add(@Nullable String part) {
        if (part != null) {
            crc.update(part.getBytes(StandardCharsets.UTF_8));
            fed = true;
        }
        return this;
    }

    public ResourceChecksum add(long part) {
        for (int shift = Long.SIZE - Byte.SIZE; shift >= 0; shift -= Byte.SIZE) {
            crc.update((int) (part >>> shift));
        }
        fed = true;
        return this;
    }

    /**
     * Adds the parts prefixed by their count and each followed by a NUL, so that
     * {@code ["ab", "c"]} and {@code ["a", "bc"]} differ.
     */
    public ResourceChecksum addAll(Collection<String> parts) {
        add(parts.size());
        for (String part : parts) {
            add(part).add("\u0000");
        }
        return this;
    }

    /**
     * @return eight lower case hex digits, or {@link #EMPTY} if nothing was added
     */
    public String encode() {
        return fed ? HEX.toHexDigits((int) crc.getValue()) : EMPTY;
    }
}
