package com.tally.metering.domain.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the integrity hash of an {@link AuditEntry}.
 *
 * <p>The digest is SHA-256 over the fields below joined with {@code |}, nulls written as empty
 * strings, in this order: id, tenant, action type, target, description, actor, timestamp
 * (ISO-8601), before value, after value. Backslashes and separators inside a field are escaped
 * with a backslash, so text moved across a field boundary changes the digest. Changing the
 * order, the separator or the escaping invalidates every stored hash.
 */
public final class AuditHasher {

    private static final String SEPARATOR = "|";

    private AuditHasher() {
        // utility class
    }

    /** Hex-encoded SHA-256 of the canonical form. */
    public static String hash(AuditEntry entry) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical(entry).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /** The string the hash is computed over. */
    public static String canonical(AuditEntry entry) {
        return String.join(
                SEPARATOR,
                text(entry.id()),
                text(entry.tenantId()),
                text(entry.actionType()),
                text(entry.targetRef()),
                text(entry.description()),
                text(entry.actorId()),
                text(entry.occurredAt()),
                text(entry.beforeValue()),
                text(entry.afterValue()));
    }

    private static String text(Object value) {
        if (value == null) {
            return "";
        }
        return value.toString().replace("\\", "\\\\").replace(SEPARATOR, "\\" + SEPARATOR);
    }
}
