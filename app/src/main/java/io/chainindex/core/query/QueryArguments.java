package io.chainindex.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Hashes;

/**
 * Validation of JSON request arguments. Values of the wrong JSON type are rejected, never
 * coerced.
 */
public final class QueryArguments {
    private QueryArguments() {}

    public static int nonNegativeInteger(JsonNode value) {
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
            throw new BadRequestException(describe(value) + " should be a non-negative integer");
        }
        return value.intValue();
    }

    /** Like {@link #nonNegativeInteger} but a missing argument gives {@code fallback}. */
    public static int nonNegativeInteger(JsonNode value, int fallback) {
        return value == null || value.isMissingNode() ? fallback : nonNegativeInteger(value);
    }

    public static boolean bool(JsonNode value) {
        if (value == null || !value.isBoolean()) {
            throw new BadRequestException(describe(value) + " should be a boolean value");
        }
        return value.booleanValue();
    }

    /** A 64-character hex transaction hash in display order. */
    public static Hash txHash(JsonNode value) {
        if (!isHash(value)) {
            throw new BadRequestException(describe(value) + " should be a transaction hash");
        }
        return Hash.fromHex(value.textValue());
    }

    /**
     * Converts an Electrum script hash, the byte-reversed SHA-256 of a script, to the
     * script's hashX.
     */
    public static HashX scriptHash(JsonNode value) {
        if (!isHash(value)) {
            throw new BadRequestException(describe(value) + " is not a valid script hash");
        }
        return HashX.of(Hashes.hexToHash(value.textValue()), 0);
    }

    public static String hexString(JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new BadRequestException(describe(value) + " should be a hex string");
        }
        try {
            Hashes.fromHex(value.textValue());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(describe(value) + " should be a hex string");
        }
        return value.textValue();
    }

    private static boolean isHash(JsonNode value) {
        if (value == null || !value.isTextual() || value.textValue().length() != 2 * Hash.LENGTH) {
            return false;
        }
        for (char c : value.textValue().toCharArray()) {
            if (Hashes.hexDigit(c) < 0) {
                return false;
            }
        }
        return true;
    }

    private static String describe(JsonNode value) {
        return value == null || value.isMissingNode() ? "missing argument" : value.toString();
    }
}
