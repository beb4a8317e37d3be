package com.rebalanceradar.common;

import java.math.BigInteger;

/**
 * Ethereum JSON-RPC quantity encoding ("0x"-prefixed, big-endian hex).
 */
public final class HexQuantity {

    private HexQuantity() {
    }

    public static String toHex(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static long parseLong(String hex) {
        return parseBigInteger(hex).longValueExact();
    }

    public static BigInteger parseBigInteger(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new NumberFormatException("Not a hex quantity: " + hex);
        }
        return new BigInteger(hex.substring(2), 16);
    }
}
