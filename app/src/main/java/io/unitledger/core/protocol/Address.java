package io.unitledger.core.protocol;

/**
 * Address rules shared by beneficiaries, sponsors, assets and the sink.
 * Addresses are opaque strings; only their shape is checked here.
 */
public final class Address {
    private Address(){}

    public static boolean isValid(String addr) {
        if (addr == null) return false;
        int len = addr.length();
        if (len < ProtocolLimits.MIN_ADDRESS_LEN || len > ProtocolLimits.MAX_ADDRESS_LEN) return false;
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '-' || c == ':' || c == '.';
            if (!ok) return false;
        }
        return true;
    }

    /** Throws {@link LedgerException} with {@link LedgerError#INVALID_ADDRESS} unless the address is well formed. */
    public static String require(String addr, String role) {
        if (!isValid(addr)) {
            throw new LedgerException(LedgerError.INVALID_ADDRESS, "Invalid " + role + " address: " + addr);
        }
        return addr;
    }
}
