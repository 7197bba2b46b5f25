package io.unitledger.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MIN_ADDRESS_LEN = 2;
    public static final int MAX_FORFEIT_ASSETS = 256;      // per clearSponsorAndForfeit call
    public static final int MAX_DECIMALS = 36;
    public static final int MAX_FEE_BPS = 10_000;
}
