package com.khaounen.contextauth.security.risk;

public enum LocationTier {
    /** Outside the usual radius but not far off, typically still in the same country. */
    REGIONAL,
    /** Far enough away to usually mean a border was crossed. */
    DISTANT
}
