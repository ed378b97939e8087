package com.khaounen.contextauth.security.risk;

public enum RiskSignal {
    DEVICE_UNKNOWN,
    IP_UNKNOWN,
    LOCATION_ANOMALY,
    HOUR_ANOMALY,
    TYPING_ANOMALY
}
