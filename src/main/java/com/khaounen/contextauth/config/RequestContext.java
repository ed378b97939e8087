package com.khaounen.contextauth.config;

public final class RequestContext {

    private static final ThreadLocal<String> IP_ADDRESS = new ThreadLocal<>();

    private RequestContext() {}

    public static void setIp(String ipAddress) {
        IP_ADDRESS.set(ipAddress);
    }

    public static String getIp() {
        return IP_ADDRESS.get();
    }

    public static void clear() {
        IP_ADDRESS.remove();
    }
}
