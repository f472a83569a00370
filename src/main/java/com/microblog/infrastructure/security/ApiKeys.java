package com.microblog.infrastructure.security;

/**
 * Log-safe rendering of API keys.
 */
public final class ApiKeys {

    private static final int VISIBLE = 4;

    private ApiKeys() {}

    public static String mask(String apiKey) {
        if (apiKey == null) {
            return "null";
        }
        if (apiKey.length() <= VISIBLE * 2) {
            return "****";
        }
        return apiKey.substring(0, VISIBLE) + "..." + apiKey.substring(apiKey.length() - VISIBLE);
    }
}
