package com.phillippitts.modelelector.domain;

import java.util.Objects;

/**
 * Immutable description of one prediction backend the elector fans requests out to.
 *
 * @param name     logical backend name (e.g., "model", "canary"), unique within a registry
 * @param baseUrl  base URL without the {@code /predict} suffix
 * @param primary  whether this backend is preferred when it succeeds
 */
public record BackendTarget(String name, String baseUrl, boolean primary) {

    public BackendTarget {
        Objects.requireNonNull(name, "Backend name must not be null");
        Objects.requireNonNull(baseUrl, "Backend base URL must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Backend name must not be blank");
        }
        baseUrl = stripTrailingSlash(baseUrl.trim());
    }

    /**
     * Returns the full prediction endpoint of this backend.
     *
     * @return {@code baseUrl + "/predict"}
     */
    public String predictUrl() {
        return baseUrl + "/predict";
    }

    private static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
