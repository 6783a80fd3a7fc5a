package com.streamfirst.feedrelay.domain;

/**
 * Proxy and client identity overrides for the source feed client.
 */
public record NetworkOptions(String proxyUrl, String proxyLogin, String proxyPassword, String userAgent) {

    public static final NetworkOptions NONE = new NetworkOptions(null, null, null, null);

    public boolean proxyConfigured() {
        return proxyUrl != null && !proxyUrl.isBlank();
    }

    @Override
    public String toString() {
        return "NetworkOptions{proxyUrl=" + proxyUrl
               + ", proxyLogin=" + proxyLogin
               + ", proxyPassword=" + (proxyPassword == null ? "null" : "***")
               + ", userAgent=" + userAgent + '}';
    }
}
