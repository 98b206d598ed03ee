package com.chatlive.realtime.config;

public record ServiceConfig(String host, int port, String username, String password, Source source) {

    public enum Source {
        ADMIN,
        ENVIRONMENT,
        DEFAULT
    }

    @Override
    public String toString() {
        // Keep the password out of log lines.
        return "ServiceConfig[host=" + host + ", port=" + port + ", username=" + username + ", source=" + source + "]";
    }
}
