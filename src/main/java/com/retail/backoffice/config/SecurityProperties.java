package com.retail.backoffice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Report users, bound from {@code reports.security.users[n].*}.
 */
@ConfigurationProperties(prefix = "reports.security")
public record SecurityProperties(List<User> users) {

    public SecurityProperties {
        users = users != null ? users : List.of();
    }

    public record User(String username, String password, List<String> roles) {
    }
}
