package com.example.console.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Role hierarchy limits.
 *
 * @param maxInheritanceDepth longest allowed chain, counting the role itself
 * @param verifyRevocation    re-read a role after unbinding to confirm the edge is gone
 */
@ConfigurationProperties(prefix = "app.rbac")
public record RbacProperties(
        int maxInheritanceDepth,
        Boolean verifyRevocation
) {
    public RbacProperties {
        if (maxInheritanceDepth <= 0) {
            maxInheritanceDepth = 10;
        }
        if (verifyRevocation == null) {
            verifyRevocation = Boolean.TRUE;
        }
    }

    public static RbacProperties defaults() {
        return new RbacProperties(0, null);
    }
}
