package com.notekeeper.api.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Auth config, bound once at startup and injected where needed.
 *
 * IMPORTANT:
 * - jwtSecret must come from env (NOTEKEEPER_JWT_SECRET)
 * - a blank secret is only tolerated under the dev/test profiles (see {@link JwtBeans})
 */
@ConfigurationProperties(prefix = "notekeeper.auth")
public record AuthProperties(

    String jwtSecret,

    @DefaultValue("notekeeper")
    String issuer,

    /**
     * Lifetime of an access token.
     */
    @DefaultValue("60")
    long accessTokenMinutes,

    /**
     * BCrypt log rounds (4..31).
     */
    @DefaultValue("10")
    int bcryptStrength

) {

    public Duration accessTokenTtl() {
        return Duration.ofMinutes(accessTokenMinutes);
    }
}
