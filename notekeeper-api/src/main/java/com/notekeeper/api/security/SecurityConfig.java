package com.notekeeper.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

import java.time.Clock;

/**
 * Security configuration for the notes API.
 *
 * Design principles:
 * - Stateless (bearer token only, no sessions)
 * - Fail-closed for secured APIs
 * - Explicit public endpoints (register, login, health)
 */
@Configuration
public class SecurityConfig {

    /**
     * Public endpoints (no bearer token):
     * - Auth: register / login / token
     * - Health & error
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(
                "/api/v1/health",
                "/error",
                "/api/v1/auth/register",
                "/api/v1/auth/login",
                "/api/v1/auth/token"
            )
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/health", "/error").permitAll()
                .requestMatchers(HttpMethod.POST,
                    "/api/v1/auth/register",
                    "/api/v1/auth/login",
                    "/api/v1/auth/token"
                ).permitAll()
                .anyRequest().denyAll() // fail-closed
            )
            .build();
    }

    /**
     * Secured API (bearer token required):
     * - All remaining /api/** endpoints
     */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http, AuthGate authGate, Clock clock) throws Exception {
        AuthenticationManager bearerAuth = new ProviderManager(authGate);
        var challenge = new BearerChallengeEntryPoint(clock);
        return http
            .securityMatcher("/api/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .authenticationManagerResolver(request -> bearerAuth)
                .authenticationEntryPoint(challenge)
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(challenge))
            .build();
    }
}
