package com.nosota.msale.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

import java.util.Arrays;

/**
 * HTTP security. Account capabilities (administrator, list owner) are checked by the services
 * against the {@code X-Account-Id} header, so the chain keeps no session and offers no login.
 * API docs are only served under the {@code dev} profile.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] API_DOCS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    private final Environment environment;

    public SecurityConfig(Environment environment) {
        this.environment = environment;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean dev = Arrays.asList(environment.getActiveProfiles()).contains("dev");
        return http
                .authorizeHttpRequests(auth -> {
                    if (dev) {
                        auth.requestMatchers(API_DOCS).permitAll();
                    }
                    auth.requestMatchers("/api/v1/**", "/error").permitAll();
                    auth.anyRequest().denyAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .build();
    }
}
