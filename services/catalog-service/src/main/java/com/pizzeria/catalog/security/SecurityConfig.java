package com.pizzeria.catalog.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer-token security.
 *
 * Public: {@code GET /}, {@code POST /signup}, {@code POST /login},
 * {@code GET /pizzas/{id}}. Every other route needs a caller resolved from an
 * access token.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           IdentityService identityService,
                                           JsonAuthenticationEntryPoint entryPoint) throws Exception {
        http
            // no cookies or sessions, so nothing for CSRF to protect
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.GET, "/").permitAll()
                .requestMatchers(HttpMethod.POST, "/signup", "/login").permitAll()
                .requestMatchers(HttpMethod.GET, "/pizzas/{pizzaId}").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )

            .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint))
            .addFilterBefore(new JwtAuthenticationFilter(identityService), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
