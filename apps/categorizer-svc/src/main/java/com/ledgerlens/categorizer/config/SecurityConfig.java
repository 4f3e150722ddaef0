package com.ledgerlens.categorizer.config;

import com.ledgerlens.categorizer.security.AuthenticatedUserFilter;
import com.ledgerlens.categorizer.security.CookieBearerTokenFilter;
import com.ledgerlens.categorizer.security.JsonAuthErrorHandlers;
import com.ledgerlens.categorizer.security.JwtIssuerService;
import com.ledgerlens.categorizer.security.TraceIdFilter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            TraceIdFilter traceIdFilter,
            JwtAuthenticationConverter jwtAuthenticationConverter,
            AuthenticatedUserFilter authenticatedUserFilter,
            JsonAuthErrorHandlers jsonAuthErrorHandlers
    ) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(registry -> registry
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/healthz").permitAll()
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/dev/auth/login").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                )
                .oauth2ResourceServer(resource -> resource
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter))
                );

        http.addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);
        http.addFilterBefore(new CookieBearerTokenFilter(), BearerTokenAuthenticationFilter.class);
        http.addFilterAfter(authenticatedUserFilter, BearerTokenAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setPrincipalClaimName("sub");
        converter.setJwtGrantedAuthoritiesConverter(jwt -> List.of());
        return converter;
    }

    /**
     * HS256 shared-secret decoder. Tokens must be unexpired and issued by {@link JwtIssuerService#ISSUER}.
     */
    @Bean
    public JwtDecoder jwtDecoder(CategorizerProperties properties) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(JwtIssuerService.signingKey(properties.security().jwtSecret()))
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(JwtIssuerService.ISSUER));
        log.info("Security: HS256 shared-secret JWT validation enabled (issuer {})", JwtIssuerService.ISSUER);
        return decoder;
    }
}
