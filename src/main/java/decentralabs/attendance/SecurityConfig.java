package decentralabs.attendance;

import decentralabs.attendance.security.TrustedIdentityFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Value("${endpoint.sessions:/sessions}")
    private String sessionsEndpoint;

    @Value("${endpoint.check-ins:/check-ins}")
    private String checkInsEndpoint;

    @Value("${security.identity.user-header:X-Authenticated-User}")
    private String userHeader;

    @Value("${security.identity.roles-header:X-Authenticated-Roles}")
    private String rolesHeader;

    @Value("${security.identity.gateway-token-header:X-Gateway-Token}")
    private String gatewayTokenHeader;

    @Value("${security.identity.gateway-token:}")
    private String gatewayToken;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        // Not a bean: a Filter bean would also be registered with the servlet container.
        TrustedIdentityFilter identityFilter = new TrustedIdentityFilter(userHeader, rolesHeader, gatewayTokenHeader, gatewayToken);

        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(identityFilter, AnonymousAuthenticationFilter.class)
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers(sessionsEndpoint, sessionsEndpoint + "/**").hasRole("INSTRUCTOR")
                .requestMatchers(checkInsEndpoint, checkInsEndpoint + "/**").authenticated()
                .anyRequest().denyAll()
            );

        return http.build();
    }
}
