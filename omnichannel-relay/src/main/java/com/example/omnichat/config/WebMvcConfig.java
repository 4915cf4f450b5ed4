package com.example.omnichat.config;

import com.example.omnichat.auth.AgentPrincipalArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final OmnichatSecurityProperties securityProperties;
    private final AgentPrincipalArgumentResolver agentPrincipalArgumentResolver;

    public WebMvcConfig(
            OmnichatSecurityProperties securityProperties,
            AgentPrincipalArgumentResolver agentPrincipalArgumentResolver) {
        this.securityProperties = securityProperties;
        this.agentPrincipalArgumentResolver = agentPrincipalArgumentResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // the widget is embedded on customer sites
        registry.addMapping("/api/widget/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);
        registry.addMapping("/api/**")
                .allowedOrigins(securityProperties.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Location")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(agentPrincipalArgumentResolver);
    }
}
