package com.warden.authzservice.config;

import com.warden.authzservice.infrastructure.web.RequiresCapabilityInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: capability interceptor and CORS for local front ends.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequiresCapabilityInterceptor capabilityInterceptor;

    public WebConfig(RequiresCapabilityInterceptor capabilityInterceptor) {
        this.capabilityInterceptor = capabilityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(capabilityInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // production origins come from the deployment's own configuration
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
