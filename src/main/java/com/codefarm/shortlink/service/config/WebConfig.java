package com.codefarm.shortlink.service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets a UI served from another origin call the API from the browser.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ShortLinkProperties properties;

    public WebConfig(ShortLinkProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("POST", "GET")
                .allowedHeaders("Content-Type");
    }
}
