package com.microblog.infrastructure.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves stored media under the public URL prefix that feed items link to.
 */
@Configuration
public class MediaResourceConfig implements WebMvcConfigurer {

    private final AppProperties appProperties;

    public MediaResourceConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = appProperties.getMedia().getUrlPrefix();
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String location = Path.of(appProperties.getMedia().getStoragePath()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler(prefix + "/**")
            .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
