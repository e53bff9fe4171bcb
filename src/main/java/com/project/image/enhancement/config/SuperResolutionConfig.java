package com.project.image.enhancement.config;

import com.project.image.enhancement.service.superres.DnnSuperResolutionBackend;
import com.project.image.enhancement.service.superres.SuperResolutionBackendFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Backends hold a loaded network, so the upscaler gets a factory instead of a shared instance.
 */
@Configuration
public class SuperResolutionConfig {

    @Bean
    public SuperResolutionBackendFactory superResolutionBackendFactory() {
        return DnnSuperResolutionBackend::new;
    }
}
