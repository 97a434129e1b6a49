package com.apimerge.config;

import com.apimerge.engine.DocumentCodec;
import com.apimerge.engine.MergeEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the framework-free engine classes as beans.
 */
@Configuration
public class EngineConfig {

    @Bean
    public MergeEngine mergeEngine() {
        return new MergeEngine();
    }

    @Bean
    public DocumentCodec documentCodec() {
        return new DocumentCodec();
    }
}
