package com.nesh.catalog.render;

import com.nesh.catalog.catalog.CatalogProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RenderConfig {

    @Bean
    public RenderCache renderCache(CatalogProperties properties) {
        return new RenderCache(properties.getRender().getCacheMaxEntries());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService renderPrewarmExecutor(CatalogProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getRender().getPrewarmPoolSize()));
    }
}
