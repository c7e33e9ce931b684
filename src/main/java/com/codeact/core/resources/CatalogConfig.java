package com.codeact.core.resources;

import com.codeact.core.model.ResourceCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    @Bean
    public ResourceCatalog resourceCatalog(CatalogLoader loader,
                                           @Value("${codeact.catalog.location:classpath:catalog/default-catalog.json}")
                                           String location) {
        return loader.load(location);
    }
}
