package com.filingsync.ingestion.config;

import com.filingsync.ingestion.client.ContentStore;
import com.filingsync.ingestion.client.LocalContentStore;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    @Bean
    ContentStore contentStore(IngestionProperties properties) {
        return new LocalContentStore(Path.of(properties.getContentStoragePath()), properties.getInlineContentMaxBytes());
    }
}
