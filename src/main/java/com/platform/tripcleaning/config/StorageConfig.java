package com.platform.tripcleaning.config;

import com.platform.tripcleaning.service.BatchLoader;
import com.platform.tripcleaning.service.FeatureDeriver;
import com.platform.tripcleaning.store.TripJdbcStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class StorageConfig {

    @Value("${trip-cleaning.load.chunk-size:50000}")
    private int chunkSize;

    @Value("${trip-cleaning.load.page-size:50000}")
    private int pageSize;

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public BatchLoader batchLoader(TripJdbcStore store, TransactionTemplate transactionTemplate,
                                   FeatureDeriver featureDeriver) {
        if (chunkSize <= 0 || pageSize <= 0) {
            throw new ConfigurationException("trip-cleaning.load chunk-size and page-size must be positive");
        }
        return new BatchLoader(store, transactionTemplate, featureDeriver, chunkSize, pageSize);
    }
}
