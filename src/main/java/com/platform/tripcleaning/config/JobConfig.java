package com.platform.tripcleaning.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class JobConfig {

    @Value("${trip-cleaning.input.file:data/yellow_tripdata_2019-01.parquet}")
    private String inputFile;

    @Value("${trip-cleaning.input.format:auto}")
    private String inputFormat;

    @Value("${trip-cleaning.input.zone-file:data/taxi_zone_lookup.csv}")
    private String zoneFile;

    @Value("${trip-cleaning.report.directory:reports}")
    private String reportDirectory;

    @Value("${trip-cleaning.load.truncate-before-load:false}")
    private boolean truncateBeforeLoad;

    @Bean
    public JobSettings jobSettings() {
        return new JobSettings(Path.of(inputFile), inputFormat, Path.of(zoneFile),
                Path.of(reportDirectory), truncateBeforeLoad);
    }
}
