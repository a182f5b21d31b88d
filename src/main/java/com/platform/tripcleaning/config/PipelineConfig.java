package com.platform.tripcleaning.config;

import com.platform.tripcleaning.domain.MonitoredColumn;
import com.platform.tripcleaning.domain.TimeOfDayScheme;
import com.platform.tripcleaning.service.FeatureDeriver;
import com.platform.tripcleaning.service.OutlierDetector;
import com.platform.tripcleaning.service.TripDeduplicator;
import com.platform.tripcleaning.service.TripValidator;
import com.platform.tripcleaning.service.ValidationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the cleaning stages from {@code trip-cleaning.*} properties.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Value("${trip-cleaning.expected-year:2019}")
    private int expectedYear;

    @Value("${trip-cleaning.time-of-day-scheme:FOUR_BUCKET}")
    private String timeOfDayScheme;

    @Value("${trip-cleaning.max-speed-mph:200}")
    private double maxSpeedMph;

    @Value("${trip-cleaning.validation.min-fare:0.01}")
    private double minFare;

    @Value("${trip-cleaning.validation.max-fare:500}")
    private double maxFare;

    @Value("${trip-cleaning.validation.max-distance:100}")
    private double maxDistance;

    @Value("${trip-cleaning.validation.min-passengers:1}")
    private int minPassengers;

    @Value("${trip-cleaning.validation.max-passengers:6}")
    private int maxPassengers;

    @Value("${trip-cleaning.validation.min-duration-seconds:10}")
    private long minDurationSeconds;

    @Value("${trip-cleaning.validation.max-duration-seconds:86400}")
    private long maxDurationSeconds;

    @Value("${trip-cleaning.validation.sanity-rules-enabled:true}")
    private boolean sanityRulesEnabled;

    @Value("${trip-cleaning.outliers.threshold:3.0}")
    private double outlierThreshold;

    @Value("${trip-cleaning.outliers.columns:fare_amount,trip_distance,tip_amount}")
    private String[] outlierColumns;

    @Bean
    public ValidationSettings validationSettings() {
        if (minFare > maxFare || minPassengers > maxPassengers || minDurationSeconds > maxDurationSeconds) {
            throw new ConfigurationException("Validation lower bounds must not exceed upper bounds");
        }
        return new ValidationSettings(expectedYear, minFare, maxFare, maxDistance, minPassengers,
                maxPassengers, minDurationSeconds, maxDurationSeconds, maxSpeedMph, sanityRulesEnabled);
    }

    @Bean
    public TripValidator tripValidator(ValidationSettings settings) {
        log.info("Validator: expected year {}, sanity rules {}", settings.expectedYear(),
                settings.sanityRulesEnabled() ? "on" : "off");
        return new TripValidator(settings);
    }

    @Bean
    public OutlierDetector outlierDetector() {
        List<MonitoredColumn> columns = new ArrayList<>();
        try {
            for (String name : outlierColumns) {
                if (!name.isBlank()) {
                    columns.add(MonitoredColumn.fromName(name));
                }
            }
            log.info("Outlier detector: threshold {}, columns {}", outlierThreshold, columns);
            return new OutlierDetector(outlierThreshold, columns);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid outlier settings: " + e.getMessage());
        }
    }

    @Bean
    public TripDeduplicator tripDeduplicator() {
        return new TripDeduplicator();
    }

    @Bean
    public FeatureDeriver featureDeriver() {
        try {
            TimeOfDayScheme scheme = TimeOfDayScheme.valueOf(timeOfDayScheme.trim().toUpperCase(Locale.ROOT));
            return new FeatureDeriver(scheme, maxSpeedMph);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid feature settings: " + e.getMessage());
        }
    }
}
