package com.platform.tripcleaning.service;

import com.platform.tripcleaning.config.ConfigurationException;
import com.platform.tripcleaning.domain.Zone;
import com.platform.tripcleaning.repository.ZoneRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the {@code zones} lookup table from the TLC zone CSV
 * ({@code LocationID,Borough,Zone,service_zone}).
 */
@Service
public class ZoneLoader {

    private static final Logger log = LoggerFactory.getLogger(ZoneLoader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final ZoneRepository zoneRepository;

    public ZoneLoader(ZoneRepository zoneRepository) {
        this.zoneRepository = zoneRepository;
    }

    /**
     * Loads the file only when the table has no rows yet.
     *
     * @return number of zones inserted, 0 when the table was already populated
     */
    @Transactional
    public int loadIfEmpty(Path zoneFile) throws IOException {
        long existing = zoneRepository.count();
        if (existing > 0) {
            log.info("Zones table already holds {} rows, skipping zone load", existing);
            return 0;
        }
        List<Zone> zones = readZones(zoneFile);
        zoneRepository.saveAll(zones);
        log.info("Loaded {} zones from {}", zones.size(), zoneFile);
        return zones.size();
    }

    static List<Zone> readZones(Path zoneFile) throws IOException {
        if (!Files.isRegularFile(zoneFile)) {
            throw new ConfigurationException("Zone lookup file not found: " + zoneFile);
        }
        List<Zone> zones = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(zoneFile, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String id = record.get("LocationID");
                try {
                    zones.add(new Zone(Integer.valueOf(id), record.get("Borough"),
                            record.get("Zone"), emptyToNull(record.get("service_zone"))));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Invalid LocationID '" + id + "' on line "
                            + record.getRecordNumber() + " of " + zoneFile);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Zone lookup file " + zoneFile + " is missing a column: "
                    + e.getMessage());
        }
        return zones;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
