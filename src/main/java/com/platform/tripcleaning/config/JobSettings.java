package com.platform.tripcleaning.config;

import java.nio.file.Path;

/**
 * What one invocation of the job reads and writes.
 */
public record JobSettings(
        Path inputFile,
        String inputFormat,
        Path zoneFile,
        Path reportDirectory,
        boolean truncateBeforeLoad
) {}
