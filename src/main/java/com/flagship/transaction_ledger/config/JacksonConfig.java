package com.flagship.transaction_ledger.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for CSV input and output.
 *
 * Key features:
 * - Decimals written in plain notation (never 1E+3)
 * - Values trimmed, blank lines skipped, surplus columns ignored
 * - Streams passed in by callers are left open
 */
@Configuration
public class JacksonConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
    }
}
