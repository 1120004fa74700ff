package com.flagship.transaction_engine.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for CSV input and output.
 *
 * Key features:
 * - Surrounding whitespace of values is trimmed (header names are always trimmed)
 * - Columns beyond the header are ignored
 * - Writers never close the stream they write to, so stdout stays usable
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
    }
}
