package com.example.pdfcompress.config;

import com.example.pdfcompress.domain.model.CompressionLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings bound from {@code pdf.compression.*} in application.properties.
 *
 * @param defaultQuality         quality used when a request does not specify one
 * @param defaultLevel           compression level used when a request does not specify one
 * @param defaultPreserveQuality preserve-quality flag used when a request does not specify one
 * @param packObjectStreams      whether the writer packs objects into object streams
 * @param requestTimeout         how long a synchronous request may run before it is cancelled
 * @param worker                 background executor sizing
 */
@ConfigurationProperties(prefix = "pdf.compression")
public record CompressionProperties(
        @DefaultValue("75") int defaultQuality,
        @DefaultValue("MEDIUM") CompressionLevel defaultLevel,
        @DefaultValue("true") boolean defaultPreserveQuality,
        @DefaultValue("true") boolean packObjectStreams,
        @DefaultValue("2m") Duration requestTimeout,
        @DefaultValue Worker worker
) {

    /**
     * @return the same values Spring binds when nothing is configured
     */
    public static CompressionProperties defaults() {
        return new CompressionProperties(75, CompressionLevel.MEDIUM, true, true, Duration.ofMinutes(2), Worker.defaults());
    }

    /**
     * Sizing of the executor that runs compression requests.
     *
     * @param corePoolSize  threads kept alive
     * @param maxPoolSize   upper bound of concurrent requests
     * @param queueCapacity requests waiting for a free thread
     */
    public record Worker(
            @DefaultValue("2") int corePoolSize,
            @DefaultValue("4") int maxPoolSize,
            @DefaultValue("50") int queueCapacity
    ) {

        public static Worker defaults() {
            return new Worker(2, 4, 50);
        }
    }
}
