package com.phototrack.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phototrack.cache.GeocodingCache;
import com.phototrack.gpx.GpxReader;
import com.phototrack.gpx.GpxWriter;
import com.phototrack.photo.ImagingPhotoMetadataReader;
import com.phototrack.photo.ImagingPhotoMetadataWriter;
import com.phototrack.photo.PhotoMetadataReader;
import com.phototrack.photo.PhotoMetadataWriter;
import com.phototrack.photo.PhotoScanner;
import com.phototrack.service.RequestThrottle;
import com.phototrack.service.TrackMatcher;

/**
 * Wires the cache, throttle and file-format adapters from {@link AppProperties}.
 * One cache and one throttle per run.
 */
@Configuration
public class GeocodingConfig {

    private final AppProperties appProperties;

    public GeocodingConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public GeocodingCache geocodingCache(ObjectMapper objectMapper) {
        AppProperties.Cache cache = appProperties.getCache();
        return new GeocodingCache(
            Path.of(cache.getFile()),
            cache.getRadiusKm(),
            Duration.ofSeconds(cache.getLoadLockTimeoutSeconds()),
            Duration.ofSeconds(cache.getSaveLockTimeoutSeconds()),
            objectMapper
        );
    }

    @Bean
    public RequestThrottle requestThrottle() {
        return new RequestThrottle(appProperties.getGeocoder().getRequestDelayMs());
    }

    @Bean
    public TrackMatcher trackMatcher() {
        return new TrackMatcher(appProperties.getSync().getToleranceSeconds());
    }

    @Bean
    public PhotoMetadataReader photoMetadataReader() {
        return new ImagingPhotoMetadataReader(ZoneId.of(appProperties.getSync().getCameraZone()));
    }

    @Bean
    public PhotoMetadataWriter photoMetadataWriter() {
        return new ImagingPhotoMetadataWriter();
    }

    @Bean
    public PhotoScanner photoScanner() {
        return new PhotoScanner();
    }

    @Bean
    public GpxReader gpxReader() {
        return new GpxReader();
    }

    @Bean
    public GpxWriter gpxWriter() {
        return new GpxWriter();
    }
}
