package com.phototrack.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Cache cache = new Cache();
    private final Geocoder geocoder = new Geocoder();
    private final Sync sync = new Sync();
    private final Generate generate = new Generate();

    public Cache getCache() {
        return cache;
    }

    public Geocoder getGeocoder() {
        return geocoder;
    }

    public Sync getSync() {
        return sync;
    }

    public Generate getGenerate() {
        return generate;
    }

    public static class Cache {
        private String file = "geocoding_cache.json";
        private double radiusKm = 5.0;
        private int loadLockTimeoutSeconds = 30;
        private int saveLockTimeoutSeconds = 60;

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public double getRadiusKm() {
            return radiusKm;
        }

        public void setRadiusKm(double radiusKm) {
            this.radiusKm = radiusKm;
        }

        public int getLoadLockTimeoutSeconds() {
            return loadLockTimeoutSeconds;
        }

        public void setLoadLockTimeoutSeconds(int loadLockTimeoutSeconds) {
            this.loadLockTimeoutSeconds = loadLockTimeoutSeconds;
        }

        public int getSaveLockTimeoutSeconds() {
            return saveLockTimeoutSeconds;
        }

        public void setSaveLockTimeoutSeconds(int saveLockTimeoutSeconds) {
            this.saveLockTimeoutSeconds = saveLockTimeoutSeconds;
        }
    }

    public static class Geocoder {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String userAgent = "PhotoTrack/2.0";
        private String contactEmail = "";
        private String language = "en";
        private int timeoutSeconds = 10;
        private long requestDelayMs = 1000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public String getContactEmail() {
            return contactEmail;
        }

        public void setContactEmail(String contactEmail) {
            this.contactEmail = contactEmail;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public long getRequestDelayMs() {
            return requestDelayMs;
        }

        public void setRequestDelayMs(long requestDelayMs) {
            this.requestDelayMs = requestDelayMs;
        }
    }

    public static class Sync {
        private long toleranceSeconds = 3600;
        private String cameraZone = "UTC";
        private List<String> extensions = new ArrayList<>(List.of("jpg", "jpeg", "nef", "cr2", "arw"));

        public long getToleranceSeconds() {
            return toleranceSeconds;
        }

        public void setToleranceSeconds(long toleranceSeconds) {
            this.toleranceSeconds = toleranceSeconds;
        }

        public String getCameraZone() {
            return cameraZone;
        }

        public void setCameraZone(String cameraZone) {
            this.cameraZone = cameraZone;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }
    }

    public static class Generate {
        private List<String> extensions = new ArrayList<>(List.of("jpg", "jpeg"));

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }
    }
}
