package com.phototrack.service;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phototrack.config.AppProperties;
import com.phototrack.exception.GeocodingException;
import com.phototrack.model.GeoPoint;
import com.phototrack.model.PlaceRecord;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * OpenStreetMap Nominatim client. Stateless apart from configuration; pacing is
 * the caller's job (see {@link RequestThrottle}).
 */
@Component
public class NominatimGeocodingProvider implements GeocodingProvider {

    // tried in this order for the place name
    static final String[] CITY_FIELDS = {
        "city", "town", "village", "municipality", "county",
        "state_district", "suburb", "neighbourhood", "hamlet", "locality"
    };

    private static final String CONTACT_EMAIL_KEY = "PHOTOTRACK_CONTACT_EMAIL";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String userAgent;
    private final String language;
    private final String contactEmail;

    private final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public NominatimGeocodingProvider(RestTemplate restTemplate, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        AppProperties.Geocoder geocoder = appProperties.getGeocoder();
        this.baseUrl = geocoder.getBaseUrl();
        this.userAgent = geocoder.getUserAgent();
        this.language = geocoder.getLanguage();
        this.contactEmail = resolveValue(geocoder.getContactEmail(), CONTACT_EMAIL_KEY);
    }

    @Override
    public PlaceRecord reverse(double lat, double lon, int zoom) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
            .path("/reverse")
            .queryParam("lat", String.format(Locale.ROOT, "%.6f", lat))
            .queryParam("lon", String.format(Locale.ROOT, "%.6f", lon))
            .queryParam("format", "json")
            .queryParam("accept-language", language)
            .queryParam("zoom", zoom);
        JsonNode body = get(withContact(builder));

        // Nominatim answers 200 with {"error": "..."} for points it cannot place (open sea)
        if (body.hasNonNull("error")) {
            return new PlaceRecord(null, "", "", "", lat, lon);
        }
        JsonNode address = body.path("address");
        String city = null;
        for (String field : CITY_FIELDS) {
            String value = text(address, field);
            if (StringUtils.hasText(value)) {
                city = value;
                break;
            }
        }
        return new PlaceRecord(city, text(address, "state"), text(address, "country"),
            text(address, "country_code"), lat, lon);
    }

    @Override
    public Optional<GeoPoint> search(String query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
            .path("/search")
            .queryParam("q", query)
            .queryParam("format", "json")
            .queryParam("limit", 1);
        JsonNode body = get(withContact(builder));
        if (!body.isArray() || body.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = body.get(0);
        try {
            double lat = Double.parseDouble(first.path("lat").asText());
            double lon = Double.parseDouble(first.path("lon").asText());
            return Optional.of(new GeoPoint(lat, lon));
        } catch (NumberFormatException e) {
            throw new GeocodingException("Malformed coordinates in search result for '" + query + "'", e);
        }
    }

    private URI withContact(UriComponentsBuilder builder) {
        if (StringUtils.hasText(contactEmail)) {
            builder.queryParam("email", contactEmail);
        }
        return builder.build().encode().toUri();
    }

    private JsonNode get(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new GeocodingException("HTTP " + response.getStatusCode().value() + " from " + uri.getPath());
            }
            String body = response.getBody();
            if (!StringUtils.hasText(body)) {
                throw new GeocodingException("Empty response from " + uri.getPath());
            }
            return objectMapper.readTree(body);
        } catch (RestClientException e) {
            throw new GeocodingException("Request to " + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new GeocodingException("Malformed response from " + uri.getPath(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : "";
    }

    private String resolveValue(String propertyValue, String key) {
        if (StringUtils.hasText(propertyValue)) {
            return propertyValue;
        }
        String systemValue = System.getenv(key);
        if (StringUtils.hasText(systemValue)) {
            return systemValue;
        }
        String dotenvValue = dotenv.get(key);
        return StringUtils.hasText(dotenvValue) ? dotenvValue : null;
    }
}
