package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Administrative unit a receiver artifact was scraped for (store city / region / country),
 * optionally with a coordinate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeoInfo {
    private String country;
    private String region;
    private String name;
    private Double latitude;
    private Double longitude;

    public GeoInfo() {}

    public GeoInfo(String country, String region, String name) {
        this.country = country;
        this.region = region;
        this.name = name;
    }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }
    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }

    @JsonIgnore
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /** "country, region, name" without blanks and case-insensitive repeats; null when nothing is known. */
    @JsonIgnore
    public String displayName() {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String part : new String[]{country, region, name}) {
            if (part == null || part.isBlank()) continue;
            String token = part.trim();
            if (seen.add(token.toLowerCase())) out.add(token);
        }
        return out.isEmpty() ? null : String.join(", ", out);
    }

    public GeoInfo copy() {
        GeoInfo g = new GeoInfo(country, region, name);
        g.setLatitude(latitude);
        g.setLongitude(longitude);
        return g;
    }
}
