package com.incoresoft.sosync.domain.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A coordinate with an optional human readable address.
 */
public record LocationData(@JsonProperty("latitude") double latitude,
                           @JsonProperty("longitude") double longitude,
                           @JsonProperty("address") String address) {

    public static LocationData unknown(String address) {
        return new LocationData(0, 0, address);
    }

    public String describe() {
        if (address != null && !address.isBlank()) return address;
        return String.format(Locale.ROOT, "%.5f, %.5f", latitude, longitude);
    }
}
