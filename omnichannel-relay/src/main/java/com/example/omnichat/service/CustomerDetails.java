package com.example.omnichat.service;

import java.util.Map;

/**
 * Customer metadata carried by an inbound event. Blank names and empty attribute bags leave the stored
 * values alone.
 */
public record CustomerDetails(String name, Map<String, Object> attributes) {

    public static CustomerDetails empty() {
        return new CustomerDetails(null, Map.of());
    }
}
