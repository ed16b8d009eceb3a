package com.care.assist.model;

import java.util.List;

/**
 * 依地區與類別查得的資源組合
 */
public record ResourceBundle(String locale, String category, String emergencyNumber, List<SupportResource> resources) {

    public ResourceBundle {
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
