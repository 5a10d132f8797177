package org.dxworks.trustforge.model;

public record CsfControl(String function, String category, String subcategoryId, String title, String description) {
}
