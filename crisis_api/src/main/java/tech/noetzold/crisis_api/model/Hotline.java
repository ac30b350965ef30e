package tech.noetzold.crisis_api.model;

public record Hotline(
        String name,
        String number,
        String description,
        String language
) {}
