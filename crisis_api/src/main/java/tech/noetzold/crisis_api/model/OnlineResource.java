package tech.noetzold.crisis_api.model;

public record OnlineResource(
        String name,
        String url,
        String description
) {}
