package tech.noetzold.crisis_api.model;

import java.util.List;

public record Hospital(
        String name,
        String location,
        String phone,
        List<String> services,
        String hours
) {}
