package tech.noetzold.crisis_api.model;

import java.util.List;

public record CounselingCenter(
        String name,
        String phone,
        String description,
        List<String> services,
        String target
) {}
