package tech.noetzold.crisis_api.model;

import java.util.List;

public record CategoryMatch(
        List<String> terms,
        int count,
        double severity
) {
    public CategoryMatch {
        terms = terms == null ? List.of() : List.copyOf(terms);
    }
}
