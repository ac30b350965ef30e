package tech.noetzold.crisis_api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Trigger terms per risk category and risk pattern. Immutable once built and shared by
 * every session.
 */
public final class RiskLexicon {

    private final Map<RiskCategory, List<String>> categoryTerms;
    private final Map<RiskPattern, List<String>> patternTerms;

    private RiskLexicon(Map<RiskCategory, List<String>> categoryTerms,
                        Map<RiskPattern, List<String>> patternTerms) {
        this.categoryTerms = Collections.unmodifiableMap(categoryTerms);
        this.patternTerms = Collections.unmodifiableMap(patternTerms);
    }

    public static RiskLexicon fromCodes(Map<String, List<String>> categories,
                                        Map<String, List<String>> patterns) {
        Map<RiskCategory, List<String>> cats = new EnumMap<>(RiskCategory.class);
        if (categories != null) {
            categories.forEach((code, terms) -> {
                RiskCategory category = RiskCategory.fromCode(code)
                        .orElseThrow(() -> new IllegalArgumentException("unknown risk category: " + code));
                cats.put(category, normalizeTerms(terms));
            });
        }
        Map<RiskPattern, List<String>> pats = new EnumMap<>(RiskPattern.class);
        if (patterns != null) {
            patterns.forEach((code, terms) -> {
                RiskPattern pattern = RiskPattern.fromCode(code)
                        .orElseThrow(() -> new IllegalArgumentException("unknown risk pattern: " + code));
                pats.put(pattern, normalizeTerms(terms));
            });
        }
        for (RiskCategory c : RiskCategory.values()) cats.putIfAbsent(c, List.of());
        for (RiskPattern p : RiskPattern.values()) pats.putIfAbsent(p, List.of());
        return new RiskLexicon(cats, pats);
    }

    public List<String> terms(RiskCategory category) {
        return categoryTerms.getOrDefault(category, List.of());
    }

    public List<String> terms(RiskPattern pattern) {
        return patternTerms.getOrDefault(pattern, List.of());
    }

    public int loadedCategories() {
        return (int) categoryTerms.values().stream().filter(t -> !t.isEmpty()).count();
    }

    private static List<String> normalizeTerms(List<String> terms) {
        if (terms == null) return List.of();
        List<String> out = new ArrayList<>(terms.size());
        for (String t : terms) {
            if (t == null || t.isBlank()) continue;
            String n = normalize(t);
            if (!out.contains(n)) out.add(n);
        }
        return List.copyOf(out);
    }

    /** Lower-cases, unifies apostrophes and collapses whitespace. Used for terms and messages alike. */
    public static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .replaceAll("\\s+", " ")
                .trim();
    }
}
