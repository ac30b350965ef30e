package tech.noetzold.crisis_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import tech.noetzold.crisis_api.model.RiskCategory;
import tech.noetzold.crisis_api.model.RiskPattern;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunable numbers of the crisis engine. The defaults are the calibrated values; the
 * aggregation shape (weighted fusion, fixed classification priority, hard escalation on
 * critical level) does not depend on them.
 */
@Data
@ConfigurationProperties(prefix = "crisis")
public class CrisisProperties {

    private Thresholds thresholds = new Thresholds();
    private History history = new History();
    private Weights weights = new Weights();
    private Aggregation aggregation = new Aggregation();
    private Analyzer analyzer = new Analyzer();
    private Response response = new Response();
    private Store store = new Store();
    private Resources resources = new Resources();

    @Data
    public static class Thresholds {
        private int low = 3;
        private int medium = 5;
        private int high = 7;
        private int critical = 9;

        public Map<String, Integer> asMap() {
            Map<String, Integer> m = new LinkedHashMap<>();
            m.put("low", low);
            m.put("medium", medium);
            m.put("high", high);
            m.put("critical", critical);
            return m;
        }
    }

    @Data
    public static class History {
        /** Crisis events kept per session, oldest evicted first. */
        private int maxEvents = 10;
        /** Previous turns scanned for repeated crisis themes. */
        private int contextWindow = 3;
        /** Previous emotional states scanned for deterioration. */
        private int emotionWindow = 5;
    }

    @Data
    public static class Weights {
        private Map<RiskCategory, Double> categories = new EnumMap<>(RiskCategory.class);
        private Map<RiskPattern, Double> patterns = new EnumMap<>(RiskPattern.class);

        public double of(RiskCategory category) {
            Double w = categories.get(category);
            return w != null ? w : category.defaultWeight();
        }

        public double of(RiskPattern pattern) {
            Double w = patterns.get(pattern);
            return w != null ? w : pattern.defaultWeight();
        }
    }

    @Data
    public static class Aggregation {
        private double categoryFactor = 0.5;
        private double patternFactor = 0.3;
        private double escalationBonus = 2.0;
        private double deteriorationBonus = 1.0;
        private double interventionsBonus = 1.0;
        private double highRiskCategoryBonus = 1.5;
    }

    @Data
    public static class Analyzer {
        private boolean enabled = false;
        private String baseUrl = "http://crisis-analyzer:8090";
        private Duration timeout = Duration.ofMillis(1500);
    }

    @Data
    public static class Response {
        public enum Selection { ROTATE, SEEDED }

        private Selection selection = Selection.ROTATE;
        private long seed = 42L;
    }

    @Data
    public static class Store {
        /** {@code jpa} or {@code memory}. */
        private String type = "jpa";
    }

    @Data
    public static class Resources {
        private String lexicon = "risk-lexicon.json";
        private String catalog = "crisis-responses.json";
        private String directory = "emergency-resources.json";
    }
}
