package tech.noetzold.crisis_api.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import tech.noetzold.crisis_api.model.ResponseCatalog;
import tech.noetzold.crisis_api.model.ResponseLanguagePack;
import tech.noetzold.crisis_api.model.RiskLexicon;
import tech.noetzold.crisis_api.service.PhraseSelector;
import tech.noetzold.crisis_api.service.RotatingPhraseSelector;
import tech.noetzold.crisis_api.service.SeededPhraseSelector;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
@EnableConfigurationProperties(CrisisProperties.class)
public class CrisisEngineConfig {

    @Bean
    public RiskLexicon riskLexicon(ObjectMapper objectMapper, CrisisProperties props) {
        RiskLexicon lexicon = loadLexicon(objectMapper, props.getResources().getLexicon());
        log.info("Risk lexicon loaded: {} categories with terms", lexicon.loadedCategories());
        return lexicon;
    }

    @Bean
    public ResponseCatalog responseCatalog(ObjectMapper objectMapper, CrisisProperties props) {
        return loadCatalog(objectMapper, props.getResources().getCatalog());
    }

    @Bean
    public PhraseSelector phraseSelector(CrisisProperties props) {
        return switch (props.getResponse().getSelection()) {
            case SEEDED -> new SeededPhraseSelector(props.getResponse().getSeed());
            case ROTATE -> new RotatingPhraseSelector();
        };
    }

    public static RiskLexicon loadLexicon(ObjectMapper objectMapper, String location) {
        LexiconFile file = read(objectMapper, location, new TypeReference<LexiconFile>() {});
        return RiskLexicon.fromCodes(file.categories(), file.patterns());
    }

    public static ResponseCatalog loadCatalog(ObjectMapper objectMapper, String location) {
        Map<String, ResponseLanguagePack> packs =
                read(objectMapper, location, new TypeReference<Map<String, ResponseLanguagePack>>() {});
        return new ResponseCatalog(packs);
    }

    private static <T> T read(ObjectMapper objectMapper, String location, TypeReference<T> type) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + location, e);
        }
    }

    record LexiconFile(Map<String, List<String>> categories, Map<String, List<String>> patterns) {}
}
