package tech.noetzold.crisis_api.service;

import java.util.List;
import java.util.Random;

public class SeededPhraseSelector implements PhraseSelector {

    private final Random random;

    public SeededPhraseSelector(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public synchronized String select(List<String> variants) {
        if (variants == null || variants.isEmpty()) return "";
        return variants.get(random.nextInt(variants.size()));
    }
}
