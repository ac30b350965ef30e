package tech.noetzold.crisis_api.service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public class RotatingPhraseSelector implements PhraseSelector {

    private final AtomicLong cursor = new AtomicLong();

    @Override
    public String select(List<String> variants) {
        if (variants == null || variants.isEmpty()) return "";
        long i = cursor.getAndIncrement();
        return variants.get((int) Math.floorMod(i, (long) variants.size()));
    }
}
