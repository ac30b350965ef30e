package tech.noetzold.crisis_api.service;

import java.util.List;

/**
 * Chooses one phrasing among equivalent variants. Implementations are deterministic for a
 * given construction so responses can be asserted exactly.
 */
public interface PhraseSelector {

    String select(List<String> variants);
}
