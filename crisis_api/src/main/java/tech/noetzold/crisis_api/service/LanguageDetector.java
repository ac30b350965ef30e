package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;

@Component
public class LanguageDetector {

    public static final String ARABIC = "ar";
    public static final String ENGLISH = "en";

    public String detect(String text) {
        if (text == null) return ENGLISH;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= '\u0600' && ch <= '\u06FF') return ARABIC;
        }
        return ENGLISH;
    }
}
