package com.ipruai.backend.services.emails.parsers;

import java.text.Normalizer;
import java.util.Locale;

import org.springframework.stereotype.Component;

@Component
public class TextNormalizer {

    private static final String SUBJECT_MARKER = "Subject:";
    private static final String BODY_MARKER = "Body:";

    /**
     * Junta assunto e corpo num único texto de análise.
     * Exemplo: ("PMS  Statement", "Send   SOA") => "subject: pms statement body: send soa"
     */
    public NormalizedText normalize(String subject, String body) {
        String s = subject == null ? "" : subject.trim();
        String b = body == null ? "" : body.trim();
        if (s.isEmpty() && b.isEmpty()) {
            return NormalizedText.EMPTY;
        }

        StringBuilder original = new StringBuilder();
        if (!s.isEmpty()) {
            original.append(SUBJECT_MARKER).append(' ').append(s);
        }
        if (!b.isEmpty()) {
            if (original.length() > 0) original.append('\n');
            original.append(BODY_MARKER).append(' ').append(b);
        }

        String combined = original.toString();
        return new NormalizedText(normalize(combined), combined);
    }

    /**
     * Lowercase, sem acentos, espaços colapsados.
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = text.toLowerCase(Locale.ROOT);

        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = result.replaceAll("\\p{M}", "");

        // Mail clients paste NBSP and other separators that \s does not match.
        result = result.replace('\u00A0', ' ');
        result = result.replaceAll("\\p{Z}+", " ");

        return result.replaceAll("\\s+", " ").trim();
    }
}
