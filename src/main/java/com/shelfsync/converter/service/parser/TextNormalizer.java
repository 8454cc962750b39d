package com.shelfsync.converter.service.parser;

import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text cleanup shared by all handlers: case folding, {@code ё -> е}, quote and symbol
 * stripping, tokenization and stop-word removal.
 */
public class TextNormalizer {
    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    static final Pattern ASSORT = Pattern.compile("(?<!\\p{L})в\\s+ассортименте(?!\\p{L})", FLAGS);
    private static final Pattern QUOTES = Pattern.compile("[\"“”«»„]");
    private static final Pattern TIMES_BETWEEN_DIGITS = Pattern.compile("(?<=\\d)\\s*[xх×]\\s*(?=\\d)", FLAGS);
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s.,x-]+", FLAGS);
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}-]+", FLAGS);

    private static final Set<String> STOPWORDS = Set.of(
            "в", "во", "на", "для", "и", "с", "со", "по", "из", "к", "от", "при", "под", "над", "без",
            "про", "за", "у", "о", "об", "обо", "это", "эта", "этот", "эти",
            "ассортимент", "ассорти", "уп", "упаковка", "упаковки",
            "and", "with", "for", "the", "of", "in", "by", "a", "an"
    );

    /** Trim, fold case and {@code ё}, collapse whitespace. Blank input yields null. */
    public String normalizeField(String value) {
        if (value == null) return null;
        String cleaned = SPACES.matcher(fold(value.trim())).replaceAll(" ");
        return cleaned.isEmpty() ? null : cleaned;
    }

    /** Trimmed value or null when blank. */
    public String trimToNull(String value) {
        if (value == null) return null;
        String token = value.trim();
        return token.isEmpty() ? null : token;
    }

    /** Cleaned lower-case form used for tokenization: no quotes, no symbols, single spaces. */
    public String clean(String text) {
        if (text == null) return "";
        String cleaned = fold(text.trim());
        cleaned = TIMES_BETWEEN_DIGITS.matcher(cleaned).replaceAll("x");
        cleaned = QUOTES.matcher(cleaned).replaceAll("");
        cleaned = NON_WORD.matcher(cleaned).replaceAll(" ");
        return SPACES.matcher(cleaned).replaceAll(" ").trim();
    }

    public List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(clean(text));
        while (m.find()) {
            String token = m.group();
            if (!token.chars().allMatch(c -> c == '-')) out.add(token);
        }
        return out;
    }

    /** Token form of a title; this is the normalized title stored in the catalog. */
    public String normalize(String text) {
        return String.join(" ", tokenize(text));
    }

    public String removeStopwords(String text) {
        String withoutAssort = ASSORT.matcher(clean(text)).replaceAll(" ");
        List<String> kept = new ArrayList<>();
        for (String token : tokenize(withoutAssort)) {
            if (!STOPWORDS.contains(token)) kept.add(token);
        }
        return String.join(" ", kept);
    }

    /** Plain text of a possibly HTML-formatted value, e.g. a composition pasted from a product page. */
    public String stripHtml(String value) {
        if (value == null || value.indexOf('<') < 0) return value;
        return Jsoup.parse(value).text();
    }

    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT).replace('ё', 'е');
    }
}
