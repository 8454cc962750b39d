package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.Unit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fix Price titles: {@code "<name>, <brand>, <size>"} with optional "в ассортименте".
 * The first comma part is the name, the second one the brand unless it looks like a size.
 */
public class FixPriceTitleParser implements TitleParser {
    private static final Pattern NUMBER = Pattern.compile("(?<![\\p{N}.,])\\p{N}+(?![\\p{N}]|[.,]\\p{N})", TextNormalizer.FLAGS);
    private static final Pattern ANY_DIGIT = Pattern.compile("\\p{N}");

    private final TextNormalizer text;

    public FixPriceTitleParser(TextNormalizer text) {
        this.text = text;
    }

    @Override
    public TitleParseResult parse(String title) {
        String raw = title.trim();
        String withoutAssort = strip(TextNormalizer.ASSORT.matcher(raw).replaceAll(""), " ,");
        List<String> parts = splitByCommas(withoutAssort);

        String nameOriginal = parts.isEmpty() ? raw : parts.get(0);
        String brand = guessBrand(parts);

        PackMeasures.Measure measure = PackMeasures.firstQuantity(withoutAssort);
        Integer count = countHeuristic(withoutAssort);

        Unit unit;
        Double availableCount = null;
        Double packageQuantity = null;
        PackageUnit packageUnit = null;
        if (PackMeasures.BY_WEIGHT.matcher(withoutAssort).find()) {
            unit = Unit.KGM;
        } else if (PackMeasures.BY_VOLUME.matcher(withoutAssort).find()) {
            unit = Unit.LTR;
        } else {
            unit = Unit.PCE;
            availableCount = count != null ? count.doubleValue() : null;
            if (measure != null) {
                packageQuantity = measure.quantity();
                packageUnit = measure.unit();
            }
        }

        String nameForNormalization = brand != null ? nameOriginal + " " + brand : nameOriginal;
        String normalized = text.normalize(nameForNormalization);
        return new TitleParseResult(
                raw,
                nameOriginal,
                brand,
                normalized,
                text.removeStopwords(nameOriginal),
                text.removeStopwords(normalized),
                unit,
                availableCount,
                packageQuantity,
                packageUnit);
    }

    private static List<String> splitByCommas(String title) {
        List<String> out = new ArrayList<>();
        for (String part : title.split(",")) {
            String token = part.trim();
            if (!token.isEmpty()) out.add(token);
        }
        return out;
    }

    private String guessBrand(List<String> parts) {
        if (parts.size() < 2) return null;
        String candidate = parts.get(1);
        if (PackMeasures.DIMENSIONS_CM.matcher(candidate).find()
                || PackMeasures.QUANTITY.matcher(candidate).find()
                || ANY_DIGIT.matcher(candidate).find()) {
            return null;
        }
        return text.clean(candidate).length() < 2 ? null : candidate;
    }

    /** Last plausible piece count (2..200) left after sizes are removed, or a lone number up to 200. */
    static Integer countHeuristic(String title) {
        String scrubbed = PackMeasures.DIMENSIONS_CM.matcher(title).replaceAll(" ");
        scrubbed = PackMeasures.QUANTITY.matcher(scrubbed).replaceAll(" ");
        scrubbed = TextNormalizer.ASSORT.matcher(scrubbed).replaceAll(" ");

        List<Integer> numbers = new ArrayList<>();
        Matcher m = NUMBER.matcher(scrubbed);
        while (m.find()) {
            String token = m.group();
            if (token.length() > 6) continue;
            numbers.add(Integer.parseInt(token));
        }
        if (numbers.isEmpty()) return null;

        Integer plausible = null;
        for (Integer n : numbers) {
            if (n >= 2 && n <= 200) plausible = n;
        }
        if (plausible != null) return plausible;
        if (numbers.size() == 1 && numbers.get(0) >= 1 && numbers.get(0) <= 200) return numbers.get(0);
        return null;
    }

    static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) end--;
        return value.substring(start, end);
    }
}
