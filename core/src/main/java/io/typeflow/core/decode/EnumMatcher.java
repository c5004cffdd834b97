package io.typeflow.core.decode;

import io.typeflow.core.schema.EnumDef;
import io.typeflow.core.schema.EnumValueDef;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a raw token onto an enum value. Tried in order: exact name, exact alias, case-insensitive
 * name or alias, then a whole-word search of the token for names and aliases. The first tier
 * with exactly one candidate wins; a tier with several candidates is ambiguous.
 */
final class EnumMatcher {

    /** Match outcome; {@code value} is set only for a unique match. */
    record Match(String value, List<String> candidates) {

        static Match none() {
            return new Match(null, List.of());
        }

        boolean matched() {
            return value != null;
        }

        boolean ambiguous() {
            return value == null && candidates.size() > 1;
        }
    }

    private static final String EDGE_PUNCTUATION = " \t\r\n\"'`*.,;:!?()";

    private EnumMatcher() {}

    static Match match(EnumDef def, String token) {
        String text = trimEdges(token);
        if (text.isEmpty()) {
            return Match.none();
        }

        for (EnumValueDef value : def.values()) {
            if (value.name().equals(text)) {
                return new Match(value.name(), List.of(value.name()));
            }
        }
        for (EnumValueDef value : def.values()) {
            if (text.equals(value.metadata().alias())) {
                return new Match(value.name(), List.of(value.name()));
            }
        }

        Set<String> caseless = new LinkedHashSet<>();
        for (EnumValueDef value : def.values()) {
            if (value.name().equalsIgnoreCase(text) || text.equalsIgnoreCase(value.metadata().alias())) {
                caseless.add(value.name());
            }
        }
        Match tier = decide(caseless);
        if (tier.matched() || tier.ambiguous()) {
            return tier;
        }

        Set<String> words = new LinkedHashSet<>();
        for (EnumValueDef value : def.values()) {
            if (containsWord(text, value.name())
                    || (value.metadata().alias() != null && containsWord(text, value.metadata().alias()))) {
                words.add(value.name());
            }
        }
        return decide(words);
    }

    private static Match decide(Set<String> candidates) {
        if (candidates.isEmpty()) {
            return Match.none();
        }
        List<String> list = new ArrayList<>(candidates);
        return list.size() == 1 ? new Match(list.get(0), list) : new Match(null, list);
    }

    private static boolean containsWord(String text, String word) {
        if (word.isBlank()) {
            return false;
        }
        Pattern pattern = Pattern.compile(
                "(?<![\\p{L}\\p{N}_])" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\p{N}_])");
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    private static String trimEdges(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
