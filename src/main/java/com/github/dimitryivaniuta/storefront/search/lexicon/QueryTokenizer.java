package com.github.dimitryivaniuta.storefront.search.lexicon;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared text folding and tokenization for queries and lexicon entries.
 *
 * Folding: lowercase ({@link Locale#ROOT}), Arabic alef variants to bare alef,
 * alef maqsura to yeh, teh marbuta to heh, diacritics and tatweel removed.
 * Punctuation and symbols become spaces.
 */
public final class QueryTokenizer {

    private static final Pattern DIACRITICS = Pattern.compile("[\\u064B-\\u0652\\u0670\\u0640]");
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryTokenizer() {}

    public static String fold(String raw) {
        if (raw == null) return "";
        String s = raw.toLowerCase(Locale.ROOT);
        s = DIACRITICS.matcher(s).replaceAll("");
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case 'أ', 'إ', 'آ' -> sb.append('ا');
                case 'ى' -> sb.append('ي');
                case 'ة' -> sb.append('ه');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static List<String> tokenize(String raw) {
        String folded = PUNCTUATION.matcher(fold(raw)).replaceAll(" ").strip();
        List<String> tokens = new ArrayList<>();
        if (folded.isEmpty()) {
            return tokens;
        }
        for (String t : WHITESPACE.split(folded)) {
            if (!t.isEmpty()) tokens.add(t);
        }
        return tokens;
    }
}
