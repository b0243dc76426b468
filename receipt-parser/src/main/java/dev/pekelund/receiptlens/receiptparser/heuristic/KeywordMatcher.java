package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive keyword test. Single words must match a whole word; phrases containing whitespace
 * match as substrings.
 */
final class KeywordMatcher {

    private final String keyword;
    private final Pattern wholeWord;

    private KeywordMatcher(String keyword) {
        this.keyword = keyword.toLowerCase(Locale.ROOT);
        this.wholeWord = this.keyword.contains(" ")
            ? null
            : Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(this.keyword) + "(?![\\p{L}\\p{N}])");
    }

    static KeywordMatcher of(String keyword) {
        return new KeywordMatcher(keyword);
    }

    static List<KeywordMatcher> ofAll(List<String> keywords) {
        return keywords.stream().map(KeywordMatcher::of).toList();
    }

    static boolean anyMatches(List<KeywordMatcher> matchers, String lowercaseText) {
        for (KeywordMatcher matcher : matchers) {
            if (matcher.matches(lowercaseText)) {
                return true;
            }
        }
        return false;
    }

    String keyword() {
        return keyword;
    }

    /**
     * @param lowercaseText text already lowercased with {@link Locale#ROOT}
     */
    boolean matches(String lowercaseText) {
        if (wholeWord == null) {
            return lowercaseText.contains(keyword);
        }
        return wholeWord.matcher(lowercaseText).find();
    }
}
