package dev.pekelund.receiptlens.analytics.search;

/**
 * Edit distance (insertions, deletions, substitutions) between two strings.
 */
public final class LevenshteinDistance {

    private LevenshteinDistance() {
    }

    public static int between(CharSequence left, CharSequence right) {
        if (left.length() == 0) {
            return right.length();
        }
        if (right.length() == 0) {
            return left.length();
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            char leftChar = left.charAt(i - 1);
            for (int j = 1; j <= right.length(); j++) {
                int substitution = previous[j - 1] + (leftChar == right.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /**
     * Same as {@code between(left, right) <= maxDistance}, skipping the table when the length difference
     * alone exceeds the limit.
     */
    public static boolean isWithin(CharSequence left, CharSequence right, int maxDistance) {
        if (Math.abs(left.length() - right.length()) > maxDistance) {
            return false;
        }
        return between(left, right) <= maxDistance;
    }
}
