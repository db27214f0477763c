package tether.core.assertion;

import tether.core.util.ObjectChecker;

import java.util.regex.Pattern;

/**
 * A shell-style wildcard pattern matched against a whole line.
 *
 * {@code *} matches any run of characters (including none), {@code ?} matches any single character, {@code [seq]}
 * matches any character in seq and {@code [!seq]} any character not in seq. Ranges such as {@code [a-z]} are allowed in
 * a sequence. A {@code [} with no closing bracket is an ordinary character. Matching is case-sensitive.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        ObjectChecker.assertNonNull(glob);
        return new GlobPattern(glob, Pattern.compile(translate(glob), Pattern.DOTALL));
    }

    /**
     * Returns true iff the whole of the given line matches this pattern.
     *
     * @param line The line to match.
     * @return whether or not the line matches.
     */
    public boolean matches(String line) {
        ObjectChecker.assertNonNull(line);
        return this.regex.matcher(line).matches();
    }

    public String getGlob() {
        return this.glob;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.glob + " }";
    }

    private static String translate(String glob) {
        StringBuilder regex = new StringBuilder();
        int length = glob.length();
        int i = 0;

        while (i < length) {
            char c = glob.charAt(i);
            i++;

            if (c == '*') {
                // Collapse runs of stars, they mean the same thing.
                while ((i < length) && (glob.charAt(i) == '*')) {
                    i++;
                }
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int close = findClosingBracket(glob, i);
                if (close < 0) {
                    regex.append("\\[");
                } else {
                    regex.append(translateSequence(glob.substring(i, close)));
                    i = close + 1;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    /**
     * Returns the index of the bracket closing a sequence whose contents start at the given index, or -1 if it is never
     * closed. A ']' directly after the opening bracket (or after its '!') belongs to the sequence.
     */
    private static int findClosingBracket(String glob, int start) {
        int i = start;
        if ((i < glob.length()) && (glob.charAt(i) == '!')) {
            i++;
        }
        if ((i < glob.length()) && (glob.charAt(i) == ']')) {
            i++;
        }
        while ((i < glob.length()) && (glob.charAt(i) != ']')) {
            i++;
        }
        return (i < glob.length()) ? i : -1;
    }

    private static String translateSequence(String sequence) {
        StringBuilder characterClass = new StringBuilder("[");
        int i = 0;
        if (sequence.startsWith("!")) {
            characterClass.append('^');
            i++;
        }

        for (; i < sequence.length(); i++) {
            char c = sequence.charAt(i);
            if ((c == '-') && (i > 0) && (i < sequence.length() - 1) && !((i == 1) && (sequence.charAt(0) == '!'))) {
                characterClass.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                characterClass.append(c);
            } else {
                characterClass.append('\\').append(c);
            }
        }
        return characterClass.append(']').toString();
    }
}
