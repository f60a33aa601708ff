package org.pragmatica.kakapo.format;

/**
 * Helpers for reading and rewriting whitespace slots.
 */
final class Whitespace {
    private static final String CONTINUATION = "...";

    private Whitespace() {
    }

    /**
     * The delimiter or operator inside a slot, without whitespace and continuations.
     */
    static String core(String slot) {
        var out = new StringBuilder();
        int i = 0;
        while (i < slot.length()) {
            if (slot.startsWith(CONTINUATION, i)) {
                i = endOfLine(slot, i);
            } else {
                char c = slot.charAt(i++);
                if (!Character.isWhitespace(c)) {
                    out.append(c);
                }
            }
        }
        return out.toString();
    }

    /**
     * The slot without the {@code ;} and {@code ,} of empty statements. Continuations are kept as they are.
     */
    static String withoutSeparators(String slot) {
        var out = new StringBuilder();
        int i = 0;
        while (i < slot.length()) {
            if (slot.startsWith(CONTINUATION, i)) {
                int end = endOfLine(slot, i);
                out.append(slot, i, end);
                i = end;
            } else {
                char c = slot.charAt(i++);
                if (c != ';' && c != ',') {
                    out.append(c);
                }
            }
        }
        return out.toString();
    }

    /**
     * Whether the slot holds a line break that is not part of a continuation.
     */
    static boolean breaksLine(String slot) {
        int i = 0;
        while (i < slot.length()) {
            if (slot.startsWith(CONTINUATION, i)) {
                i = endOfLine(slot, i);
            } else if (slot.charAt(i++) == '\n') {
                return true;
            }
        }
        return false;
    }

    /**
     * The slot with trailing blanks removed, ending in a line break.
     */
    static String lineStart(String slot) {
        int end = slot.length();
        while (end > 0 && (slot.charAt(end - 1) == ' ' || slot.charAt(end - 1) == '\t')) {
            end--;
        }
        var trimmed = slot.substring(0, end);
        return trimmed.endsWith("\n") ? trimmed : trimmed + "\n";
    }

    static int newlines(String slot) {
        return (int) slot.chars()
                         .filter(c -> c == '\n')
                         .count();
    }

    private static int endOfLine(String slot, int from) {
        int newline = slot.indexOf('\n', from);
        return newline < 0 ? slot.length() : newline + 1;
    }
}
