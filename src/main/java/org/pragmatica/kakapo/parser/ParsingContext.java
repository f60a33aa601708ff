package org.pragmatica.kakapo.parser;

import org.pragmatica.kakapo.tree.SourceLocation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable parsing context that tracks state during parsing.
 */
public final class ParsingContext {

    private final String input;
    private final Map<Long, ParseResult> packratCache;
    private final Map<String, Integer> ruleIds;

    private int pos;
    private int line;
    private int column;
    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private String furthestExpected;
    private int predicateDepth;
    private int cacheHits;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = config.packratEnabled() ? new HashMap<>() : null;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestPos = 0;
        this.furthestLine = 1;
        this.furthestColumn = 1;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char peek(int offset) {
        return input.charAt(pos + offset);
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Error Tracking ===

    /**
     * Record what was expected at the current position. Ignored inside lookahead,
     * where a failing match is part of normal operation.
     */
    public void updateFurthest(String expected) {
        if (predicateDepth > 0) {
            return;
        }
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public SourceLocation furthestLocation() {
        return SourceLocation.at(furthestLine, furthestColumn, furthestPos);
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    /**
     * Input at the furthest failure, up to the next whitespace and at most {@code limit} characters.
     */
    public String furthestFound(int limit) {
        int end = furthestPos;
        while (end < input.length() && end - furthestPos < limit && !Character.isWhitespace(input.charAt(end))) {
            end++;
        }
        if (end == furthestPos && end < input.length()) {
            end++;
        }
        return input.substring(furthestPos, end);
    }

    // === Predicates ===

    public void enterPredicate() {
        predicateDepth++;
    }

    public void exitPredicate() {
        predicateDepth--;
    }

    public boolean inPredicate() {
        return predicateDepth > 0;
    }

    // === Packrat Cache ===

    public Optional<ParseResult> getCachedAt(String ruleName, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        var cached = Optional.ofNullable(packratCache.get(packratKey(ruleName, position)));
        if (cached.isPresent()) {
            cacheHits++;
        }
        return cached;
    }

    public void cacheAt(String ruleName, int position, ParseResult result) {
        if (packratCache != null) {
            packratCache.put(packratKey(ruleName, position), result);
        }
    }

    public int cacheSize() {
        return packratCache == null ? 0 : packratCache.size();
    }

    public int cacheHits() {
        return cacheHits;
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }
}
