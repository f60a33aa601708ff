package org.pragmatica.kakapo.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.kakapo.action.Parts;
import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;
import org.pragmatica.kakapo.grammar.Expression;
import org.pragmatica.kakapo.grammar.Grammar;
import org.pragmatica.kakapo.grammar.Rule;
import org.pragmatica.kakapo.tree.Composite;
import org.pragmatica.kakapo.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * PEG parsing engine - interprets Grammar to parse input text into tree nodes.
 *
 * <p>Whitespace is never skipped implicitly: every byte of the input is matched
 * by some expression, which keeps the resulting tree lossless.
 */
public final class PegEngine implements Parser {
    private static final Logger logger = LogManager.getLogger(PegEngine.class);
    private static final int FOUND_LIMIT = 20;

    private final Grammar grammar;
    private final ParserConfig config;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar, config);
    }

    public static PegEngine create(Grammar grammar) {
        return new PegEngine(grammar, ParserConfig.DEFAULT);
    }

    @Override
    public Node parse(String input) throws ParseException {
        return parse(input, grammar.startRule());
    }

    @Override
    public Node parse(String input, String startRule) throws ParseException {
        var rule = grammar.rule(startRule)
                          .orElseThrow(() -> new IllegalArgumentException("Unknown rule: " + startRule));

        var ctx = ParsingContext.create(input, config);
        var result = parseRule(ctx, rule);

        if (result.isFailure()) {
            throw failure(ctx);
        }

        // Check if we consumed all input
        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            throw failure(ctx);
        }

        var values = ((ParseResult.Success) result).values();
        if (values.size() != 1 || !(values.get(0) instanceof Node node)) {
            throw new StructuralAssumptionViolation("Rule '" + startRule + "' produced " + values + " instead of one node");
        }

        // Nodes taken from the packrat cache may still point at a discarded parent
        if (node instanceof Composite composite) {
            composite.link();
        }

        logger.debug("Parsed {} characters from rule '{}' ({} memoized results, {} cache hits)",
                     input.length(), startRule, ctx.cacheSize(), ctx.cacheHits());
        return node;
    }

    private static ParseException failure(ParsingContext ctx) {
        var expected = ctx.furthestExpected().isEmpty()
                       ? "valid input"
                       : ctx.furthestExpected();
        return new ParseException(ctx.furthestLocation(), ctx.furthestFound(FOUND_LIMIT), expected);
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startLoc = ctx.location();

        // Check packrat cache at START position
        var cached = ctx.getCachedAt(rule.name(), startLoc.offset());
        if (cached.isPresent()) {
            var result = cached.get();
            if (result instanceof ParseResult.Success success) {
                ctx.restoreLocation(success.endLocation());
            }
            return result;
        }

        var values = new ArrayList<Object>();
        var result = parseExpression(ctx, rule.expression(), values);

        if (result.isFailure()) {
            // Restore position on failure
            ctx.restoreLocation(startLoc);
            ctx.cacheAt(rule.name(), startLoc.offset(), result);
            return result;
        }

        var success = rule.action()
                          .map(action -> ParseResult.Success.of(ctx.location(), List.<Object>of(action.apply(Parts.of(values)))))
                          .orElseGet(() -> ParseResult.Success.of(ctx.location(), values));

        // An empty match could be reused twice at the same position, which would share one node
        if (ctx.pos() > startLoc.offset()) {
            ctx.cacheAt(rule.name(), startLoc.offset(), success);
        }
        return success;
    }

    // === Expression Parsing ===

    private ParseResult parseExpression(ParsingContext ctx, Expression expr, List<Object> values) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref, values);
        }
        if (expr instanceof Expression.Dictionary dict) {
            return parseDictionary(ctx, dict);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq, values);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice, values);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepetition(ctx, zom.expression(), 0, Integer.MAX_VALUE, values);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepetition(ctx, oom.expression(), 1, Integer.MAX_VALUE, values);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseRepetition(ctx, opt.expression(), 0, 1, values);
        }
        if (expr instanceof Expression.Repetition rep) {
            return parseRepetition(ctx, rep.expression(), rep.min(), rep.max(), values);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb, values);
        }
        if (expr instanceof Expression.Empty empty) {
            values.add(empty.value());
            return ParseResult.Success.at(ctx.location());
        }
        throw new IllegalStateException("Unsupported expression " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        if (!matchesWord(ctx, text)) {
            ctx.updateFurthest("'" + text + "'");
            return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
        }

        // Consume the matched text
        ctx.advance(text.length());
        return ParseResult.Success.at(ctx.location());
    }

    private ParseResult parseDictionary(ParsingContext ctx, Expression.Dictionary dict) {
        String longestMatch = null;

        for (var word : dict.words()) {
            if (matchesWord(ctx, word) && (longestMatch == null || word.length() > longestMatch.length())) {
                longestMatch = word;
            }
        }

        if (longestMatch == null) {
            var expected = String.join(" | ", dict.words().stream().map(w -> "'" + w + "'").toList());
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        ctx.advance(longestMatch.length());
        return ParseResult.Success.at(ctx.location());
    }

    /**
     * Check if word matches at current position.
     */
    private static boolean matchesWord(ParsingContext ctx, String word) {
        if (ctx.remaining() < word.length()) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (word.charAt(i) != ctx.peek(i)) {
                return false;
            }
        }
        return true;
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var expected = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        boolean matches = matchesCharClass(ctx.peek(), cc.pattern());

        if (cc.negated()) {
            matches = !matches;
        }

        if (!matches) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        ctx.advance();
        return ParseResult.Success.at(ctx.location());
    }

    static boolean matchesCharClass(char c, String pattern) {
        int i = 0;
        while (i < pattern.length()) {
            char start = pattern.charAt(i);
            if (start == '\\' && i + 1 < pattern.length()) {
                // Escape sequence
                char expected = switch (pattern.charAt(i + 1)) {
                    case 'n' -> '\n';
                    case 'r' -> '\r';
                    case 't' -> '\t';
                    default -> pattern.charAt(i + 1);
                };
                if (c == expected) {
                    return true;
                }
                i += 2;
                continue;
            }

            // Check for range
            if (i + 2 < pattern.length() && pattern.charAt(i + 1) == '-') {
                if (c >= start && c <= pattern.charAt(i + 2)) {
                    return true;
                }
                i += 3;
            } else {
                if (c == start) {
                    return true;
                }
                i++;
            }
        }
        return false;
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }

        ctx.advance();
        return ParseResult.Success.at(ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref, List<Object> values) {
        var rule = grammar.rule(ref.ruleName())
                          .orElseThrow(() -> new IllegalStateException("Undefined rule '" + ref.ruleName() + "'"));
        var result = parseRule(ctx, rule);
        if (result instanceof ParseResult.Success success) {
            values.addAll(success.values());
        }
        return result;
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq, List<Object> values) {
        var startLoc = ctx.location();
        int mark = values.size();

        for (var element : seq.elements()) {
            var result = parseExpression(ctx, element, values);
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                values.subList(mark, values.size()).clear();
                return result;
            }
        }

        return ParseResult.Success.at(ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice, List<Object> values) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            // Collect locally - only merge on success
            var localValues = new ArrayList<Object>();
            var result = parseExpression(ctx, alt, localValues);
            if (result.isSuccess()) {
                values.addAll(localValues);
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
               ? lastFailure
               : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    /**
     * Bounded repetition; also serves {@code e*}, {@code e+} and {@code e?}.
     */
    private ParseResult parseRepetition(ParsingContext ctx, Expression expression, int min, int max,
                                        List<Object> values) {
        var startLoc = ctx.location();
        int mark = values.size();
        int count = 0;

        while (count < max) {
            var beforeLoc = ctx.location();
            var localValues = new ArrayList<Object>();
            var result = parseExpression(ctx, expression, localValues);

            if (result.isFailure()) {
                ctx.restoreLocation(beforeLoc);
                break;
            }

            values.addAll(localValues);
            count++;

            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }

        if (count < min) {
            ctx.restoreLocation(startLoc);
            values.subList(mark, values.size()).clear();
            return ParseResult.Failure.at(ctx.location(), "at least " + min + " repetitions");
        }

        return ParseResult.Success.at(ctx.location());
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = parsePredicate(ctx, and.expression());

        if (result.isSuccess()) {
            return ParseResult.Success.at(startLoc);
        }
        return result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        var result = parsePredicate(ctx, not.expression());

        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describe(not.expression()));
        }
        return ParseResult.Success.at(startLoc);
    }

    private ParseResult parsePredicate(ParsingContext ctx, Expression expression) {
        var startLoc = ctx.location();
        ctx.enterPredicate();
        try {
            return parseExpression(ctx, expression, new ArrayList<>());
        } finally {
            ctx.exitPredicate();
            // Always restore - predicates don't consume
            ctx.restoreLocation(startLoc);
        }
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx, Expression.TokenBoundary tb, List<Object> values) {
        int startPos = ctx.pos();

        // Parts of the inner expression are replaced by the matched text
        var result = parseExpression(ctx, tb.expression(), new ArrayList<>());
        if (result.isFailure()) {
            return result;
        }

        values.add(ctx.substring(startPos, ctx.pos()));
        return ParseResult.Success.at(ctx.location());
    }

    private static String describe(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        }
        return "expression";
    }
}
