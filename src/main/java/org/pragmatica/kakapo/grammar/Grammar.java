package org.pragmatica.kakapo.grammar;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A complete PEG grammar - collection of rules with a start rule.
 */
public record Grammar(Map<String, Rule> rules, String startRule) {

    public static Grammar of(List<Rule> rules, String startRule) {
        var builder = ImmutableMap.<String, Rule>builder();
        rules.forEach(rule -> builder.put(rule.name(), rule));
        return new Grammar(builder.buildOrThrow(), startRule).validate();
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * Validate the grammar for undefined references.
     */
    public Grammar validate() {
        if (!rules.containsKey(startRule)) {
            throw new VerifyException("Undefined start rule: '" + startRule + "'");
        }
        for (var rule : rules.values()) {
            findUndefinedReference(rule.expression(), rules.keySet())
                .ifPresent(ref -> {
                    throw new VerifyException("Undefined rule reference: '" + ref.ruleName() + "' in rule '"
                                              + rule.name() + "'");
                });
        }
        return this;
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return firstUndefined(seq.elements(), ruleNames);
        }
        if (expr instanceof Expression.Choice choice) {
            return firstUndefined(choice.alternatives(), ruleNames);
        }
        return nested(expr).flatMap(inner -> findUndefinedReference(inner, ruleNames));
    }

    private Optional<Expression.Reference> firstUndefined(List<Expression> expressions, Set<String> ruleNames) {
        return expressions.stream()
                          .map(e -> findUndefinedReference(e, ruleNames))
                          .flatMap(Optional::stream)
                          .findFirst();
    }

    private static Optional<Expression> nested(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return Optional.of(zom.expression());
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return Optional.of(oom.expression());
        }
        if (expr instanceof Expression.Optional opt) {
            return Optional.of(opt.expression());
        }
        if (expr instanceof Expression.Repetition rep) {
            return Optional.of(rep.expression());
        }
        if (expr instanceof Expression.And and) {
            return Optional.of(and.expression());
        }
        if (expr instanceof Expression.Not not) {
            return Optional.of(not.expression());
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return Optional.of(tb.expression());
        }
        // Terminals - no nested expressions
        return Optional.empty();
    }
}
