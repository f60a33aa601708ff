package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code if} block. The {@code elseif} and {@code else} clauses follow the body
 * as flat siblings, each preceded by its own gap.
 */
public final class If extends Block {
    private final List<Clause> clauses;
    private final List<Element> children;

    public If(Leaf keyword,
              Text afterKeyword,
              Statement condition,
              Text beforeBody,
              Code body,
              List<Text> gaps,
              List<Clause> clauses,
              Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(condition), beforeBody, body, Optional.of(terminator));
        checkClauses(gaps, clauses);
        this.clauses = adoptAll(ImmutableList.copyOf(clauses));
        var extras = new ArrayList<Element>();
        for (int i = 0; i < clauses.size(); i++) {
            extras.add(gaps.get(i));
            extras.add(clauses.get(i));
        }
        this.children = childrenOf(keyword, afterKeyword, condition, beforeBody, body, extras, terminatorSlots());
    }

    private static void checkClauses(List<Text> gaps, List<Clause> clauses) {
        if (gaps.size() != clauses.size()) {
            throw new StructuralAssumptionViolation("If has " + clauses.size() + " clauses and " + gaps.size() + " gaps");
        }
        for (int i = 0; i < clauses.size(); i++) {
            var clause = clauses.get(i);
            boolean last = i == clauses.size() - 1;
            if (!(clause instanceof ElseIfClause) && !(clause instanceof ElseClause && last)) {
                throw StructuralAssumptionViolation.unexpected("clause " + i, clause, ElseIfClause.class);
            }
        }
    }

    public Statement condition() {
        return (Statement) head().orElseThrow();
    }

    public List<Clause> clauses() {
        return clauses;
    }

    public List<ElseIfClause> elseIfs() {
        return clauses.stream()
                      .filter(ElseIfClause.class::isInstance)
                      .map(ElseIfClause.class::cast)
                      .toList();
    }

    public Optional<ElseClause> elseClause() {
        return clauses.stream()
                      .filter(ElseClause.class::isInstance)
                      .map(ElseClause.class::cast)
                      .findFirst();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
