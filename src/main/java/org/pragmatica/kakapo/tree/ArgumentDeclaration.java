package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.List;

/**
 * One line of an {@code arguments} block: the argument name followed by its size,
 * class, validators and default value, in source order, e.g.
 * {@code x (1,1) double {mustBePositive} = 1}. The gap before a default holds its {@code =}.
 */
public final class ArgumentDeclaration extends Composite implements Construct {
    private final List<Node> parts;
    private final List<Text> gaps;
    private final Text beforeSeparator;
    private final Text separator;
    private final List<Element> children;

    public ArgumentDeclaration(List<? extends Node> parts, List<Text> gaps, Text beforeSeparator, Text separator) {
        checkAlternating(parts, gaps, "ArgumentDeclaration");
        this.parts = adoptAll(ImmutableList.copyOf(parts));
        this.gaps = ImmutableList.copyOf(gaps);
        this.beforeSeparator = beforeSeparator;
        this.separator = separator;
        this.children = childrenOf(interleave(this.parts, this.gaps), beforeSeparator, separator);
    }

    public Call name() {
        if (parts.get(0) instanceof Call call) {
            return call;
        }
        throw StructuralAssumptionViolation.unexpected("name", parts.get(0), Call.class);
    }

    public List<Node> parts() {
        return parts;
    }

    public List<Text> gaps() {
        return gaps;
    }

    public Text beforeSeparator() {
        return beforeSeparator;
    }

    public Text separator() {
        return separator;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
