package org.pragmatica.kakapo.error;

import com.google.common.base.VerifyException;

/**
 * A node was found where the grammar guarantees a different kind of node.
 *
 * <p>This is a contract break between {@code MatlabGrammar} and the tree model,
 * never a problem with the user's input.
 */
public final class StructuralAssumptionViolation extends VerifyException {

    public StructuralAssumptionViolation(String message) {
        super(message);
    }

    public static StructuralAssumptionViolation unexpected(String slot, Object found, Class<?> expected) {
        var foundKind = found == null ? "nothing" : found.getClass().getSimpleName();
        return new StructuralAssumptionViolation(
            "Slot '" + slot + "' holds " + foundKind + ", expected " + expected.getSimpleName()
        );
    }
}
