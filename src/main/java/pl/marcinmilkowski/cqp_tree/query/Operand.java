package pl.marcinmilkowski.cqp_tree.query;

import java.util.Set;

/**
 * Side of a {@link Comparison}: either an {@link Attribute} or a {@link Value}.
 */
public interface Operand {

    <R> R accept(OperandVisitor<R> visitor);

    /**
     * Identifiers named by this operand, in order of appearance.
     */
    Set<Identifier> referencedIdentifiers();

    /**
     * Make "this token" references explicit by naming {@code on} as their owner.
     */
    Operand raiseFrom(Identifier on);

    /**
     * Turn references to {@code on} back into "this token" references.
     */
    Operand lowerOnto(Identifier on);
}
