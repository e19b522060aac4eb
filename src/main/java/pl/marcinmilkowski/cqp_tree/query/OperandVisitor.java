package pl.marcinmilkowski.cqp_tree.query;

public interface OperandVisitor<R> {

    R visitAttribute(Attribute attribute);

    R visitValue(Value value);
}
