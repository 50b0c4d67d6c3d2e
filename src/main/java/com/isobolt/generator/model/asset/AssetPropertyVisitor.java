package com.isobolt.generator.model.asset;

/**
 * Visitor pattern interface for traversing appearance asset properties.
 */
public interface AssetPropertyVisitor {
    void visit(StringProperty property);
    void visit(DoubleProperty property);
    void visit(DistanceProperty property);
    void visit(BooleanProperty property);
    void visit(IntegerProperty property);
    void visit(ReferenceProperty property);
    void visit(ListProperty property);
}
