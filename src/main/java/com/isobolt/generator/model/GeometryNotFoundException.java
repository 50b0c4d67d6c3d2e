package com.isobolt.generator.model;

/**
 * Thrown when no geometry is registered for a nominal diameter.
 */
public class GeometryNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int diameter;

    public GeometryNotFoundException(int diameter) {
        super("No geometry registered for M" + diameter);
        this.diameter = diameter;
    }

    public int getDiameter() {
        return diameter;
    }
}
