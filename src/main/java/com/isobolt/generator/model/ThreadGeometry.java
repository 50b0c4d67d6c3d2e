package com.isobolt.generator.model;

import lombok.Value;

/**
 * Thread-facing subset of an ISO metric geometry.
 */
@Value
public class ThreadGeometry {

    int d;
    double p;

    /** Nominal circumference. */
    double u;

    /** Thread helix angle in degrees. */
    double beta;

    public ThreadGeometry(int d, double p) {
        this.d = d;
        this.p = p;
        this.u = Math.PI * d;
        this.beta = Math.toDegrees(Math.atan2(p, this.u));
    }

    @Override
    public String toString() {
        return "[ThreadGeometry D=%d, P=%s, u=%s, beta=%s]".formatted(d, p, u, beta);
    }
}
