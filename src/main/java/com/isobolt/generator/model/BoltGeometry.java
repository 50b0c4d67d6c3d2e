package com.isobolt.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * ISO metric bolt geometry for one nominal diameter.
 *
 * Base parameters follow DIN 13 / DIN ISO 68-1 (thread), DIN 931 / DIN 933 (bolt)
 * and DIN 125 (washer). All lengths are in millimeters. Derived values are
 * computed once in the constructor.
 */
@Value
public class BoltGeometry {

    /** Nominal diameter. */
    int d;

    /** Thread pitch. */
    double p;

    /** Wrench size. */
    double s;

    /** Height of bolt head and nut. */
    double k;

    /** Maximum distance from bolt head to thread. */
    double a;

    /** Diameter of washer clearance hole. */
    double du1;

    /** Washer diameter. */
    double du2;

    /** Washer thickness. */
    double u;

    /** Fine clearance hole diameter (H12). */
    double dh1;

    /** Medium clearance hole diameter (H13). */
    double dh2;

    /** Coarse clearance hole diameter (H14). */
    double dh3;

    /** Default grip length of a bolt assembly. */
    int dgl;

    /** Customary bolt lengths, ascending. */
    List<Integer> cls;

    /** Effective pitch diameter. */
    double d2;

    /** Thread height. */
    double h;

    /** Nominal circumference. */
    double c;

    /** Thread helix angle in degrees. */
    double beta;

    /** Minimum thread length for bolt lengths below 125 mm. */
    double b2;

    /** Minimum thread length for bolt lengths below 200 mm. */
    double b3;

    /** Minimum thread length for bolt lengths of 200 mm and above. */
    double b4;

    @Builder
    private BoltGeometry(int d, double p, double s, double k, double a, double du1, double du2, double u,
                         double dh1, double dh2, double dh3, int dgl, @NonNull List<Integer> cls) {
        if (cls.isEmpty()) {
            throw new IllegalArgumentException("M" + d + ": customary lengths must not be empty");
        }
        for (int i = 1; i < cls.size(); i++) {
            if (cls.get(i) <= cls.get(i - 1)) {
                throw new IllegalArgumentException("M" + d + ": customary lengths must be ascending, got " + cls);
            }
        }
        this.d = d;
        this.p = p;
        this.s = s;
        this.k = k;
        this.a = a;
        this.du1 = du1;
        this.du2 = du2;
        this.u = u;
        this.dh1 = dh1;
        this.dh2 = dh2;
        this.dh3 = dh3;
        this.dgl = dgl;
        this.cls = List.copyOf(cls);

        this.d2 = d - 3 * Math.sqrt(3) / 8 * p;
        this.h = Math.sqrt(3) / 2 * p;
        this.c = Math.PI * d;
        this.beta = Math.toDegrees(Math.atan2(p, this.c));
        this.b2 = 2 * d + 6;
        this.b3 = 2 * d + 12;
        this.b4 = 2 * d + 25;
    }

    /**
     * Returns the display name, e.g. {@code M12}.
     */
    public String getDesignation() {
        return "M" + d;
    }

    @Override
    public String toString() {
        return "[BoltGeometry D=%d, P=%s, C=%s, beta=%s]".formatted(d, p, c, beta);
    }
}
