package com.isobolt.generator.codegen.generator;

import java.util.List;

import com.isobolt.generator.codegen.util.NumberFormatUtil;
import com.isobolt.generator.model.BoltGeometry;

import lombok.Value;

/**
 * Formatted parameters of one geometry, shared by the delimited and the HTML parameter table.
 * Thread height and pitch diameter are rounded to two decimals.
 */
@Value
public class GeometryParameterRow {

    String name;
    String d;
    String p;
    String h;
    String d2;
    String s;
    String k;
    String a;
    String b2;
    String b3;
    String b4;
    String du1;
    String du2;
    String u;
    String dh1;
    String dh2;
    String dh3;

    public static GeometryParameterRow of(BoltGeometry g) {
        return new GeometryParameterRow(
                g.getDesignation(),
                Integer.toString(g.getD()),
                NumberFormatUtil.format(g.getP()),
                NumberFormatUtil.fixed2(g.getH()),
                NumberFormatUtil.fixed2(g.getD2()),
                NumberFormatUtil.format(g.getS()),
                NumberFormatUtil.format(g.getK()),
                NumberFormatUtil.format(g.getA()),
                NumberFormatUtil.format(g.getB2()),
                NumberFormatUtil.format(g.getB3()),
                NumberFormatUtil.format(g.getB4()),
                NumberFormatUtil.format(g.getDu1()),
                NumberFormatUtil.format(g.getDu2()),
                NumberFormatUtil.format(g.getU()),
                NumberFormatUtil.format(g.getDh1()),
                NumberFormatUtil.format(g.getDh2()),
                NumberFormatUtil.format(g.getDh3()));
    }

    /**
     * Parameter values in column order, without the name.
     */
    public List<String> values() {
        return List.of(d, p, h, d2, s, k, a, b2, b3, b4, du1, du2, u, dh1, dh2, dh3);
    }
}
