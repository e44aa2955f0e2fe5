package com.sarcodec.xml;

import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.Map;

/**
 * Two-dimensional polynomial stored as {@code Coef} children with {@code exponent1} and
 * {@code exponent2} attributes.
 */
public class Poly2dTranscoder implements Transcoder<Poly2d> {

    @Override
    public Poly2d decode(Element element) throws SarCodecException {
        var coefs = XmlTrees.children(element, "Coef");
        int max1 = -1;
        int max2 = -1;
        for (var coef : coefs) {
            max1 = Math.max(max1, PolyTranscoder.exponent(coef, "exponent1"));
            max2 = Math.max(max2, PolyTranscoder.exponent(coef, "exponent2"));
        }
        var values = new double[max1 + 1][max2 + 1];
        for (var coef : coefs) {
            values[PolyTranscoder.exponent(coef, "exponent1")][PolyTranscoder.exponent(coef, "exponent2")] =
                    XmlText.parseDouble(coef);
        }
        return new Poly2d(values);
    }

    @Override
    public void encode(Element element, Poly2d value) {
        var coefs = value.getCoefs();
        element.removeContent();
        element.setAttribute("order1", Integer.toString(Math.max(value.getOrder1(), 0)));
        element.setAttribute("order2", Integer.toString(Math.max(value.getOrder2(), 0)));
        for (int i = 0; i < coefs.length; i++) {
            for (int j = 0; j < coefs[i].length; j++) {
                var coef = XmlTrees.addChild(element, "Coef", XmlText.formatDouble(coefs[i][j]));
                coef.setAttribute("exponent1", Integer.toString(i));
                coef.setAttribute("exponent2", Integer.toString(j));
            }
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        return Map.of("Coef", DBL);
    }
}
