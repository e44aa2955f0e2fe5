package com.sarcodec.xml;

import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.Map;

/**
 * One-dimensional polynomial stored as {@code Coef} children with an {@code exponent1}
 * attribute. Decoding is dense up to the highest exponent present; missing terms are zero.
 */
public class PolyTranscoder implements Transcoder<Poly1d> {

    @Override
    public Poly1d decode(Element element) throws SarCodecException {
        var coefs = XmlTrees.children(element, "Coef");
        int max = -1;
        for (var coef : coefs) {
            max = Math.max(max, exponent(coef, "exponent1"));
        }
        var values = new double[max + 1];
        for (var coef : coefs) {
            values[exponent(coef, "exponent1")] = XmlText.parseDouble(coef);
        }
        return new Poly1d(values);
    }

    @Override
    public void encode(Element element, Poly1d value) {
        var coefs = value.getCoefs();
        element.removeContent();
        element.setAttribute("order1", Integer.toString(Math.max(coefs.length - 1, 0)));
        for (int i = 0; i < coefs.length; i++) {
            XmlTrees.addChild(element, "Coef", XmlText.formatDouble(coefs[i]))
                    .setAttribute("exponent1", Integer.toString(i));
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        return Map.of("Coef", DBL);
    }

    static int exponent(Element coef, String attribute) throws SarCodecException {
        int value = XmlText.intAttribute(coef, attribute);
        if (value < 0) {
            throw XmlText.malformed(coef, "non-negative " + attribute, Integer.toString(value), null);
        }
        return value;
    }
}
