package com.sarcodec.xml;

import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code X}, {@code Y} and {@code Z} one-dimensional polynomial children.
 */
public class XyzPolyTranscoder implements Transcoder<XyzPoly> {

    @Override
    public XyzPoly decode(Element element) throws SarCodecException {
        return new XyzPoly(POLY.decode(XmlTrees.requireChild(element, "X")),
                POLY.decode(XmlTrees.requireChild(element, "Y")),
                POLY.decode(XmlTrees.requireChild(element, "Z")));
    }

    @Override
    public void encode(Element element, XyzPoly value) throws SarCodecException {
        element.removeContent();
        POLY.encode(XmlTrees.addChild(element, "X"), value.getX());
        POLY.encode(XmlTrees.addChild(element, "Y"), value.getY());
        POLY.encode(XmlTrees.addChild(element, "Z"), value.getZ());
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        var map = new LinkedHashMap<String, Transcoder<?>>();
        for (var axis : new String[]{"X", "Y", "Z"}) {
            map.put(axis, POLY);
            map.put(axis + "/Coef", DBL);
        }
        return map;
    }
}
