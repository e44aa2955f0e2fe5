package com.sarcodec.xml;

import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of same-named children carrying an {@code index} attribute, e.g. polygon
 * vertices. The parent gets a {@code size} attribute unless disabled.
 */
public class ListTranscoder<T> implements Transcoder<List<T>> {
    private final String childName;
    private final Transcoder<T> item;
    private final int indexStart;
    private final boolean sizeAttribute;

    public ListTranscoder(String childName, Transcoder<T> item) {
        this(childName, item, 1, true);
    }

    public ListTranscoder(String childName, Transcoder<T> item, int indexStart, boolean sizeAttribute) {
        this.childName = childName;
        this.item = item;
        this.indexStart = indexStart;
        this.sizeAttribute = sizeAttribute;
    }

    @Override
    public List<T> decode(Element element) throws SarCodecException {
        var children = XmlTrees.children(element, childName);
        var indexed = new ArrayList<Element>(children);
        boolean allIndexed = children.stream().allMatch(c -> c.getAttribute("index") != null);
        if (allIndexed) {
            var keys = new LinkedHashMap<Element, Integer>();
            for (var child : children) {
                keys.put(child, leadingInt(child));
            }
            indexed.sort(Comparator.comparing(keys::get));
        }
        var values = new ArrayList<T>(indexed.size());
        for (var child : indexed) {
            values.add(item.decode(child));
        }
        return values;
    }

    @Override
    public void encode(Element element, List<T> value) throws SarCodecException {
        element.removeContent();
        if (sizeAttribute) {
            element.setAttribute("size", Integer.toString(value.size()));
        }
        for (int i = 0; i < value.size(); i++) {
            var child = XmlTrees.addChild(element, childName);
            child.setAttribute("index", Integer.toString(i + indexStart));
            item.encode(child, value.get(i));
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        var map = new LinkedHashMap<String, Transcoder<?>>();
        map.put(childName, item);
        item.children().forEach((path, t) -> map.put(childName + "/" + path, t));
        return map;
    }

    /**
     * Numeric part of an index attribute; {@code "3:LRLC"} yields 3.
     */
    static int leadingInt(Element child) throws SarCodecException {
        var value = child.getAttributeValue("index").trim();
        int colon = value.indexOf(':');
        var number = colon < 0 ? value : value.substring(0, colon);
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException e) {
            throw XmlText.malformed(child, "integer index attribute", value, e);
        }
    }
}
