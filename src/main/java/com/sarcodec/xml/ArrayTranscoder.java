package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed sequence of named double children, e.g. {@code X, Y, Z} or {@code Lat, Lon}.
 */
public class ArrayTranscoder implements Transcoder<double[]> {
    private final List<String> names;

    public ArrayTranscoder(String... names) {
        this.names = List.of(names);
    }

    @Override
    public double[] decode(Element element) throws SarCodecException {
        var values = new double[names.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = XmlText.parseDouble(XmlTrees.requireChild(element, names.get(i)));
        }
        return values;
    }

    @Override
    public void encode(Element element, double[] value) throws SarCodecException {
        if (value.length != names.size()) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element) + ": length "
                    + value.length + " does not match expected " + names.size() + " " + names);
        }
        element.removeContent();
        for (int i = 0; i < value.length; i++) {
            XmlTrees.addChild(element, names.get(i), XmlText.formatDouble(value[i]));
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        var map = new LinkedHashMap<String, Transcoder<?>>();
        names.forEach(n -> map.put(n, DBL));
        return map;
    }
}
