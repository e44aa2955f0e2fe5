package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed sequence of named integer children such as {@code Row, Col}.
 */
public class IntArrayTranscoder implements Transcoder<long[]> {
    private final List<String> names;

    public IntArrayTranscoder(String... names) {
        this.names = List.of(names);
    }

    @Override
    public long[] decode(Element element) throws SarCodecException {
        var values = new long[names.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = XmlText.parseLong(XmlTrees.requireChild(element, names.get(i)));
        }
        return values;
    }

    @Override
    public void encode(Element element, long[] value) throws SarCodecException {
        if (value.length != names.size()) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element) + ": length "
                    + value.length + " does not match expected " + names.size() + " " + names);
        }
        element.removeContent();
        for (int i = 0; i < value.length; i++) {
            XmlTrees.addChild(element, names.get(i), Long.toString(value[i]));
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        var map = new LinkedHashMap<String, Transcoder<?>>();
        names.forEach(n -> map.put(n, INT));
        return map;
    }
}
