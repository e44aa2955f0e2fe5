package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered, optionally present named children of differing types, decoded to a map keyed by
 * local name. Absent children are left out of the map.
 */
public class SequenceTranscoder implements Transcoder<Map<String, Object>> {
    private final LinkedHashMap<String, Transcoder<?>> members;

    public SequenceTranscoder(Map<String, Transcoder<?>> members) {
        this.members = new LinkedHashMap<>(members);
    }

    @Override
    public Map<String, Object> decode(Element element) throws SarCodecException {
        var result = new LinkedHashMap<String, Object>();
        for (var member : members.entrySet()) {
            var child = XmlTrees.child(element, member.getKey());
            if (child != null) {
                result.put(member.getKey(), member.getValue().decode(child));
            }
        }
        return result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void encode(Element element, Map<String, Object> value) throws SarCodecException {
        for (var key : value.keySet()) {
            if (!members.containsKey(key)) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element)
                        + ": unknown member '" + key + "', expected " + members.keySet());
            }
        }
        element.removeContent();
        for (var member : members.entrySet()) {
            if (value.containsKey(member.getKey())) {
                var transcoder = (Transcoder<Object>) member.getValue();
                transcoder.encode(XmlTrees.addChild(element, member.getKey()), value.get(member.getKey()));
            }
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        var map = new LinkedHashMap<String, Transcoder<?>>();
        members.forEach((name, t) -> {
            map.put(name, t);
            t.children().forEach((path, sub) -> map.put(name + "/" + path, sub));
        });
        return map;
    }
}
