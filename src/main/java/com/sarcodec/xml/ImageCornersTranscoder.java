package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.List;
import java.util.Map;

/**
 * Four labelled lat/lon corners such as {@code <ICP index="1:FRFC">}. Decodes to a
 * {@code double[4][2]} ordered by the numeric part of the label.
 */
public class ImageCornersTranscoder implements Transcoder<double[][]> {
    public static final List<String> SICD_LABELS = List.of("1:FRFC", "2:FRLC", "3:LRLC", "4:LRFC");

    private final String childName;
    private final List<String> labels;

    public ImageCornersTranscoder(String childName, List<String> labels) {
        this.childName = childName;
        this.labels = List.copyOf(labels);
    }

    @Override
    public double[][] decode(Element element) throws SarCodecException {
        var children = XmlTrees.children(element, childName);
        if (children.size() != labels.size()) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element) + ": expected "
                    + labels.size() + " " + childName + " children, found " + children.size());
        }
        var corners = new double[labels.size()][];
        for (var child : children) {
            int index = ListTranscoder.leadingInt(child);
            if (index < 1 || index > corners.length || corners[index - 1] != null) {
                throw XmlText.malformed(child, "distinct corner index 1.." + corners.length,
                        child.getAttributeValue("index"), null);
            }
            corners[index - 1] = LAT_LON.decode(child);
        }
        return corners;
    }

    @Override
    public void encode(Element element, double[][] value) throws SarCodecException {
        if (value.length != labels.size()) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element) + ": expected "
                    + labels.size() + " corners, got " + value.length);
        }
        element.removeContent();
        for (int i = 0; i < value.length; i++) {
            var child = XmlTrees.addChild(element, childName);
            child.setAttribute("index", labels.get(i));
            LAT_LON.encode(child, value[i]);
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        return Map.of(childName, LAT_LON, childName + "/Lat", DBL, childName + "/Lon", DBL);
    }
}
