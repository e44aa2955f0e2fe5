package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.util.Map;

/**
 * Matrix stored as {@code Entry} children with 1-based {@code index1}/{@code index2}
 * attributes and {@code size1}/{@code size2} on the parent. When a shape is given, documents
 * and values of any other shape are rejected.
 */
public class MatrixTranscoder implements Transcoder<Matrix> {
    private final int rows;
    private final int cols;

    /**
     * Matrix of any shape.
     */
    public MatrixTranscoder() {
        this(-1, -1);
    }

    public MatrixTranscoder(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public Matrix decode(Element element) throws SarCodecException {
        var entries = XmlTrees.children(element, "Entry");
        int maxRow = 0;
        int maxCol = 0;
        for (var entry : entries) {
            maxRow = Math.max(maxRow, XmlText.intAttribute(entry, "index1"));
            maxCol = Math.max(maxCol, XmlText.intAttribute(entry, "index2"));
        }
        int size1 = element.getAttribute("size1") != null ? XmlText.intAttribute(element, "size1") : maxRow;
        int size2 = element.getAttribute("size2") != null ? XmlText.intAttribute(element, "size2") : maxCol;
        if (rows >= 0 && (size1 != rows || size2 != cols)) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element) + ": shape " + size1 + "x"
                    + size2 + " does not match expected " + rows + "x" + cols);
        }
        var values = new double[size1][size2];
        for (var entry : entries) {
            int i = XmlText.intAttribute(entry, "index1");
            int j = XmlText.intAttribute(entry, "index2");
            if (i < 1 || i > size1 || j < 1 || j > size2) {
                throw XmlText.malformed(entry, "index within " + size1 + "x" + size2, i + "," + j, null);
            }
            values[i - 1][j - 1] = XmlText.parseDouble(entry);
        }
        return new Matrix(values);
    }

    @Override
    public void encode(Element element, Matrix value) throws SarCodecException {
        int size1 = value.getRows();
        int size2 = value.getCols();
        if (rows >= 0 && (size1 != rows || size2 != cols)) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element) + ": shape " + size1
                    + "x" + size2 + " does not match expected " + rows + "x" + cols);
        }
        element.removeContent();
        element.setAttribute("size1", Integer.toString(size1));
        element.setAttribute("size2", Integer.toString(size2));
        for (int i = 0; i < size1; i++) {
            if (value.getValues()[i].length != size2) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element) + ": ragged matrix row " + i);
            }
            for (int j = 0; j < size2; j++) {
                var entry = XmlTrees.addChild(element, "Entry", XmlText.formatDouble(value.get(i, j)));
                entry.setAttribute("index1", Integer.toString(i + 1));
                entry.setAttribute("index2", Integer.toString(j + 1));
            }
        }
    }

    @Override
    public Map<String, Transcoder<?>> children() {
        return Map.of("Entry", DBL);
    }
}
