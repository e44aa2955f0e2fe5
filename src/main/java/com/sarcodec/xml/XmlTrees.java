package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.experimental.UtilityClass;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsing, serialization and namespace-agnostic navigation of metadata element trees.
 * Serialized XML is UTF-8 without pretty printing so that its length is stable.
 */
@UtilityClass
public class XmlTrees {

    public Document parse(byte[] bytes) throws SarCodecException {
        var builder = new SAXBuilder();
        builder.setExpandEntities(false);
        builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        try {
            return builder.build(new ByteArrayInputStream(bytes));
        } catch (JDOMException e) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "Cannot parse XML segment: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public byte[] serialize(Document document) {
        var outputter = new XMLOutputter(Format.getRawFormat().setEncoding("UTF-8"));
        var out = new ByteArrayOutputStream();
        try {
            outputter.output(document, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * First child with the given local name in any namespace, or {@code null}.
     */
    public Element child(Element parent, String localName) {
        for (var child : parent.getChildren()) {
            if (child.getName().equals(localName)) return child;
        }
        return null;
    }

    public List<Element> children(Element parent, String localName) {
        var result = new ArrayList<Element>();
        for (var child : parent.getChildren()) {
            if (child.getName().equals(localName)) result.add(child);
        }
        return result;
    }

    public Element requireChild(Element parent, String localName) throws SarCodecException {
        var child = child(parent, localName);
        if (child == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, describe(parent) + " has no child " + localName);
        }
        return child;
    }

    /**
     * Appends a child in the parent's namespace.
     */
    public Element addChild(Element parent, String localName) {
        var child = new Element(localName, parent.getNamespace());
        parent.addContent(child);
        return child;
    }

    public Element addChild(Element parent, String localName, String text) {
        return addChild(parent, localName).setText(text);
    }

    /**
     * Slash-separated local names from the document root, for messages.
     */
    public String describe(Element element) {
        var names = new ArrayList<String>();
        for (var e = element; e != null; e = e.getParentElement()) {
            names.add(0, e.getName());
        }
        return "/" + String.join("/", names);
    }
}
