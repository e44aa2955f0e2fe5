package com.sarcodec.xml;

import com.sarcodec.error.SarCodecException;
import org.jdom2.Document;
import org.jdom2.Element;

import java.util.List;
import java.util.Objects;

/**
 * A {@link TranscoderRegistry} bound to one document, addressed with Clark-notation path
 * strings relative to the root element such as {@code "./{*}ImageData/{*}NumRows"}.
 */
public class XmlHelper {
    private final Document document;
    private final TranscoderRegistry registry;

    public XmlHelper(Document document, TranscoderRegistry registry) {
        this.document = Objects.requireNonNull(document, "Document cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    public Document getDocument() {
        return document;
    }

    public Element getRoot() {
        return document.getRootElement();
    }

    public Object load(String path) throws SarCodecException {
        return registry.load(getRoot(), ElementPath.parse(path));
    }

    public <T> T load(String path, Class<T> type) throws SarCodecException {
        return registry.load(getRoot(), ElementPath.parse(path), type);
    }

    public void set(String path, Object value) throws SarCodecException {
        registry.set(getRoot(), ElementPath.parse(path), value);
    }

    public Object loadElem(Element element) throws SarCodecException {
        return registry.loadElem(element);
    }

    public void setElem(Element element, Object value) throws SarCodecException {
        registry.setElem(element, value);
    }

    public Element find(String path) {
        return registry.find(getRoot(), ElementPath.parse(path));
    }

    public List<Element> findAll(String path) {
        return registry.findAll(getRoot(), ElementPath.parse(path));
    }

    /**
     * Trimmed text of the first element at {@code path}, or {@code null} when absent.
     */
    public String findText(String path) {
        var element = find(path);
        return element == null ? null : element.getTextTrim();
    }
}
