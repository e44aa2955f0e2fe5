package com.sarcodec.xml;

import lombok.Value;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Location of an element relative to the document root (the root itself is not part of the
 * path). Segments are typed, so wildcard namespaces never depend on string matching.
 */
@Value
public class ElementPath {
    List<PathSegment> segments;

    private ElementPath(List<PathSegment> segments) {
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public static ElementPath of(PathSegment... segments) {
        return new ElementPath(List.of(segments));
    }

    public static ElementPath of(List<PathSegment> segments) {
        return new ElementPath(segments);
    }

    /**
     * All-wildcard path from slash-separated local names, e.g. {@code "ImageData/NumRows"}.
     */
    public static ElementPath wildcard(String localNames) {
        var segments = new ArrayList<PathSegment>();
        for (var name : localNames.split("/")) {
            if (!name.isEmpty()) segments.add(PathSegment.wildcard(name));
        }
        return new ElementPath(segments);
    }

    /**
     * Parses Clark-notation paths such as {@code "./{*}ImageData/{*}NumRows"} or
     * {@code "{urn:SICD:1.3.0}ImageData/{urn:SICD:1.3.0}NumRows"}. A step without braces has
     * no namespace. A leading {@code "./"} is ignored.
     */
    public static ElementPath parse(String path) {
        var text = path.startsWith("./") ? path.substring(2) : path;
        var segments = new ArrayList<PathSegment>();
        int i = 0;
        while (i < text.length()) {
            String namespace = "";
            if (text.charAt(i) == '{') {
                int close = text.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated namespace in path '" + path + "'");
                }
                namespace = text.substring(i + 1, close);
                i = close + 1;
            }
            int slash = text.indexOf('/', i);
            int end = slash < 0 ? text.length() : slash;
            var localName = text.substring(i, end);
            if (localName.isEmpty()) {
                throw new IllegalArgumentException("Empty step in path '" + path + "'");
            }
            segments.add("*".equals(namespace) ? PathSegment.wildcard(localName) : PathSegment.exact(namespace, localName));
            i = end + 1;
        }
        return new ElementPath(segments);
    }

    /**
     * Exact path of {@code element} below {@code root}.
     */
    public static ElementPath relative(Element root, Element element) {
        var segments = new ArrayList<PathSegment>();
        var e = element;
        while (e != null && e != root) {
            segments.add(0, PathSegment.exact(e.getNamespaceURI(), e.getName()));
            e = e.getParentElement();
        }
        if (e == null) {
            throw new IllegalArgumentException("Element " + XmlTrees.describe(element) + " is not below the given root");
        }
        return new ElementPath(segments);
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public PathSegment last() {
        return segments.get(segments.size() - 1);
    }

    public ElementPath parent() {
        return new ElementPath(segments.subList(0, segments.size() - 1));
    }

    public ElementPath child(PathSegment segment) {
        var list = new ArrayList<>(segments);
        list.add(segment);
        return new ElementPath(list);
    }

    public ElementPath concat(ElementPath other) {
        var list = new ArrayList<>(segments);
        list.addAll(other.segments);
        return new ElementPath(list);
    }

    public boolean isExact() {
        return segments.stream().noneMatch(PathSegment::isWildcard);
    }

    public List<String> localNames() {
        return segments.stream().map(PathSegment::getLocalName).collect(Collectors.toList());
    }

    public ElementPath toWildcard() {
        return new ElementPath(segments.stream().map(PathSegment::toWildcard).collect(Collectors.toList()));
    }

    /**
     * True when every segment of this (possibly wildcard) path matches the corresponding
     * segment of the exact path {@code other}.
     */
    public boolean matches(ElementPath other) {
        if (other.size() != size()) return false;
        for (int i = 0; i < size(); i++) {
            var target = other.segments.get(i);
            if (!segments.get(i).matches(target.getNamespace(), target.getLocalName())) return false;
        }
        return true;
    }

    /**
     * Replaces every run of consecutive {@code localName} steps with a single step.
     */
    public ElementPath collapse(String localName) {
        var list = new ArrayList<PathSegment>();
        for (var segment : segments) {
            if (segment.getLocalName().equals(localName) && !list.isEmpty()
                    && list.get(list.size() - 1).getLocalName().equals(localName)) {
                continue;
            }
            list.add(segment);
        }
        return new ElementPath(list);
    }

    @Override
    public String toString() {
        return segments.stream().map(PathSegment::toString).collect(Collectors.joining("/"));
    }
}
