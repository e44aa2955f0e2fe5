package com.sarcodec.xml;

import lombok.Value;

import java.util.Objects;

/**
 * One step of an {@link ElementPath}: a local name and either a namespace URI or the
 * wildcard ({@code null}), which matches any namespace. The empty string means "no namespace".
 */
@Value
public class PathSegment {
    String namespace;
    String localName;

    private PathSegment(String namespace, String localName) {
        this.namespace = namespace;
        this.localName = Objects.requireNonNull(localName, "Local name cannot be null");
        if (localName.isEmpty() || localName.contains("/")) {
            throw new IllegalArgumentException("Invalid local name: '" + localName + "'");
        }
    }

    public static PathSegment exact(String namespace, String localName) {
        return new PathSegment(Objects.requireNonNull(namespace, "Namespace cannot be null"), localName);
    }

    public static PathSegment wildcard(String localName) {
        return new PathSegment(null, localName);
    }

    public boolean isWildcard() {
        return namespace == null;
    }

    public boolean matches(String elementNamespace, String elementName) {
        return localName.equals(elementName) && (namespace == null || namespace.equals(elementNamespace));
    }

    public PathSegment toWildcard() {
        return isWildcard() ? this : wildcard(localName);
    }

    @Override
    public String toString() {
        if (namespace == null) return "{*}" + localName;
        if (namespace.isEmpty()) return localName;
        return "{" + namespace + "}" + localName;
    }
}
