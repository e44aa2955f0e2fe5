package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Element;
import org.jdom2.Namespace;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps element paths to the {@link Transcoder} responsible for them and performs typed
 * load/set operations against a metadata tree passed in on each call. Paths are relative to
 * the document root. An exact registration beats a wildcard one; among wildcard patterns
 * the one with the most namespace-qualified steps wins.
 *
 * <p>Instances are built once per standard and are not synchronized; register everything
 * before sharing one between readers.
 */
@Slf4j
public class TranscoderRegistry {
    private final Map<ElementPath, Transcoder<?>> exact = new HashMap<>();
    private final Map<List<String>, List<Registration>> byLocalNames = new HashMap<>();
    private final Set<String> collapsed = new HashSet<>();

    public TranscoderRegistry register(String pattern, Transcoder<?> transcoder) {
        return register(ElementPath.parse(pattern), transcoder);
    }

    /**
     * Registers {@code transcoder} for {@code pattern} together with the sub-element
     * transcoders it declares. Sub-elements inherit the namespace (or wildcard) of the
     * pattern's last step and never replace an explicit registration.
     */
    public TranscoderRegistry register(ElementPath pattern, Transcoder<?> transcoder) {
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("Cannot register a transcoder for the document root");
        }
        put(pattern, transcoder, true);
        var namespace = pattern.last().getNamespace();
        transcoder.children().forEach((relative, child) -> {
            var path = pattern;
            for (var name : relative.split("/")) {
                path = path.child(namespace == null ? PathSegment.wildcard(name) : PathSegment.exact(namespace, name));
            }
            put(path, child, false);
        });
        return this;
    }

    /**
     * Treats runs of nested {@code localName} groups (e.g. {@code GeoInfo/GeoInfo/Desc}) as
     * a single step when looking up transcoders.
     */
    public TranscoderRegistry collapse(String localName) {
        collapsed.add(localName);
        return this;
    }

    public Optional<Transcoder<?>> lookup(ElementPath path) {
        var normalized = normalize(path);
        if (normalized.isExact()) {
            var hit = exact.get(normalized);
            if (hit != null) return Optional.of(hit);
        }
        Registration best = null;
        for (var candidate : byLocalNames.getOrDefault(normalized.localNames(), List.of())) {
            if (compatible(candidate.pattern, normalized)
                    && (best == null || candidate.specificity() > best.specificity())) {
                best = candidate;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.transcoder);
    }

    public boolean isTranscodable(ElementPath path) {
        return lookup(path).isPresent();
    }

    public boolean isTranscodable(String path) {
        return isTranscodable(ElementPath.parse(path));
    }

    /**
     * Decodes the first element at {@code path} below {@code root}.
     *
     * @return the decoded value, or {@code null} when the tree has no such element
     * @throws SarCodecException NOT_TRANSCODABLE when no transcoder handles {@code path}
     */
    public Object load(Element root, ElementPath path) throws SarCodecException {
        require(path);
        var element = find(root, path);
        return element == null ? null : loadElem(element);
    }

    public <T> T load(Element root, ElementPath path, Class<T> type) throws SarCodecException {
        var value = load(root, path);
        if (value != null && !type.isInstance(value)) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Element " + path + " decodes to "
                    + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public Object loadElem(Element element) throws SarCodecException {
        var path = pathOf(element);
        return require(path).decode(element);
    }

    /**
     * Encodes {@code value} at {@code path}, creating the element and any missing ancestors.
     * New elements take the namespace of their path step, or of their parent for wildcard
     * steps.
     */
    public void set(Element root, ElementPath path, Object value) throws SarCodecException {
        require(path);
        var element = root;
        for (var segment : path.getSegments()) {
            var next = firstMatch(element, segment);
            if (next == null) {
                var namespace = segment.isWildcard()
                        ? element.getNamespace()
                        : Namespace.getNamespace(segment.getNamespace());
                next = new Element(segment.getLocalName(), namespace);
                element.addContent(next);
            }
            element = next;
        }
        setElem(element, value);
    }

    @SuppressWarnings("unchecked")
    public void setElem(Element element, Object value) throws SarCodecException {
        var path = pathOf(element);
        var transcoder = (Transcoder<Object>) require(path);
        try {
            transcoder.encode(element, value);
        } catch (ClassCastException e) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Value of type "
                    + value.getClass().getSimpleName() + " cannot be encoded at " + path, e);
        }
    }

    /**
     * First element below {@code root} matching {@code path}, or {@code null}.
     */
    public Element find(Element root, ElementPath path) {
        var all = findAll(root, path, true);
        return all.isEmpty() ? null : all.get(0);
    }

    public List<Element> findAll(Element root, ElementPath path) {
        return findAll(root, path, false);
    }

    private List<Element> findAll(Element root, ElementPath path, boolean firstOnly) {
        var current = List.of(root);
        for (var segment : path.getSegments()) {
            var next = new ArrayList<Element>();
            for (var element : current) {
                for (var child : element.getChildren()) {
                    if (segment.matches(child.getNamespaceURI(), child.getName())) {
                        next.add(child);
                    }
                }
            }
            if (next.isEmpty()) return List.of();
            current = next;
        }
        return firstOnly ? current.subList(0, 1) : current;
    }

    private Transcoder<?> require(ElementPath path) throws SarCodecException {
        return lookup(path).orElseThrow(() ->
                new SarCodecException(ErrorType.NOT_TRANSCODABLE, "No transcoder registered for " + path));
    }

    private void put(ElementPath pattern, Transcoder<?> transcoder, boolean replace) {
        var list = byLocalNames.computeIfAbsent(pattern.localNames(), k -> new ArrayList<>());
        var existing = list.stream().filter(r -> r.pattern.equals(pattern)).findFirst();
        if (existing.isPresent()) {
            if (!replace) return;
            list.remove(existing.get());
        }
        list.add(new Registration(pattern, transcoder));
        if (pattern.isExact()) {
            exact.put(pattern, transcoder);
        }
        log.trace("Registered {} for {}", transcoder.getClass().getSimpleName(), pattern);
    }

    private ElementPath normalize(ElementPath path) {
        var result = path;
        for (var name : collapsed) {
            result = result.collapse(name);
        }
        return result;
    }

    private static ElementPath pathOf(Element element) {
        var root = element;
        while (root.getParentElement() != null) {
            root = root.getParentElement();
        }
        return ElementPath.relative(root, element);
    }

    private static Element firstMatch(Element parent, PathSegment segment) {
        for (var child : parent.getChildren()) {
            if (segment.matches(child.getNamespaceURI(), child.getName())) return child;
        }
        return null;
    }

    /**
     * A step of a registered pattern and a step of a queried path are compatible when the
     * local names agree and either side is a wildcard or the namespaces are equal.
     */
    private static boolean compatible(ElementPath pattern, ElementPath query) {
        for (int i = 0; i < pattern.size(); i++) {
            var p = pattern.getSegments().get(i);
            var q = query.getSegments().get(i);
            if (!p.isWildcard() && !q.isWildcard() && !p.getNamespace().equals(q.getNamespace())) {
                return false;
            }
        }
        return true;
    }

    private static final class Registration {
        private final ElementPath pattern;
        private final Transcoder<?> transcoder;

        private Registration(ElementPath pattern, Transcoder<?> transcoder) {
            this.pattern = pattern;
            this.transcoder = transcoder;
        }

        private int specificity() {
            return (int) pattern.getSegments().stream().filter(s -> !s.isWildcard()).count();
        }
    }
}
