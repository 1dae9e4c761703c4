package com.aasx.ingest.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link XmlLookupStrategy}s. Every lookup returns the result of the
 * first strategy that yields something non-empty.
 */
public final class XmlLookupChain {
    private static final Logger log = LoggerFactory.getLogger(XmlLookupChain.class);

    private final List<XmlLookupStrategy> strategies;

    public XmlLookupChain(List<XmlLookupStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one lookup strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static XmlLookupChain of(XmlLookupStrategy... strategies) {
        return new XmlLookupChain(List.of(strategies));
    }

    /**
     * Qualified lookup in each namespace, then unqualified, then local-name.
     */
    public static XmlLookupChain withFallback(String... namespaceUris) {
        List<XmlLookupStrategy> strategies = new ArrayList<>();
        for (String namespaceUri : namespaceUris) {
            strategies.add(XmlLookupStrategy.qualified(namespaceUri));
        }
        strategies.add(XmlLookupStrategy.unqualified());
        strategies.add(XmlLookupStrategy.localName());
        return new XmlLookupChain(strategies);
    }

    public List<XmlLookupStrategy> strategies() {
        return strategies;
    }

    /**
     * All descendant elements with the given local name, in document order.
     */
    public List<Element> descendants(Node root, String localName) {
        for (int i = 0; i < strategies.size(); i++) {
            List<Element> found = new ArrayList<>();
            collectDescendants(root, localName, strategies.get(i), found);
            if (!found.isEmpty()) {
                traceFallback(i, localName);
                return found;
            }
        }
        return List.of();
    }

    /**
     * Direct child elements with the given local name.
     */
    public List<Element> children(Element parent, String localName) {
        for (int i = 0; i < strategies.size(); i++) {
            List<Element> found = directChildren(parent, localName, strategies.get(i));
            if (!found.isEmpty()) {
                traceFallback(i, localName);
                return found;
            }
        }
        return List.of();
    }

    public Optional<Element> firstChild(Element parent, String localName) {
        List<Element> found = children(parent, localName);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Trimmed text of the first child with the given local name. A strategy whose match
     * has blank text does not stop the chain.
     */
    public Optional<String> childText(Element parent, String localName) {
        for (int i = 0; i < strategies.size(); i++) {
            for (Element child : directChildren(parent, localName, strategies.get(i))) {
                String text = child.getTextContent();
                if (text != null && !text.isBlank()) {
                    traceFallback(i, localName);
                    return Optional.of(text.trim());
                }
            }
        }
        return Optional.empty();
    }

    private static List<Element> directChildren(Element parent, String localName, XmlLookupStrategy strategy) {
        List<Element> found = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (strategy.matches(child, localName)) {
                found.add((Element) child);
            }
        }
        return found;
    }

    private static void collectDescendants(Node node, String localName, XmlLookupStrategy strategy,
                                           List<Element> found) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            if (strategy.matches(child, localName)) {
                found.add((Element) child);
            }
            collectDescendants(child, localName, strategy, found);
        }
    }

    private void traceFallback(int index, String localName) {
        if (index > 0 && log.isTraceEnabled()) {
            log.trace("xml.lookup.fallback element={} strategy={}", localName, strategies.get(index).describe());
        }
    }
}
