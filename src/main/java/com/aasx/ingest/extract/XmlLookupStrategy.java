package com.aasx.ingest.extract;

import org.w3c.dom.Node;

import java.util.Objects;

/**
 * One way of deciding whether a DOM element is the one being looked up by local name.
 * Strategies are tried in order by an {@link XmlLookupChain}.
 */
public interface XmlLookupStrategy {

    boolean matches(Node node, String localName);

    String describe();

    /**
     * Element in exactly the given namespace.
     */
    static XmlLookupStrategy qualified(String namespaceUri) {
        Objects.requireNonNull(namespaceUri, "namespaceUri is required");
        return new XmlLookupStrategy() {
            @Override
            public boolean matches(Node node, String localName) {
                return node.getNodeType() == Node.ELEMENT_NODE
                        && namespaceUri.equals(node.getNamespaceURI())
                        && localName.equals(node.getLocalName());
            }

            @Override
            public String describe() {
                return "qualified{" + namespaceUri + "}";
            }
        };
    }

    /**
     * Element without any namespace.
     */
    static XmlLookupStrategy unqualified() {
        return new XmlLookupStrategy() {
            @Override
            public boolean matches(Node node, String localName) {
                return node.getNodeType() == Node.ELEMENT_NODE
                        && node.getNamespaceURI() == null
                        && localName.equals(localNameOf(node));
            }

            @Override
            public String describe() {
                return "unqualified";
            }
        };
    }

    /**
     * Element in any namespace, matched on local name alone.
     */
    static XmlLookupStrategy localName() {
        return new XmlLookupStrategy() {
            @Override
            public boolean matches(Node node, String localName) {
                return node.getNodeType() == Node.ELEMENT_NODE
                        && localName.equals(localNameOf(node));
            }

            @Override
            public String describe() {
                return "local-name";
            }
        };
    }

    private static String localNameOf(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
