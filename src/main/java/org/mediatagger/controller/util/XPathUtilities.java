package org.mediatagger.controller.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

public class XPathUtilities {

    /** Prefixes usable in expressions, bound to the namespaces XMP sidecars use. */
    public static final Map<String, String> XMP_NAMESPACES = Map.of(
        "rdf", "http://www.w3.org/1999/02/22-rdf-syntax-ns#",
        "dc", "http://purl.org/dc/elements/1.1/",
        "Iptc4xmpCore", "http://iptc.org/std/Iptc4xmpCore/1.0/xmlns/",
        "photoshop", "http://ns.adobe.com/photoshop/1.0/",
        "exif", "http://ns.adobe.com/exif/1.0/",
        "lr", "http://ns.adobe.com/lightroom/1.0/",
        "xmp", "http://ns.adobe.com/xap/1.0/",
        "xml", XMLConstants.XML_NS_URI
    );

    private static final NamespaceContext XMP_CONTEXT = new NamespaceContext() {
        @Override
        public String getNamespaceURI(String prefix) {
            return XMP_NAMESPACES.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
        }

        @Override
        public String getPrefix(String namespaceURI) {
            for (Map.Entry<String, String> entry : XMP_NAMESPACES.entrySet()) {
                if (entry.getValue().equals(namespaceURI)) {
                    return entry.getKey();
                }
            }
            return null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            String prefix = getPrefix(namespaceURI);
            return (prefix == null)
                ? Collections.emptyIterator()
                : Collections.singletonList(prefix).iterator();
        }
    };

    private static final XPathFactory XPATH_FACTORY =
        XPathFactory.newInstance();

    /**
     * XPath instances are not guaranteed to be thread-safe. Use a ThreadLocal
     * instance so callers can safely evaluate XPath expressions from any thread.
     */
    private static final ThreadLocal<XPath> XPATH = ThreadLocal.withInitial(() -> {
        XPath xpath = XPATH_FACTORY.newXPath();
        xpath.setNamespaceContext(XMP_CONTEXT);
        return xpath;
    });

    /**
     * Per-thread cache of compiled XPath expressions. The sidecar reader
     * evaluates the same handful of expressions for every file.
     */
    private static final ThreadLocal<Map<String, XPathExpression>> EXPR_CACHE =
        ThreadLocal.withInitial(HashMap::new);

    private static XPathExpression compile(String expression)
        throws XPathExpressionException {
        Map<String, XPathExpression> cache = EXPR_CACHE.get();
        XPathExpression compiled = cache.get(expression);
        if (compiled == null) {
            compiled = XPATH.get().compile(expression);
            cache.put(expression, compiled);
        }
        return compiled;
    }

    public static NodeList nodeListValue(String name, Node eNode)
        throws XPathExpressionException {
        return (NodeList) compile(name).evaluate(eNode, XPathConstants.NODESET);
    }

    /**
     * Text of the first node matching the expression whose trimmed content
     * is not empty.
     *
     * @param name the XPath expression
     * @param eNode the context node
     * @return the trimmed text, or null if no matching node has any
     * @throws XPathExpressionException if the expression is invalid
     */
    public static String firstNonEmptyText(String name, Node eNode)
        throws XPathExpressionException {
        NodeList nodes = nodeListValue(name, eNode);
        for (int i = 0; i < nodes.getLength(); i++) {
            String text = StringUtils.trimToNull(nodes.item(i).getTextContent());
            if (text != null) {
                return text;
            }
        }
        return null;
    }
}
