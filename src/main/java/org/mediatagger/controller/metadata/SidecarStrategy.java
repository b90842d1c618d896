package org.mediatagger.controller.metadata;

import javax.xml.xpath.XPathExpressionException;
import org.w3c.dom.Document;

/**
 * One way of pulling a value out of a parsed sidecar.  Strategies for the
 * same field are tried in order until one finds something.
 *
 * @param <T> the extracted value type
 */
@FunctionalInterface
public interface SidecarStrategy<T> {

    /**
     * @param doc the parsed sidecar
     * @return the value, or null if this strategy found nothing
     * @throws XPathExpressionException if an expression is invalid
     */
    T extract(Document doc) throws XPathExpressionException;
}
