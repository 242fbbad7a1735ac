package com.caselink.adapter;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RSS 2.0 reader. External entities and DTDs are refused.
 */
final class RssFeedParser {

    private static final String CONTENT_NS = "http://purl.org/rss/1.0/modules/content/";

    private RssFeedParser() {
    }

    static List<AmberFeedItem> parse(String feedUrl, String xml) throws SAXException, IOException {
        Document doc = parseXml(xml);
        NodeList items = doc.getElementsByTagName("item");
        List<AmberFeedItem> result = new ArrayList<>(items.getLength());

        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            Element enclosure = firstChild(item, "enclosure");
            String enclosureUrl = enclosure != null && !enclosure.getAttribute("url").isBlank()
                ? enclosure.getAttribute("url") : null;

            result.add(new AmberFeedItem(
                feedUrl,
                text(item, "title"),
                text(item, "link"),
                text(item, "description"),
                text(item, "pubDate"),
                text(item, "guid"),
                enclosureUrl,
                contentEncoded(item)
            ));
        }
        return result;
    }

    private static Document parseXml(String xml) throws SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static Element firstChild(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && localName.equals(localNameOf(e)) && e.getNamespaceURI() == null) {
                return e;
            }
        }
        return null;
    }

    private static String text(Element parent, String localName) {
        Element e = firstChild(parent, localName);
        if (e == null) return null;
        String value = e.getTextContent().trim();
        return value.isEmpty() ? null : value;
    }

    private static String contentEncoded(Element item) {
        NodeList nodes = item.getElementsByTagNameNS(CONTENT_NS, "encoded");
        if (nodes.getLength() == 0) return null;
        String value = nodes.item(0).getTextContent().trim();
        return value.isEmpty() ? null : value;
    }

    private static String localNameOf(Element e) {
        return e.getLocalName() != null ? e.getLocalName() : e.getTagName();
    }
}
