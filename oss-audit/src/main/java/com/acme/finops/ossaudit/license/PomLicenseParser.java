package com.acme.finops.ossaudit.license;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts {@code project/licenses/license/name} values from a POM, with or
 * without the Maven namespace.
 */
public final class PomLicenseParser {
    private static final String LICENSE_SEPARATOR = ";";

    // The JDK default handler prints fatal errors to stderr before throwing.
    private static final ErrorHandler RETHROWING = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private PomLicenseParser() {
    }

    /**
     * @return license names joined with {@code ;}, or the empty string when the
     *         POM declares none
     */
    public static String licenses(byte[] pom) throws LicenseLookupException {
        Document document = parse(pom);
        List<String> names = new ArrayList<>();
        Element project = document.getDocumentElement();
        for (Element licenses : children(project, "licenses")) {
            for (Element license : children(licenses, "license")) {
                for (Element name : children(license, "name")) {
                    String text = name.getTextContent();
                    if (text != null && !text.isBlank()) {
                        names.add(text.trim());
                    }
                }
            }
        }
        return String.join(LICENSE_SEPARATOR, names);
    }

    private static Document parse(byte[] pom) throws LicenseLookupException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROWING);
            return builder.parse(new ByteArrayInputStream(pom));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new LicenseLookupException("unparsable POM: " + e.getMessage(), e);
        }
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            String name = n.getLocalName() != null ? n.getLocalName() : n.getNodeName();
            if (localName.equals(name)) {
                out.add((Element) n);
            }
        }
        return out;
    }
}
