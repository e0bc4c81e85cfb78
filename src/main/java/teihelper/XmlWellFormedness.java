package teihelper;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Strict well-formedness check. The tree builder is lenient and would silently
 * repair broken input, so documents are streamed through StAX first.
 */
final class XmlWellFormedness {
    private static final Logger LOGGER = Logger.getLogger(XmlWellFormedness.class.getName());

    private XmlWellFormedness() {
    }

    static void check(byte[] xml) throws XMLStreamException {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        trySet(factory, "javax.xml.stream.isSupportingExternalEntities", Boolean.FALSE);
        trySet(factory, "javax.xml.stream.supportDTD", Boolean.FALSE);
        trySet(factory, XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);

        XMLStreamReader reader = factory.createXMLStreamReader(new ByteArrayInputStream(xml));
        try {
            while (reader.hasNext()) {
                reader.next();
            }
        } finally {
            reader.close();
        }
    }

    private static void trySet(XMLInputFactory f, String key, Object value) {
        try {
            f.setProperty(key, value);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.FINE, "StAX property not supported: " + key, e);
        }
    }
}
