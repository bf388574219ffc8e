package dev.sfc.engine;

import dev.sfc.model.LoadOptions;
import dev.sfc.xml.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

/**
 * Loads an SFC chart from an L5X export (a whole controller, a single
 * program or routine) or from a bare {@code SFCContent} document.
 */
public final class L5xLoader {

    private static final Logger log = LoggerFactory.getLogger(L5xLoader.class);

    private L5xLoader() {}

    public static SfcChart loadFromFile(Path path) throws IOException {
        return loadFromFile(path, LoadOptions.defaults());
    }

    public static SfcChart loadFromFile(Path path, LoadOptions options) throws IOException {
        Document doc;
        try {
            doc = newBuilder().parse(path.toFile());
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Failed to parse L5X file " + path, e);
        }
        return load(doc.getDocumentElement(), options);
    }

    public static SfcChart loadFromString(String xml) throws IOException {
        return loadFromString(xml, LoadOptions.defaults());
    }

    public static SfcChart loadFromString(String xml, LoadOptions options) throws IOException {
        Document doc;
        try {
            doc = newBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Failed to parse L5X content", e);
        }
        return load(doc.getDocumentElement(), options);
    }

    /**
     * Build a chart from an already-parsed document root.
     *
     * @throws IllegalArgumentException if no matching SFC routine is present
     */
    public static SfcChart load(Element root, LoadOptions options) {
        if ("SFCContent".equals(root.getTagName())) {
            return SfcChart.from(root);
        }

        NodeList programs = root.getElementsByTagName("Program");
        boolean programFound = false;
        for (int i = 0; i < programs.getLength(); i++) {
            Element program = (Element) programs.item(i);
            if (options.programName() != null
                && !options.programName().equals(Elements.attribute(program, "Name"))) {
                continue;
            }
            programFound = true;
            Element sfcContent = findSfcContent(program, options.routineName());
            if (sfcContent == null) {
                continue;
            }
            log.debug("Using SFC routine of program {}", Elements.attribute(program, "Name"));
            Element tags = options.loadPresets() ? Elements.firstChild(program, "Tags") : null;
            return SfcChart.from(sfcContent, tags);
        }

        if (options.programName() != null && !programFound) {
            throw new IllegalArgumentException("Program not found: " + options.programName());
        }
        if (options.programName() == null && options.routineName() == null) {
            // A routine exported on its own has no Program around it.
            NodeList contents = root.getElementsByTagName("SFCContent");
            if (contents.getLength() > 0) {
                return SfcChart.from((Element) contents.item(0));
            }
        }
        throw new IllegalArgumentException(options.routineName() == null
            ? "No SFC routine found"
            : "SFC routine not found: " + options.routineName());
    }

    private static Element findSfcContent(Element program, String routineName) {
        for (Element routine : Elements.path(program, "Routines/Routine")) {
            Element content = Elements.firstChild(routine, "SFCContent");
            if (content == null) {
                continue;
            }
            if (routineName == null || routineName.equals(Elements.attribute(routine, "Name"))) {
                return content;
            }
        }
        return null;
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }
}
