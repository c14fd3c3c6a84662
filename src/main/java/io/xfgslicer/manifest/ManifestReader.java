package io.xfgslicer.manifest;

import io.xfgslicer.ConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads a SARD-style {@code manifest.xml}:
 * <pre>
 * &lt;container&gt;
 *   &lt;testcase id="..."&gt;
 *     &lt;file path="..."&gt;
 *       &lt;flaw line="12" name="..."/&gt;
 *       &lt;mixed line="20" name="..."/&gt;
 *       &lt;fix line="30" name="..."/&gt;
 *     &lt;/file&gt;
 *   &lt;/testcase&gt;
 * &lt;/container&gt;
 * </pre>
 * {@code flaw} and {@code mixed} lines are vulnerable; {@code fix} lines are not.
 */
public class ManifestReader {

    /**
     * Parses the manifest at the given path.
     *
     * @throws ConfigurationException If the file is missing or is not a readable manifest
     */
    public Manifest read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Manifest not found: " + path);
        }
        try {
            Document document = newDocumentBuilder().parse(path.toFile());
            document.getDocumentElement().normalize();
            return toManifest(document.getDocumentElement());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ConfigurationException("Failed to parse manifest " + path + ": " + e.getMessage(), e);
        }
    }

    private Manifest toManifest(Element root) {
        Map<String, Map<String, Set<Integer>>> testCases = new LinkedHashMap<>();
        NodeList testCaseNodes = root.getElementsByTagName("testcase");
        for (int i = 0; i < testCaseNodes.getLength(); i++) {
            Element testCase = (Element) testCaseNodes.item(i);
            String id = testCase.getAttribute("id");
            Map<String, Set<Integer>> files = testCases.computeIfAbsent(id, k -> new LinkedHashMap<>());

            NodeList fileNodes = testCase.getElementsByTagName("file");
            for (int j = 0; j < fileNodes.getLength(); j++) {
                Element file = (Element) fileNodes.item(j);
                Set<Integer> lines = files.computeIfAbsent(file.getAttribute("path"), k -> new TreeSet<>());
                collectLines(file, "flaw", lines);
                collectLines(file, "mixed", lines);
            }
        }
        return new Manifest(testCases);
    }

    private void collectLines(Element file, String tag, Set<Integer> lines) {
        NodeList marks = file.getElementsByTagName(tag);
        for (int i = 0; i < marks.getLength(); i++) {
            String line = ((Element) marks.item(i)).getAttribute("line").strip();
            try {
                lines.add(Integer.parseInt(line));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid line '" + line + "' in <" + tag + "> of "
                        + file.getAttribute("path"), e);
            }
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // No DTDs or external entities
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }
}
