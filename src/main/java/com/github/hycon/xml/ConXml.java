package com.github.hycon.xml;

import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
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
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helpers for the versioned {@code tulipcon} XML format: the document envelope and the tags
 * storing lists, dictionaries, matrices, polytopes and regions.
 *
 * Child elements are looked up by local name, so documents with or without the default
 * namespace are both accepted.
 */
public final class ConXml {

    public static final String NAMESPACE = "http://tulip-control.sourceforge.net/ns/0";
    public static final String ROOT = "tulipcon";
    public static final String VERSION = "0";

    // Only provides static methods.
    private ConXml() {}

    /* ------------- documents ---------------- */

    @NotNull
    public static Document newDocument() {
        return builder().newDocument();
    }

    /**
     * Create the {@code tulipcon} root element of an empty document.
     */
    @NotNull
    public static Element createEnvelope(@NotNull Document document) {
        final Element root = element(document, ROOT);
        root.setAttribute("version", VERSION);
        document.appendChild(root);
        return root;
    }

    @NotNull
    public static Document parse(@NotNull String xml) throws FormatException {
        try {
            return builder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new FormatException("Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FormatException("Cannot read XML: " + e.getMessage(), e);
        }
    }

    /**
     * Check root tag and version of a parsed document and return its root element.
     */
    @NotNull
    public static Element openEnvelope(@NotNull Document document) throws FormatException {
        final Element root = document.getDocumentElement();
        if (root == null || !ROOT.equals(localName(root))) {
            throw new FormatException("Root tag should be " + ROOT);
        }
        if (!root.hasAttribute("version")) {
            throw new FormatException("Unversioned " + ROOT + " document");
        }
        final String version = root.getAttribute("version").trim();
        if (!VERSION.equals(version)) {
            throw new FormatException("Unsupported " + ROOT + " version: " + version);
        }
        return root;
    }

    @NotNull
    public static String toXml(@NotNull Document document, boolean pretty) {
        try {
            final TransformerFactory factory = TransformerFactory.newInstance();
            final Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            if (pretty) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }
            final StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot serialize XML document", e);
        }
    }

    @NotNull
    private static DocumentBuilder builder() {
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /* ------------- elements ---------------- */

    @NotNull
    public static Element element(@NotNull Document document, @NotNull String name) {
        return document.createElementNS(NAMESPACE, name);
    }

    @NotNull
    public static Element textElement(@NotNull Document document, @NotNull String name, @NotNull String text) {
        final Element result = element(document, name);
        if (!text.isEmpty()) {
            result.setTextContent(text);
        }
        return result;
    }

    @NotNull
    public static String localName(@NotNull Element element) {
        final String local = element.getLocalName();
        return local == null ? element.getTagName() : local;
    }

    @Nullable
    public static Element child(@NotNull Element parent, @NotNull String name) {
        final NodeList nodes = parent.getChildNodes();
        for (int i=0; i < nodes.getLength(); i++) {
            final Node node = nodes.item(i);
            if (node instanceof Element && name.equals(localName((Element) node))) {
                return (Element) node;
            }
        }
        return null;
    }

    @NotNull
    public static Element requireChild(@NotNull Element parent, @NotNull String name) throws FormatException {
        final Element result = child(parent, name);
        if (result == null) {
            throw new FormatException("<" + localName(parent) + "> is missing <" + name + ">");
        }
        return result;
    }

    @NotNull
    public static List<Element> children(@NotNull Element parent, @NotNull String name) {
        final List<Element> result = new ArrayList<>();
        final NodeList nodes = parent.getChildNodes();
        for (int i=0; i < nodes.getLength(); i++) {
            final Node node = nodes.item(i);
            if (node instanceof Element && name.equals(localName((Element) node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * True if the element has neither child elements nor non-blank text.
     */
    public static boolean isBlank(@NotNull Element element) {
        final NodeList nodes = element.getChildNodes();
        for (int i=0; i < nodes.getLength(); i++) {
            final Node node = nodes.item(i);
            if (node instanceof Element) return false;
            if (node.getNodeType() == Node.TEXT_NODE && !node.getTextContent().isBlank()) return false;
        }
        return true;
    }

    public static int parseInt(@NotNull String value, @NotNull String what) throws FormatException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new FormatException("Expected an integer for " + what + ", got '" + value + "'", e);
        }
    }

    /* ------------- lists ---------------- */

    @NotNull
    public static Element tagList(@NotNull Document document, @NotNull String name, @NotNull Collection<?> items) {
        final StringJoiner joiner = new StringJoiner(" ");
        for (Object item : items) {
            joiner.add(String.valueOf(item));
        }
        return textElement(document, name, joiner.toString());
    }

    @NotNull
    public static List<String> untagList(@NotNull Element element) {
        final List<String> result = new ArrayList<>();
        final String text = element.getTextContent();
        if (text == null || text.isBlank()) return result;
        for (String token : text.trim().split("\\s+")) {
            result.add(token);
        }
        return result;
    }

    @NotNull
    public static List<Integer> untagIntList(@NotNull Element element) throws FormatException {
        final List<Integer> result = new ArrayList<>();
        for (String token : untagList(element)) {
            result.add(parseInt(token, "<" + localName(element) + ">"));
        }
        return result;
    }

    /* ------------- dictionaries ---------------- */

    @NotNull
    public static Element tagDict(@NotNull Document document, @NotNull String name, @NotNull Map<String, ?> items) {
        final Element result = element(document, name);
        for (Map.Entry<String, ?> entry : items.entrySet()) {
            final Element item = element(document, "item");
            item.setAttribute("key", entry.getKey());
            item.setAttribute("value", String.valueOf(entry.getValue()));
            result.appendChild(item);
        }
        return result;
    }

    /**
     * Read {@code <item key=".." value=".."/>} children. A repeated key overwrites the earlier one.
     */
    @NotNull
    public static Map<String, String> untagDict(@NotNull Element element) throws FormatException {
        final Map<String, String> result = new LinkedHashMap<>();
        for (Element item : children(element, "item")) {
            if (!item.hasAttribute("key") || !item.hasAttribute("value")) {
                throw new FormatException("Malformed <item> in <" + localName(element) + ">");
            }
            result.put(item.getAttribute("key"), item.getAttribute("value"));
        }
        return result;
    }

    /* ------------- matrices ---------------- */

    @NotNull
    public static Element tagMatrix(@NotNull Document document, @NotNull String name, @NotNull double[][] matrix) {
        final int rows = matrix.length;
        final int cols = rows == 0 ? 0 : matrix[0].length;
        final StringJoiner joiner = new StringJoiner(" ");
        for (double[] row : matrix) {
            for (double value : row) {
                joiner.add(Double.toString(value));
            }
        }
        return matrixElement(document, name, rows == 0 || cols == 0 ? 0 : rows, cols, joiner.toString());
    }

    /**
     * A vector is stored as a column, {@code r="n" c="1"}.
     */
    @NotNull
    public static Element tagVector(@NotNull Document document, @NotNull String name, @NotNull double[] vector) {
        final StringJoiner joiner = new StringJoiner(" ");
        for (double value : vector) {
            joiner.add(Double.toString(value));
        }
        return matrixElement(document, name, vector.length, vector.length == 0 ? 0 : 1, joiner.toString());
    }

    /**
     * Boolean matrices are stored as 0/1 integers.
     */
    @NotNull
    public static Element tagBooleanMatrix(@NotNull Document document, @NotNull String name, @NotNull boolean[][] matrix) {
        final int rows = matrix.length;
        final int cols = rows == 0 ? 0 : matrix[0].length;
        final StringJoiner joiner = new StringJoiner(" ");
        for (boolean[] row : matrix) {
            for (boolean value : row) {
                joiner.add(value ? "1" : "0");
            }
        }
        return matrixElement(document, name, rows, cols, joiner.toString());
    }

    @NotNull
    private static Element matrixElement(@NotNull Document document, @NotNull String name, int rows, int cols, @NotNull String text) {
        final Element result = textElement(document, name, text);
        result.setAttribute("type", "matrix");
        result.setAttribute("r", String.valueOf(rows));
        result.setAttribute("c", String.valueOf(cols));
        return result;
    }

    @NotNull
    public static double[][] untagMatrix(@NotNull Element element) throws FormatException {
        if (!"matrix".equals(element.getAttribute("type"))) {
            throw new FormatException("<" + localName(element) + "> should be of type matrix");
        }
        final List<String> values = untagList(element);
        if (values.isEmpty()) {
            return new double[0][];
        }
        final int rows = parseInt(element.getAttribute("r"), "matrix rows");
        final int cols = parseInt(element.getAttribute("c"), "matrix columns");
        if (rows * cols != values.size()) {
            throw new FormatException("<" + localName(element) + "> declares " + rows + "x" + cols
                    + " entries but holds " + values.size());
        }
        final double[][] result = new double[rows][cols];
        for (int i=0; i < rows; i++) {
            for (int j=0; j < cols; j++) {
                final String value = values.get(i * cols + j);
                try {
                    result[i][j] = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new FormatException("Expected a number in <" + localName(element) + ">, got '" + value + "'", e);
                }
            }
        }
        return result;
    }

    @NotNull
    public static double[] untagVector(@NotNull Element element) throws FormatException {
        final double[][] matrix = untagMatrix(element);
        final List<Double> result = new ArrayList<>();
        for (double[] row : matrix) {
            for (double value : row) {
                result.add(value);
            }
        }
        final double[] vector = new double[result.size()];
        for (int i=0; i < vector.length; i++) {
            vector[i] = result.get(i);
        }
        return vector;
    }

    @NotNull
    public static boolean[][] untagBooleanMatrix(@NotNull Element element) throws FormatException {
        final double[][] matrix = untagMatrix(element);
        final boolean[][] result = new boolean[matrix.length][];
        for (int i=0; i < matrix.length; i++) {
            result[i] = new boolean[matrix[i].length];
            for (int j=0; j < matrix[i].length; j++) {
                result[i][j] = matrix[i][j] != 0.0;
            }
        }
        return result;
    }

    /* ------------- geometry ---------------- */

    @NotNull
    public static Element tagPolytope(@NotNull Document document, @NotNull String name, @NotNull Polytope polytope) {
        final Element result = element(document, name);
        result.setAttribute("type", "polytope");
        result.appendChild(tagMatrix(document, "H", polytope.getH()));
        result.appendChild(tagVector(document, "K", polytope.getK()));
        return result;
    }

    @NotNull
    public static Polytope untagPolytope(@NotNull Element element) throws FormatException {
        if (!"polytope".equals(element.getAttribute("type"))) {
            throw new FormatException("<" + localName(element) + "> should be of type polytope");
        }
        final double[][] h = untagMatrix(requireChild(element, "H"));
        final double[] k = untagVector(requireChild(element, "K"));
        try {
            return new Polytope(h, k);
        } catch (IllegalArgumentException e) {
            throw new FormatException("Inconsistent polytope <" + localName(element) + ">: " + e.getMessage(), e);
        }
    }

    @NotNull
    public static Element tagRegion(@NotNull Document document, @NotNull Region region) {
        final Element result = element(document, "region");
        result.appendChild(tagList(document, "list_prop", region.getPropositions()));
        for (Polytope piece : region.getPieces()) {
            result.appendChild(tagPolytope(document, "reg_item", piece));
        }
        return result;
    }

    @NotNull
    public static Region untagRegion(@NotNull Element element) throws FormatException {
        if (!"region".equals(localName(element))) {
            throw new FormatException("Expected <region>, got <" + localName(element) + ">");
        }
        final Element props = child(element, "list_prop");
        final List<Integer> propositions = props == null ? new ArrayList<>() : untagIntList(props);
        final List<Polytope> pieces = new ArrayList<>();
        for (Element item : children(element, "reg_item")) {
            pieces.add(untagPolytope(item));
        }
        return new Region(pieces, propositions);
    }

}
