package com.github.hycon.xml;

import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConXmlTest {

    private static Element parseRoot(String xml) throws FormatException {
        return ConXml.openEnvelope(ConXml.parse(xml));
    }

    @Test
    void envelopeIsVersioned() throws FormatException {
        Document document = ConXml.newDocument();
        ConXml.createEnvelope(document);
        String text = ConXml.toXml(document, false);

        assertThat(text).contains("tulipcon").contains("version=\"0\"").contains(ConXml.NAMESPACE);
        assertThat(ConXml.localName(parseRoot(text))).isEqualTo(ConXml.ROOT);
    }

    @Test
    void envelopeErrors() {
        assertThatThrownBy(() -> parseRoot("<other version=\"0\"/>"))
                .isInstanceOf(FormatException.class).hasMessageContaining("Root tag");
        assertThatThrownBy(() -> parseRoot("<tulipcon/>"))
                .isInstanceOf(FormatException.class).hasMessageContaining("Unversioned");
        assertThatThrownBy(() -> parseRoot("<tulipcon version=\"1\"/>"))
                .isInstanceOf(FormatException.class).hasMessageContaining("Unsupported");
        assertThatThrownBy(() -> ConXml.parse("<tulipcon version=\"0\">"))
                .isInstanceOf(FormatException.class).hasMessageContaining("Malformed");
    }

    @Test
    void doctypeIsRejected() {
        String xml = "<!DOCTYPE tulipcon [<!ENTITY x \"y\">]><tulipcon version=\"0\">&x;</tulipcon>";
        assertThatThrownBy(() -> ConXml.parse(xml)).isInstanceOf(FormatException.class);
    }

    @Test
    void listsAndDictionaries() throws FormatException {
        Document document = ConXml.newDocument();
        Element list = ConXml.tagList(document, "child_list", Arrays.asList(3, 1, 2));
        assertThat(ConXml.untagIntList(list)).containsExactly(3, 1, 2);
        assertThat(ConXml.untagList(ConXml.tagList(document, "empty", Arrays.asList()))).isEmpty();

        Map<String, Integer> values = new LinkedHashMap<>();
        values.put("x", 1);
        values.put("y", -4);
        assertThat(ConXml.untagDict(ConXml.tagDict(document, "state", values)))
                .containsExactly(entry("x", "1"), entry("y", "-4"));
    }

    @Test
    void laterDictionaryKeysWin() throws FormatException {
        Element state = parseRoot("<tulipcon version=\"0\"><state>"
                + "<item key=\"x\" value=\"1\"/><item key=\"x\" value=\"2\"/></state></tulipcon>");
        assertThat(ConXml.untagDict(ConXml.requireChild(state, "state"))).containsExactly(entry("x", "2"));
    }

    @Test
    void malformedItemsAndNumbers() throws FormatException {
        Element root = parseRoot("<tulipcon version=\"0\"><state><item key=\"x\"/></state>"
                + "<child_list>1 two</child_list></tulipcon>");
        assertThatThrownBy(() -> ConXml.untagDict(ConXml.requireChild(root, "state")))
                .isInstanceOf(FormatException.class);
        assertThatThrownBy(() -> ConXml.untagIntList(ConXml.requireChild(root, "child_list")))
                .isInstanceOf(FormatException.class).hasMessageContaining("two");
        assertThatThrownBy(() -> ConXml.requireChild(root, "missing"))
                .isInstanceOf(FormatException.class).hasMessageContaining("<missing>");
    }

    @Test
    void matrices() throws FormatException {
        Document document = ConXml.newDocument();
        double[][] m = { { 1.5, -2 }, { 0, 3 } };
        Element tag = ConXml.tagMatrix(document, "H", m);
        assertThat(tag.getAttribute("r")).isEqualTo("2");
        assertThat(tag.getAttribute("c")).isEqualTo("2");
        assertThat(ConXml.untagMatrix(tag)).isDeepEqualTo(m);
        assertThat(ConXml.untagVector(ConXml.tagVector(document, "K", new double[] { 1, 2 }))).containsExactly(1, 2);

        Element empty = ConXml.tagMatrix(document, "H", new double[0][]);
        assertThat(empty.getAttribute("r")).isEqualTo("0");
        assertThat(ConXml.untagMatrix(empty)).isEmpty();

        boolean[][] b = { { true, false }, { false, true } };
        assertThat(ConXml.untagBooleanMatrix(ConXml.tagBooleanMatrix(document, "adj", b))).isDeepEqualTo(b);
    }

    @Test
    void matrixSizeMustMatch() throws FormatException {
        Element root = parseRoot("<tulipcon version=\"0\"><H type=\"matrix\" r=\"2\" c=\"2\">1 2 3</H>"
                + "<K r=\"1\" c=\"1\">1</K></tulipcon>");
        assertThatThrownBy(() -> ConXml.untagMatrix(ConXml.requireChild(root, "H")))
                .isInstanceOf(FormatException.class).hasMessageContaining("2x2");
        assertThatThrownBy(() -> ConXml.untagMatrix(ConXml.requireChild(root, "K")))
                .isInstanceOf(FormatException.class).hasMessageContaining("type matrix");
    }

    @Test
    void regions() throws FormatException {
        Document document = ConXml.newDocument();
        Region region = new Region(Arrays.asList(
                Polytope.box(new double[] { 0, 0 }, new double[] { 1, 1 }),
                Polytope.box(new double[] { 1, 0 }, new double[] { 2, 1 })), Arrays.asList(0, 1));

        Region read = ConXml.untagRegion(ConXml.tagRegion(document, region));

        assertThat(read).isEqualTo(region);
        assertThat(ConXml.untagPolytope(ConXml.tagPolytope(document, "domain", Polytope.empty())))
                .isEqualTo(Polytope.empty());
    }

}
