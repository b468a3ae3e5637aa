package com.github.hycon.automaton;

import com.github.hycon.xml.ConXml;
import com.github.hycon.xml.FormatException;
import com.github.hycon.xml.XmlSerializer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stores an automaton as the {@code <aut>} element of a {@code tulipcon} document.
 *
 * <pre>
 * &lt;aut&gt;
 *   &lt;node&gt;
 *     &lt;id&gt;0&lt;/id&gt;&lt;name&gt;&lt;/name&gt;
 *     &lt;child_list&gt;1 2&lt;/child_list&gt;
 *     &lt;state&gt;&lt;item key="x" value="1"/&gt;&lt;/state&gt;
 *   &lt;/node&gt;
 * &lt;/aut&gt;
 * </pre>
 *
 * Reading requires the node ids to be exactly {@code 0..N-1}. A repeated id is reported and
 * only its first node is used.
 */
public final class AutomatonXml implements XmlSerializer<Automaton> {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonXml.class);

    public static final String TAG = "aut";

    @NotNull
    private final List<String> warnings = new ArrayList<>();

    @NotNull
    @Override
    public Element write(@NotNull Document document, @NotNull Automaton automaton) {
        final Element result = ConXml.element(document, TAG);
        for (AutomatonState state : automaton.getStates()) {
            final Element node = ConXml.element(document, "node");
            node.appendChild(ConXml.textElement(document, "id", String.valueOf(state.getId())));
            node.appendChild(ConXml.textElement(document, "name", ""));
            node.appendChild(ConXml.tagList(document, "child_list", state.getTransitions()));
            node.appendChild(ConXml.tagDict(document, "state", state.getState()));
            result.appendChild(node);
        }
        return result;
    }

    @NotNull
    @Override
    public Automaton read(@NotNull Element element) throws FormatException {
        warnings.clear();
        if (!TAG.equals(ConXml.localName(element))) {
            throw new FormatException("Expected <" + TAG + ">, got <" + ConXml.localName(element) + ">");
        }
        final Map<Integer, AutomatonState> nodes = new TreeMap<>();
        final VariableTable variables = new VariableTable();
        for (Element node : ConXml.children(element, "node")) {
            final int id = ConXml.parseInt(ConXml.requireChild(node, "id").getTextContent(), "node id");
            final List<Integer> children = ConXml.untagIntList(ConXml.requireChild(node, "child_list"));
            final Map<String, Integer> state = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : ConXml.untagDict(ConXml.requireChild(node, "state")).entrySet()) {
                state.put(entry.getKey(), ConXml.parseInt(entry.getValue(), "variable " + entry.getKey()));
            }
            if (nodes.containsKey(id)) {
                final String message = "Duplicate node " + id + ", ignoring it";
                LOG.warn(message);
                warnings.add(message);
                continue;
            }
            if (id < 0) {
                throw new FormatException("Negative node id " + id);
            }
            nodes.put(id, new AutomatonState(id, Valuation.of(variables, state), children));
        }
        for (int id=0; id < nodes.size(); id++) {
            if (!nodes.containsKey(id)) {
                throw new FormatException("Missing states in automaton, no node " + id);
            }
        }
        final Automaton result = new Automaton(variables);
        result.replaceStates(new ArrayList<>(nodes.values()));
        return result;
    }

    /**
     * Warnings of the last {@link #read} call.
     */
    @NotNull
    public List<String> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    /**
     * Read the automaton of a {@code tulipcon} document, null if the document has no
     * {@code <aut>} element. An {@code <aut>} without nodes is an automaton with no states.
     */
    @Nullable
    public static Automaton loadXML(@NotNull String xml) throws FormatException {
        final Element root = ConXml.openEnvelope(ConXml.parse(xml));
        final Element element = ConXml.child(root, TAG);
        if (element == null) {
            return null;
        }
        return new AutomatonXml().read(element);
    }

}
