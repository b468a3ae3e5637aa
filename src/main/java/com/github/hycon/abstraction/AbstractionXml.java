package com.github.hycon.abstraction;

import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import com.github.hycon.xml.ConXml;
import com.github.hycon.xml.FormatException;
import com.github.hycon.xml.XmlSerializer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores an abstraction as the {@code <d_dyn>} element of a {@code tulipcon} document.
 *
 * <pre>
 * &lt;d_dyn horizon="10"&gt;
 *   &lt;domain type="polytope"&gt;...&lt;/domain&gt;
 *   &lt;trans type="matrix" r="n" c="n"&gt;...&lt;/trans&gt;      only when computed
 *   &lt;adj type="matrix" r="n" c="n"&gt;...&lt;/adj&gt;
 *   &lt;prop_symbols&gt;a b&lt;/prop_symbols&gt;
 *   &lt;regions&gt;&lt;region&gt;...&lt;/region&gt;...&lt;/regions&gt;
 *   &lt;orig&gt;0 0 1&lt;/orig&gt;
 *   &lt;orig_regions&gt;&lt;region&gt;...&lt;/region&gt;...&lt;/orig_regions&gt;
 * &lt;/d_dyn&gt;
 * </pre>
 *
 * The horizon written is the one the transitions were computed with.
 */
public final class AbstractionXml implements XmlSerializer<AbstractionSystem> {

    public static final String TAG = "d_dyn";

    private final int horizon;

    public AbstractionXml(int horizon) {
        this.horizon = horizon;
    }

    public AbstractionXml(@NotNull AbstractionConfig config) {
        this(config.getHorizon());
    }

    @NotNull
    @Override
    public Element write(@NotNull Document document, @NotNull AbstractionSystem system) {
        final Partition partition = system.getPartition();
        final Element result = ConXml.element(document, TAG);
        result.setAttribute("horizon", String.valueOf(horizon));
        result.appendChild(ConXml.tagPolytope(document, "domain", partition.getDomain()));
        final boolean[][] transitions = system.getTransitions();
        if (transitions != null) {
            result.appendChild(ConXml.tagBooleanMatrix(document, "trans", transitions));
        }
        result.appendChild(ConXml.tagBooleanMatrix(document, "adj", partition.getAdjacency()));
        result.appendChild(ConXml.tagList(document, "prop_symbols", partition.getPropositionSymbols()));
        result.appendChild(regions(document, "regions", partition.getRegions()));
        final List<Integer> origin = new ArrayList<>();
        for (int o : system.getOrigin()) {
            origin.add(o);
        }
        result.appendChild(ConXml.tagList(document, "orig", origin));
        result.appendChild(regions(document, "orig_regions", system.getOriginalRegions()));
        return result;
    }

    @NotNull
    @Override
    public AbstractionSystem read(@NotNull Element element) throws FormatException {
        if (!TAG.equals(ConXml.localName(element))) {
            throw new FormatException("Expected <" + TAG + ">, got <" + ConXml.localName(element) + ">");
        }
        horizonOf(element);
        final Polytope domain = ConXml.untagPolytope(ConXml.requireChild(element, "domain"));
        final List<String> symbols = ConXml.untagList(ConXml.requireChild(element, "prop_symbols"));
        final List<Region> regions = regions(ConXml.child(element, "regions"));
        final int n = regions.size();

        final Element adjTag = ConXml.child(element, "adj");
        final boolean[][] adjacency = adjTag == null ? Matrices.identity(n) : ConXml.untagBooleanMatrix(adjTag);
        final Element transTag = ConXml.child(element, "trans");
        final boolean[][] transitions = transTag == null ? null : ConXml.untagBooleanMatrix(transTag);

        final Element origTag = ConXml.child(element, "orig");
        final int[] origin = new int[n];
        final List<Region> originalRegions;
        if (origTag == null) {
            for (int i=0; i < n; i++) {
                origin[i] = i;
            }
            originalRegions = regions;
        } else {
            final List<Integer> values = ConXml.untagIntList(origTag);
            if (values.size() != n) {
                throw new FormatException("<orig> has " + values.size() + " entries for " + n + " regions");
            }
            for (int i=0; i < n; i++) {
                origin[i] = values.get(i);
            }
            originalRegions = regions(ConXml.requireChild(element, "orig_regions"));
        }

        try {
            final Partition partition = new Partition(domain, regions, adjacency, symbols);
            return new AbstractionSystem(partition, origin, originalRegions, transitions);
        } catch (IllegalArgumentException e) {
            throw new FormatException("Inconsistent <" + TAG + ">: " + e.getMessage(), e);
        }
    }

    /**
     * Horizon length the stored transitions were computed with.
     */
    public static int horizonOf(@NotNull Element element) throws FormatException {
        if (!element.hasAttribute("horizon")) {
            throw new FormatException("Missing horizon length used for reachability computation");
        }
        return ConXml.parseInt(element.getAttribute("horizon"), "horizon");
    }

    /**
     * Complete {@code tulipcon} document holding only the abstraction.
     */
    @NotNull
    public String dumpXML(@NotNull AbstractionSystem system, boolean pretty) {
        final Document document = ConXml.newDocument();
        final Element root = ConXml.createEnvelope(document);
        root.appendChild(write(document, system));
        return ConXml.toXml(document, pretty);
    }

    /**
     * Read the abstraction of a {@code tulipcon} document, null if the document has none.
     */
    @Nullable
    public AbstractionSystem loadXML(@NotNull String xml) throws FormatException {
        final Element root = ConXml.openEnvelope(ConXml.parse(xml));
        final Element element = ConXml.child(root, TAG);
        if (element == null || ConXml.isBlank(element)) {
            return null;
        }
        return read(element);
    }

    @NotNull
    private static Element regions(@NotNull Document document, @NotNull String name, @NotNull List<Region> regions) {
        final Element result = ConXml.element(document, name);
        for (Region region : regions) {
            result.appendChild(ConXml.tagRegion(document, region));
        }
        return result;
    }

    @NotNull
    private static List<Region> regions(@Nullable Element element) throws FormatException {
        final List<Region> result = new ArrayList<>();
        if (element == null) return result;
        for (Element item : ConXml.children(element, "region")) {
            result.add(ConXml.untagRegion(item));
        }
        return result;
    }

}
