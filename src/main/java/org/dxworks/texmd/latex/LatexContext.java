package org.dxworks.texmd.latex;

import java.util.HashMap;
import java.util.Map;

/**
 * Argument specs of the macros and environments {@link LatexWalker} knows about.
 *
 * <p>A spec is a string of argument slots read left to right: {@code *} an optional star,
 * {@code [} an optional bracketed argument, {@code {} a mandatory argument. Anything
 * missing from the tables takes no arguments.
 */
public final class LatexContext {

    private static final String SPEC_CHARS = "*[{";

    private static final Map<String, String> DEFAULT_MACROS = new HashMap<>();
    private static final Map<String, String> DEFAULT_ENVIRONMENTS = new HashMap<>();

    static {
        // Document structure
        DEFAULT_MACROS.put("documentclass", "[{");
        DEFAULT_MACROS.put("usepackage", "[{");
        DEFAULT_MACROS.put("title", "{");
        DEFAULT_MACROS.put("author", "{");
        DEFAULT_MACROS.put("date", "{");
        DEFAULT_MACROS.put("thanks", "{");
        for (String sectioning : new String[]{"part", "chapter", "section", "subsection",
                "subsubsection", "paragraph", "subparagraph"}) {
            DEFAULT_MACROS.put(sectioning, "*[{");
        }
        DEFAULT_MACROS.put("input", "{");
        DEFAULT_MACROS.put("include", "{");
        DEFAULT_MACROS.put("bibliography", "{");
        DEFAULT_MACROS.put("bibliographystyle", "{");

        // References
        DEFAULT_MACROS.put("label", "{");
        DEFAULT_MACROS.put("ref", "{");
        DEFAULT_MACROS.put("eqref", "{");
        DEFAULT_MACROS.put("pageref", "{");
        DEFAULT_MACROS.put("cite", "*[[{");
        DEFAULT_MACROS.put("footnote", "[{");
        DEFAULT_MACROS.put("caption", "[{");
        DEFAULT_MACROS.put("url", "{");
        DEFAULT_MACROS.put("href", "{{");
        DEFAULT_MACROS.put("includegraphics", "[{");
        DEFAULT_MACROS.put("item", "[");

        // Text and math fonts
        for (String font : new String[]{"textbf", "textit", "textsl", "textsc", "texttt", "textrm",
                "textsf", "emph", "underline", "mbox", "text", "mathrm", "mathbf", "mathit",
                "mathcal", "mathbb", "mathsf", "mathtt", "mathfrak", "operatorname"}) {
            DEFAULT_MACROS.put(font, "{");
        }
        DEFAULT_MACROS.put("frac", "{{");
        DEFAULT_MACROS.put("dfrac", "{{");
        DEFAULT_MACROS.put("tfrac", "{{");
        DEFAULT_MACROS.put("binom", "{{");
        DEFAULT_MACROS.put("sqrt", "[{");
        DEFAULT_MACROS.put("hspace", "*{");
        DEFAULT_MACROS.put("vspace", "*{");

        DEFAULT_ENVIRONMENTS.put("array", "[{");
        DEFAULT_ENVIRONMENTS.put("tabular", "[{");
        DEFAULT_ENVIRONMENTS.put("minipage", "[{");
        DEFAULT_ENVIRONMENTS.put("figure", "[");
        DEFAULT_ENVIRONMENTS.put("table", "[");
        DEFAULT_ENVIRONMENTS.put("thebibliography", "{");
    }

    private final Map<String, String> macros;
    private final Map<String, String> environments;

    private LatexContext(Map<String, String> macros, Map<String, String> environments) {
        this.macros = Map.copyOf(macros);
        this.environments = Map.copyOf(environments);
    }

    public static LatexContext defaultContext() {
        return new LatexContext(DEFAULT_MACROS, DEFAULT_ENVIRONMENTS);
    }

    /**
     * Returns a context with the given specs layered over this one's.
     */
    public LatexContext extendedWith(Map<String, String> extraMacros, Map<String, String> extraEnvironments) {
        Map<String, String> mergedMacros = new HashMap<>(macros);
        Map<String, String> mergedEnvironments = new HashMap<>(environments);
        putValid(mergedMacros, extraMacros);
        putValid(mergedEnvironments, extraEnvironments);
        return new LatexContext(mergedMacros, mergedEnvironments);
    }

    public String macroSpec(String macroName) {
        return macros.getOrDefault(macroName, "");
    }

    public String environmentSpec(String environmentName) {
        return environments.getOrDefault(environmentName, "");
    }

    public static boolean isValidSpec(String spec) {
        if (spec == null) return false;
        for (int i = 0; i < spec.length(); i++) {
            if (SPEC_CHARS.indexOf(spec.charAt(i)) < 0) return false;
        }
        return true;
    }

    private static void putValid(Map<String, String> target, Map<String, String> extra) {
        if (extra == null) return;
        for (Map.Entry<String, String> e : extra.entrySet()) {
            if (e.getKey() == null || !isValidSpec(e.getValue())) {
                throw new IllegalArgumentException("Invalid argument spec for " + e.getKey() + ": " + e.getValue());
            }
            target.put(e.getKey(), e.getValue());
        }
    }
}
