package org.dxworks.texmd.convert;

import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexNodeKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a (kind, name) key to the converter that handles it. Lookup is exact: there is
 * no fallback for unregistered macros or environments.
 */
public final class ConverterRegistry {

    public static final List<String> EQUATION_ENVIRONMENTS =
            List.of("equation", "align", "array", "eqnarray", "multline", "matrix", "split");

    private final Map<ConverterKey, Converter> converters;

    private ConverterRegistry(Map<ConverterKey, Converter> converters) {
        this.converters = Collections.unmodifiableMap(converters);
    }

    public static ConverterRegistry defaultRegistry() {
        Map<ConverterKey, Converter> converters = new HashMap<>();
        converters.put(ConverterKey.of(TexNodeKind.GROUP), new GroupNodeConverter());
        converters.put(ConverterKey.of(TexNodeKind.TEXT), new TextNodeConverter());
        converters.put(ConverterKey.of(TexNodeKind.SPECIALS), new SpecialsNodeConverter());
        converters.put(ConverterKey.of(TexNodeKind.MATH), new MathNodeConverter());

        converters.put(ConverterKey.of(TexNodeKind.MACRO, "author"), new AuthorConverter());
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "title"), new HeadingConverter(1));
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "section"), new HeadingConverter(2));
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "subsection"), new HeadingConverter(3));
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "subsubsection"), new HeadingConverter(4));

        converters.put(ConverterKey.of(TexNodeKind.ENVIRONMENT, "abstract"), new AbstractConverter());

        RefConverter ref = new RefConverter();
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "ref"), ref);
        converters.put(ConverterKey.of(TexNodeKind.MACRO, "eqref"), ref);

        EquationConverter equation = new EquationConverter();
        for (String name : EQUATION_ENVIRONMENTS) {
            converters.put(ConverterKey.of(TexNodeKind.ENVIRONMENT, name), equation);
            converters.put(ConverterKey.of(TexNodeKind.ENVIRONMENT, name + "*"), equation);
        }
        return new ConverterRegistry(converters);
    }

    public Optional<Converter> converterFor(ConverterKey key) {
        return Optional.ofNullable(converters.get(key));
    }

    public Optional<Converter> converterFor(TexNode node) {
        return converterFor(ConverterKey.of(node));
    }

    public boolean isRegistered(ConverterKey key) {
        return converters.containsKey(key);
    }
}
