package com.dotprint.core.definition;

import com.dotprint.core.attributes.ArrowType;
import com.dotprint.core.attributes.Attribute;
import com.dotprint.core.attributes.Attributes;
import com.dotprint.core.attributes.DirType;
import com.dotprint.core.attributes.Label;
import com.dotprint.core.attributes.Order;
import com.dotprint.core.attributes.Shape;
import com.dotprint.core.attributes.StyleItem;
import com.dotprint.core.attributes.StyleName;
import com.dotprint.core.model.DotEdge;
import com.dotprint.core.model.DotGraph;
import com.dotprint.core.model.DotNode;
import com.dotprint.core.printing.Printers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts a {@link GraphDefinition} into a typed {@link DotGraph}.
 *
 * <p>Well-known attribute names are mapped to typed attributes so that their values
 * are validated and printed in DOT's native syntax. Any other name is kept as a
 * free-text attribute and printed as a DOT string.
 *
 * <p>Labels wrapped in {@code <...>} are treated as HTML-like labels.
 */
public class DefinitionConverter {

    private static final Logger log = LoggerFactory.getLogger(DefinitionConverter.class);

    /**
     * Converts a definition.
     *
     * @param definition parsed definition
     * @return the graph model
     * @throws DefinitionException if a node, edge or attribute is invalid
     */
    public DotGraph convert(GraphDefinition definition) {
        List<DotNode> nodes = new ArrayList<>();
        if (definition.nodes() != null) {
            for (GraphDefinition.NodeDefinition node : definition.nodes()) {
                if (node == null || node.id() == null) {
                    throw new DefinitionException("Node without id");
                }
                nodes.add(new DotNode(node.id(), convertAttributes(node.attributes())));
            }
        }

        List<DotEdge> edges = new ArrayList<>();
        if (definition.edges() != null) {
            for (GraphDefinition.EdgeDefinition edge : definition.edges()) {
                if (edge == null || edge.from() == null || edge.to() == null) {
                    throw new DefinitionException("Edge requires both 'from' and 'to'");
                }
                edges.add(new DotEdge(edge.from(), edge.to(), convertAttributes(edge.attributes())));
            }
        }

        DotGraph graph = new DotGraph(
            Boolean.TRUE.equals(definition.strict()),
            !Boolean.FALSE.equals(definition.directed()),
            definition.name(),
            convertAttributes(definition.graph()),
            convertAttributes(definition.nodeDefaults()),
            convertAttributes(definition.edgeDefaults()),
            nodes,
            edges
        );
        log.debug("Converted definition '{}' into {} nodes and {} edges",
            definition.name(), nodes.size(), edges.size());
        return graph;
    }

    /**
     * Converts an attribute map, keeping its order.
     *
     * @param attributes attribute values by name (nullable)
     * @return the typed attributes
     * @throws DefinitionException if a value is invalid for its attribute
     */
    public List<Attribute<?>> convertAttributes(Map<String, Object> attributes) {
        if (attributes == null) {
            return List.of();
        }
        List<Attribute<?>> converted = new ArrayList<>();
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            converted.add(convertAttribute(entry.getKey(), entry.getValue()));
        }
        return converted;
    }

    /**
     * Converts a single attribute.
     *
     * @param name attribute name
     * @param value scalar or list value from the definition
     * @return the typed attribute
     * @throws DefinitionException if the value is invalid for the attribute
     */
    public Attribute<?> convertAttribute(String name, Object value) {
        if (value == null) {
            throw new DefinitionException("Attribute '" + name + "' has no value");
        }
        try {
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "label" -> Attributes.toLabel(label(scalar(value)));
                case "xlabel" -> Attributes.xLabel(label(scalar(value)));
                case "forcelabels" -> new Attribute<>("forcelabels", bool(scalar(value)), Printers.BOOLEAN);
                case "color" -> Attributes.colors(ColorParser.parseList(joined(value, ":")));
                case "bgcolor" -> Attributes.bgColor(ColorParser.parse(scalar(value)));
                case "fillcolor" -> Attributes.fillColor(ColorParser.parse(scalar(value)));
                case "fontcolor" -> Attributes.fontColor(ColorParser.parse(scalar(value)));
                case "pencolor" -> Attributes.penColor(ColorParser.parse(scalar(value)));
                case "colorscheme" -> Attributes.colorScheme(ColorParser.parseScheme(scalar(value)));
                case "penwidth" -> Attributes.penWidth(Double.parseDouble(scalar(value).trim()));
                case "style" -> Attributes.styles(styles(joined(value, ",")));
                case "shape" -> Attributes.shape(Shape.fromDotName(scalar(value).trim()));
                case "arrowhead" -> Attributes.arrowTo(ArrowType.fromDotName(scalar(value).trim()));
                case "arrowtail" -> Attributes.arrowFrom(ArrowType.fromDotName(scalar(value).trim()));
                case "dir" -> Attributes.edgeEnds(DirType.fromDotName(scalar(value).trim()));
                case "ordering" -> Attributes.ordering(Order.fromDotName(scalar(value).trim()));
                default -> Attributes.custom(name, scalar(value));
            };
        } catch (IllegalArgumentException e) {
            throw new DefinitionException(
                "Invalid value for attribute '" + name + "': " + value + " (" + e.getMessage() + ")", e);
        }
    }

    private static Label label(String text) {
        if (text.length() >= 2 && text.startsWith("<") && text.endsWith(">")) {
            return Label.html(text.substring(1, text.length() - 1));
        }
        return Label.text(text);
    }

    private static boolean bool(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException("not a boolean: " + text);
        };
    }

    /**
     * Parses a style list such as {@code filled,rounded} or {@code dashed, setlinewidth(2)}.
     * Commas inside parentheses separate arguments, not styles.
     */
    private static List<StyleItem> styles(String text) {
        List<StyleItem> items = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            char c = i < text.length() ? text.charAt(i) : ',';
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                items.add(styleItem(text.substring(start, i).trim()));
                start = i + 1;
            }
        }
        return items;
    }

    private static StyleItem styleItem(String text) {
        int open = text.indexOf('(');
        if (open < 0) {
            return StyleItem.of(StyleName.fromDotName(text));
        }
        if (!text.endsWith(")")) {
            throw new IllegalArgumentException("unbalanced style arguments: " + text);
        }
        String args = text.substring(open + 1, text.length() - 1);
        List<String> arguments = args.isBlank()
            ? List.of()
            : Arrays.stream(args.split(",")).map(String::trim).toList();
        return new StyleItem(StyleName.fromDotName(text.substring(0, open).trim()), arguments);
    }

    private static String scalar(Object value) {
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            throw new IllegalArgumentException("expected a single value");
        }
        return String.valueOf(value);
    }

    private static String joined(Object value, String separator) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(DefinitionConverter::scalar).collect(Collectors.joining(separator));
        }
        return scalar(value);
    }
}
