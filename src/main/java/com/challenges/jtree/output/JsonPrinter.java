package com.challenges.jtree.output;

import com.challenges.jtree.json.JsonNode;
import org.eclipse.collections.api.list.ListIterable;

import java.util.Comparator;

/**
 * Renders a {@link JsonNode} tree as JSON text.
 * <p>
 * Pretty output puts each object member on its own line, indented with one tab
 * per nesting level, with a space after the colon. Arrays stay on one line with
 * {@code ", "} between elements. Compact output has no whitespace at all.
 * Printing never modifies the tree.
 */
public class JsonPrinter {
    private static final Comparator<JsonNode> BY_KEY =
        Comparator.comparing(JsonNode::key, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final boolean prettyPrint;
    private final boolean sortKeys;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public JsonPrinter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    /**
     * @param sortKeys emit object members in key order instead of insertion order
     */
    public JsonPrinter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String print(JsonNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        printValue(node, 0, sb);

        return sb.toString();
    }

    private void printValue(JsonNode node, int depth, StringBuilder sb) {
        switch (node.type()) {
            case NULL -> sb.append("null");
            case FALSE -> sb.append("false");
            case TRUE -> sb.append("true");
            case NUMBER -> sb.append(NumberText.format(node.doubleValue(), node.intValue()));
            case STRING -> appendString(node.stringValue(), sb);
            case ARRAY -> printArray(node, depth, sb);
            case OBJECT -> printObject(node, depth, sb);
        }
    }

    private void printArray(JsonNode array, int depth, StringBuilder sb) {
        if (array.size() == 0) {
            sb.append("[]");
            return;
        }

        sb.append('[');

        boolean first = true;
        for (JsonNode element : array) {
            if (!first) {
                sb.append(',');
                if (prettyPrint) {
                    sb.append(' ');
                }
            }
            first = false;

            printValue(element, depth + 1, sb);
        }

        sb.append(']');
    }

    private void printObject(JsonNode object, int depth, StringBuilder sb) {
        if (object.size() == 0) {
            sb.append('{');
            if (prettyPrint) {
                sb.append('\n');
                indent(depth - 1, sb);
            }
            sb.append('}');
            return;
        }

        int memberDepth = depth + 1;
        sb.append('{');
        if (prettyPrint) {
            sb.append('\n');
        }

        ListIterable<JsonNode> members = sortKeys
            ? object.children().toSortedList(BY_KEY)
            : object.children();

        for (int i = 0; i < members.size(); i++) {
            JsonNode member = members.get(i);
            if (prettyPrint) {
                indent(memberDepth, sb);
            }
            appendString(member.key() == null ? "" : member.key(), sb);
            sb.append(':');
            if (prettyPrint) {
                sb.append(' ');
            }
            printValue(member, memberDepth, sb);
            if (i != members.size() - 1) {
                sb.append(',');
            }
            if (prettyPrint) {
                sb.append('\n');
            }
        }

        if (prettyPrint) {
            indent(memberDepth - 1, sb);
        }
        sb.append('}');
    }

    private static void indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append('\t');
        }
    }

    private static void appendString(String s, StringBuilder sb) {
        sb.append('"');

        // Fast path: if no escaping needed, append as is
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == '\\' || c == '"') {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            sb.append(s).append('"');
            return;
        }

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
