package com.challenges.jtree.json;

import com.challenges.jtree.output.JsonPrinter;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * A single element of a JSON tree.
 * <p>
 * Containers ({@link JsonType#ARRAY} and {@link JsonType#OBJECT}) own an ordered
 * sequence of children. Object members carry their name in {@link #key()};
 * duplicate names are legal and lookups return the first case-insensitive match.
 * <p>
 * A node has at most one parent. To make one subtree appear under several
 * parents, insert a reference with {@link #appendReference} or
 * {@link #putReference}: the reference shares the target's children and payload,
 * so dropping the container that holds it leaves the target intact.
 * <p>
 * Not thread safe.
 */
public final class JsonNode implements Iterable<JsonNode> {
    private final JsonType type;
    private final boolean reference;
    private final double doubleValue;
    private final int intValue;
    private final String stringValue;
    private final MutableList<JsonNode> children;
    private String key;
    private JsonNode parent;
    // Node whose children a reference shares; null for an owning node.
    private JsonNode target;

    private JsonNode(JsonType type, double doubleValue, int intValue, String stringValue,
                     MutableList<JsonNode> children, boolean reference) {
        this.type = type;
        this.doubleValue = doubleValue;
        this.intValue = intValue;
        this.stringValue = stringValue;
        this.children = children;
        this.reference = reference;
    }

    private static JsonNode scalar(JsonType type) {
        return new JsonNode(type, 0, type == JsonType.TRUE ? 1 : 0, null, null, false);
    }

    // ============================================================
    // Construction
    // ============================================================

    public static JsonNode nullNode() {
        return scalar(JsonType.NULL);
    }

    public static JsonNode trueNode() {
        return scalar(JsonType.TRUE);
    }

    public static JsonNode falseNode() {
        return scalar(JsonType.FALSE);
    }

    public static JsonNode bool(boolean value) {
        return value ? trueNode() : falseNode();
    }

    public static JsonNode number(double value) {
        return new JsonNode(JsonType.NUMBER, value, (int) value, null, null, false);
    }

    public static JsonNode string(String value) {
        Objects.requireNonNull(value, "value");
        return new JsonNode(JsonType.STRING, 0, 0, value, null, false);
    }

    public static JsonNode array() {
        return new JsonNode(JsonType.ARRAY, 0, 0, null, Lists.mutable.empty(), false);
    }

    public static JsonNode object() {
        return new JsonNode(JsonType.OBJECT, 0, 0, null, Lists.mutable.empty(), false);
    }

    public static JsonNode intArray(int... numbers) {
        JsonNode result = array();
        for (int n : numbers) {
            result.link(number(n));
        }
        return result;
    }

    public static JsonNode floatArray(float... numbers) {
        JsonNode result = array();
        for (float n : numbers) {
            result.link(number(n));
        }
        return result;
    }

    public static JsonNode doubleArray(double... numbers) {
        JsonNode result = array();
        for (double n : numbers) {
            result.link(number(n));
        }
        return result;
    }

    public static JsonNode stringArray(String... strings) {
        JsonNode result = array();
        for (String s : strings) {
            result.link(string(s));
        }
        return result;
    }

    // ============================================================
    // Accessors
    // ============================================================

    public JsonType type() {
        return type;
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isContainer() {
        return type.isContainer();
    }

    public double doubleValue() {
        return doubleValue;
    }

    /**
     * The number truncated to an int. Only meaningful when the number is whole
     * and within int range.
     */
    public int intValue() {
        return intValue;
    }

    public String stringValue() {
        return stringValue;
    }

    public String key() {
        return key;
    }

    public JsonNode parent() {
        return parent;
    }

    public ListIterable<JsonNode> children() {
        return children == null ? Lists.immutable.empty() : children.asUnmodifiable();
    }

    @Override
    public Iterator<JsonNode> iterator() {
        return children().iterator();
    }

    public int size() {
        return children == null ? 0 : children.size();
    }

    public JsonNode nextSibling() {
        return sibling(1);
    }

    public JsonNode previousSibling() {
        return sibling(-1);
    }

    private JsonNode sibling(int offset) {
        if (parent == null) {
            return null;
        }
        int index = parent.children.indexOf(this) + offset;
        return index >= 0 && index < parent.children.size() ? parent.children.get(index) : null;
    }

    /**
     * @return the child at {@code index}, or null if there is none
     */
    public JsonNode get(int index) {
        if (children == null || index < 0 || index >= children.size()) {
            return null;
        }
        return children.get(index);
    }

    /**
     * @return the first member whose key matches ignoring ASCII case, or null
     */
    public JsonNode get(String key) {
        int index = indexOf(key);
        return index < 0 ? null : children.get(index);
    }

    public boolean has(String key) {
        return indexOf(key) >= 0;
    }

    private int indexOf(String key) {
        Objects.requireNonNull(key, "key");
        if (children == null) {
            return -1;
        }
        return children.detectIndex(child -> equalsIgnoreAsciiCase(key, child.key));
    }

    // Only A-Z fold; other letters must match exactly.
    static boolean equalsIgnoreAsciiCase(String a, String b) {
        if (b == null || a.length() != b.length()) {
            return false;
        }
        for (int i = 0; i < a.length(); i++) {
            if (toAsciiLower(a.charAt(i)) != toAsciiLower(b.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char toAsciiLower(char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
    }

    // ============================================================
    // Mutation
    // ============================================================

    /**
     * Appends {@code item} to this array. A null item is ignored.
     */
    public JsonNode append(JsonNode item) {
        requireType(JsonType.ARRAY);
        if (item != null) {
            checkInsertable(item);
            item.key = null;
            link(item);
        }
        return this;
    }

    /**
     * Appends {@code item} to this object under {@code key}. An existing member
     * with the same key is left in place. A null item is ignored.
     */
    public JsonNode put(String key, JsonNode item) {
        requireType(JsonType.OBJECT);
        Objects.requireNonNull(key, "key");
        if (item != null) {
            checkInsertable(item);
            item.key = key;
            link(item);
        }
        return this;
    }

    public JsonNode appendReference(JsonNode item) {
        Objects.requireNonNull(item, "item");
        return append(item.newReference());
    }

    public JsonNode putReference(String key, JsonNode item) {
        Objects.requireNonNull(item, "item");
        return put(key, item.newReference());
    }

    private JsonNode newReference() {
        JsonNode ref = new JsonNode(type, doubleValue, intValue, stringValue, children, true);
        ref.target = owner();
        return ref;
    }

    /**
     * The node that owns this node's children: itself, or the target of a reference.
     */
    private JsonNode owner() {
        return target == null ? this : target;
    }

    /**
     * Unlinks the child at {@code index} and hands it to the caller.
     *
     * @return the detached child, or null if there is none
     */
    public JsonNode detach(int index) {
        if (get(index) == null) {
            return null;
        }
        JsonNode removed = children.remove(index);
        removed.parent = null;
        removed.key = null;
        return removed;
    }

    public JsonNode detach(String key) {
        int index = indexOf(key);
        return index < 0 ? null : detach(index);
    }

    public void delete(int index) {
        detach(index);
    }

    public void delete(String key) {
        detach(key);
    }

    /**
     * Puts {@code newItem} in the slot held by the child at {@code index}, which is dropped.
     * Object members keep the replaced member's key. Does nothing if the slot does not exist.
     */
    public void replace(int index, JsonNode newItem) {
        Objects.requireNonNull(newItem, "newItem");
        JsonNode old = get(index);
        if (old == null) {
            return;
        }
        splice(index, old.key, newItem);
    }

    public void replace(String key, JsonNode newItem) {
        Objects.requireNonNull(newItem, "newItem");
        int index = indexOf(key);
        if (index < 0) {
            return;
        }
        splice(index, key, newItem);
    }

    private void splice(int index, String newKey, JsonNode newItem) {
        checkInsertable(newItem);
        newItem.key = type == JsonType.OBJECT ? newKey : null;
        newItem.parent = owner();
        JsonNode old = children.set(index, newItem);
        old.parent = null;
        old.key = null;
    }

    /**
     * Copies this node. The copy is never a reference and has no parent or key.
     *
     * @param recursive whether to copy the children too; if false, a container
     *                  is copied as an empty container of the same type
     */
    public JsonNode duplicate(boolean recursive) {
        JsonNode copy = new JsonNode(type, doubleValue, intValue, stringValue,
            children == null ? null : Lists.mutable.empty(), false);
        if (recursive && children != null) {
            for (JsonNode child : children) {
                JsonNode childCopy = child.duplicate(true);
                childCopy.key = child.key;
                copy.link(childCopy);
            }
        }
        return copy;
    }

    // Parser and bulk constructors build fresh subtrees and skip the insertion checks.
    void link(JsonNode child) {
        child.parent = owner();
        children.add(child);
    }

    void setKey(String key) {
        this.key = key;
    }

    private void requireType(JsonType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " but node is " + type);
        }
    }

    private void checkInsertable(JsonNode item) {
        if (item.parent != null) {
            throw new IllegalArgumentException("Node is already attached to a parent; detach it first");
        }
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(item);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            if (node == this || (node.children != null && node.children == children)) {
                throw new IllegalArgumentException("Inserting this node would create a cycle");
            }
            if (node.children != null) {
                node.children.each(pending::push);
            }
        }
    }

    // ============================================================
    // Comparison and rendering
    // ============================================================

    /**
     * Structural comparison: same types, values, child order and member keys.
     * The keys and reference flags of the two roots are not compared.
     */
    public boolean equivalentTo(JsonNode other) {
        if (other == null || type != other.type) {
            return false;
        }
        return switch (type) {
            case NUMBER -> Double.compare(doubleValue, other.doubleValue) == 0;
            case STRING -> stringValue.equals(other.stringValue);
            case ARRAY, OBJECT -> {
                if (size() != other.size()) {
                    yield false;
                }
                for (int i = 0; i < children.size(); i++) {
                    JsonNode mine = children.get(i);
                    JsonNode theirs = other.children.get(i);
                    if (!Objects.equals(mine.key, theirs.key) || !mine.equivalentTo(theirs)) {
                        yield false;
                    }
                }
                yield true;
            }
            default -> true;
        };
    }

    public String toPrettyString() {
        return new JsonPrinter(true).print(this);
    }

    @Override
    public String toString() {
        return new JsonPrinter(false).print(this);
    }
}
