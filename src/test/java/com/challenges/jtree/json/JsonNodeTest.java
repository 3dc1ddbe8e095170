package com.challenges.jtree.json;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.challenges.jtree.json.JsonNode.*;
import static org.junit.jupiter.api.Assertions.*;

public class JsonNodeTest {

    private static List<String> strings(JsonNode array) {
        List<String> result = new ArrayList<>();
        for (JsonNode element : array) {
            result.add(element.stringValue());
        }
        return result;
    }

    // ============================================================
    // Construction
    // ============================================================

    @Test
    public void testScalarConstructors() {
        assertEquals(JsonType.NULL, nullNode().type());
        assertEquals(JsonType.TRUE, bool(true).type());
        assertEquals(JsonType.FALSE, bool(false).type());
        assertEquals(JsonType.STRING, string("x").type());
        assertEquals("x", string("x").stringValue());
        assertNull(number(1).stringValue());
        assertEquals(0, string("x").size());
        assertFalse(string("x").isContainer());
    }

    @Test
    public void testNumberKeepsDoubleAndTruncatedInt() {
        JsonNode n = number(3.9);
        assertEquals(3.9, n.doubleValue());
        assertEquals(3, n.intValue());
        assertEquals(-7, number(-7.2).intValue());
    }

    @Test
    public void testBulkConstructors() {
        assertEquals("[1,2,3]", intArray(1, 2, 3).toString());
        assertEquals("[1.500000,0.250000]", floatArray(1.5f, 0.25f).toString());
        assertEquals("[-1,2.500000]", doubleArray(-1, 2.5).toString());
        assertEquals("[\"a\",\"b\"]", stringArray("a", "b").toString());
        assertEquals("[]", intArray().toString());
    }

    @Test
    public void testStringRejectsNull() {
        assertThrows(NullPointerException.class, () -> string(null));
    }

    // ============================================================
    // Arrays
    // ============================================================

    @Test
    public void testAppendThenDetachMiddle() {
        JsonNode array = array()
            .append(string("a"))
            .append(string("b"))
            .append(string("c"));

        JsonNode removed = array.detach(1);

        assertEquals("b", removed.stringValue());
        assertNull(removed.parent());
        assertNull(removed.nextSibling());
        assertEquals(List.of("a", "c"), strings(array));

        JsonNode first = array.get(0);
        JsonNode last = array.get(1);
        assertSame(last, first.nextSibling());
        assertSame(first, last.previousSibling());
        assertNull(first.previousSibling());
        assertNull(last.nextSibling());
        assertSame(array, first.parent());
    }

    @Test
    public void testDetachHead() {
        JsonNode array = stringArray("a", "b");
        assertEquals("a", array.detach(0).stringValue());
        assertEquals(List.of("b"), strings(array));
        assertNull(array.get(0).previousSibling());
    }

    @Test
    public void testAbsentIndexIsNotAnError() {
        JsonNode array = intArray(1, 2);
        assertEquals(2, array.size());
        assertNull(array.get(2));
        assertNull(array.get(-1));
        assertNull(array.detach(5));
        assertNull(number(1).get(0));
        assertNull(number(1).detach(0));
        assertEquals(2, array.size());
    }

    @Test
    public void testAppendNullIsIgnored() {
        JsonNode array = array().append(null);
        assertEquals(0, array.size());
    }

    @Test
    public void testDelete() {
        JsonNode array = intArray(1, 2, 3);
        array.delete(0);
        assertEquals("[2,3]", array.toString());
    }

    @Test
    public void testReplaceInArray() {
        JsonNode array = intArray(1, 2, 3);
        JsonNode old = array.get(1);
        array.replace(1, string("x"));
        assertEquals("[1,\"x\",3]", array.toString());
        assertNull(old.parent());
        assertSame(array, array.get(1).parent());
        assertSame(array.get(2), array.get(1).nextSibling());
    }

    @Test
    public void testReplaceOutOfRangeDoesNothing() {
        JsonNode array = intArray(1);
        JsonNode replacement = string("x");
        array.replace(3, replacement);
        assertEquals("[1]", array.toString());
        assertNull(replacement.parent());
    }

    @Test
    public void testChildrenAreReadOnly() {
        JsonNode array = intArray(1, 2);
        assertEquals(2, array.children().size());
        assertThrows(UnsupportedOperationException.class, () -> {
            var iterator = array.iterator();
            iterator.next();
            iterator.remove();
        });
    }

    // ============================================================
    // Objects
    // ============================================================

    @Test
    public void testPutAndCaseInsensitiveLookup() {
        JsonNode object = object()
            .put("Name", string("John"))
            .put("age", number(30));

        assertEquals("John", object.get("name").stringValue());
        assertEquals("John", object.get("NAME").stringValue());
        assertEquals("Name", object.get("name").key());
        assertTrue(object.has("AGE"));
        assertFalse(object.has("missing"));
        assertNull(object.get("missing"));
    }

    @Test
    public void testLookupFoldsOnlyAsciiLetters() {
        JsonNode object = object()
            .put("\u00c9t\u00e9", number(1))
            .put("\u017f", number(2))
            .put("\u212a", number(3))
            .put("Mixed", number(4));

        assertNull(object.get("\u00e9t\u00e9"));
        assertNull(object.get("s"));
        assertNull(object.get("k"));
        assertFalse(object.has("S"));
        assertNull(object.detach("k"));
        assertEquals(1, object.get("\u00c9T\u00e9").intValue());
        assertEquals(4, object.get("mIXED").intValue());
        assertEquals(4, object.size());
    }

    @Test
    public void testPutDuplicateKeyKeepsBoth() {
        JsonNode object = object()
            .put("a", number(1))
            .put("a", number(2));
        assertEquals(2, object.size());
        assertEquals(1, object.get("a").intValue());
        assertEquals("{\"a\":1,\"a\":2}", object.toString());
    }

    @Test
    public void testPutOverwritesItemKey() {
        JsonNode object = object();
        JsonNode detached = object().put("old", number(1)).detach("old");
        assertNull(detached.key());
        object.put("new", detached);
        assertEquals("new", detached.key());
    }

    @Test
    public void testDetachAndDeleteByKey() {
        JsonNode object = object()
            .put("a", number(1))
            .put("b", number(2))
            .put("c", number(3));

        JsonNode b = object.detach("B");
        assertEquals(2, b.intValue());
        assertNull(b.key());
        assertNull(object.detach("b"));

        object.delete("A");
        assertEquals("{\"c\":3}", object.toString());
    }

    @Test
    public void testReplaceInObjectUsesGivenKey() {
        JsonNode object = object()
            .put("a", number(1))
            .put("b", number(2));
        object.replace("B", trueNode());
        assertEquals("{\"a\":1,\"B\":true}", object.toString());
    }

    @Test
    public void testReplaceByIndexInObjectKeepsKey() {
        JsonNode object = object().put("a", number(1));
        object.replace(0, falseNode());
        assertEquals("{\"a\":false}", object.toString());
    }

    @Test
    public void testReplaceMissingKeyDoesNothing() {
        JsonNode object = object().put("a", number(1));
        object.replace("z", nullNode());
        assertEquals("{\"a\":1}", object.toString());
    }

    @Test
    public void testAppendToArrayClearsKey() {
        JsonNode member = object().put("k", number(1)).detach(0);
        JsonNode array = array().append(member);
        assertNull(array.get(0).key());
    }

    // ============================================================
    // Misuse
    // ============================================================

    @Test
    public void testWrongContainerType() {
        assertThrows(IllegalStateException.class, () -> object().append(number(1)));
        assertThrows(IllegalStateException.class, () -> array().put("a", number(1)));
        assertThrows(IllegalStateException.class, () -> number(1).append(number(2)));
    }

    @Test
    public void testAttachedNodeCannotBeInsertedTwice() {
        JsonNode child = number(1);
        array().append(child);
        assertThrows(IllegalArgumentException.class, () -> array().append(child));
    }

    @Test
    public void testCyclesAreRejected() {
        JsonNode outer = array();
        JsonNode inner = array();
        outer.append(inner);

        assertThrows(IllegalArgumentException.class, () -> outer.append(outer));
        JsonNode root = array().append(outer.detach(0));
        assertThrows(IllegalArgumentException.class, () -> root.get(0).append(root));
    }

    @Test
    public void testReferenceToSelfIsRejected() {
        JsonNode array = intArray(1);
        assertThrows(IllegalArgumentException.class, () -> array.appendReference(array));
    }

    // ============================================================
    // References
    // ============================================================

    @Test
    public void testReferenceSharesChildren() {
        JsonNode shared = object().put("x", number(1));
        JsonNode holder = array().appendReference(shared);

        JsonNode ref = holder.get(0);
        assertTrue(ref.isReference());
        assertFalse(shared.isReference());
        assertEquals(1, ref.get("x").intValue());

        shared.put("y", number(2));
        assertEquals("[{\"x\":1,\"y\":2}]", holder.toString());
    }

    @Test
    public void testDroppingReferenceLeavesTargetIntact() {
        JsonNode shared = object().put("x", stringArray("a", "b"));
        JsonNode holder = object().putReference("alias", shared);
        assertEquals("alias", holder.get(0).key());
        assertNull(shared.key());

        holder.delete("alias");

        assertEquals(0, holder.size());
        assertEquals("{\"x\":[\"a\",\"b\"]}", shared.toString());
        assertSame(shared, shared.get("x").parent());
    }

    @Test
    public void testEditsThroughReferenceAreOwnedByTarget() {
        JsonNode target = intArray(1, 2);
        JsonNode ref = array().appendReference(target).get(0);

        ref.replace(0, string("x"));
        ref.append(number(3));

        assertEquals("[\"x\",2,3]", target.toString());
        assertSame(target, target.get(0).parent());
        assertSame(target, target.get(2).parent());
        assertSame(target.get(1), target.get(0).nextSibling());
    }

    @Test
    public void testReferenceToReferenceSharesOriginalOwner() {
        JsonNode target = object();
        JsonNode first = array().appendReference(target).get(0);
        JsonNode second = array().appendReference(first).get(0);

        second.put("k", nullNode());

        assertSame(target, target.get("k").parent());
        assertEquals("{\"k\":null}", first.toString());
    }

    @Test
    public void testSameNodeUnderSeveralParents() {
        JsonNode shared = string("s");
        JsonNode first = array().appendReference(shared);
        JsonNode second = array().appendReference(shared);
        assertEquals("[\"s\"]", first.toString());
        assertEquals("[\"s\"]", second.toString());
        assertNull(shared.parent());
    }

    // ============================================================
    // Duplication
    // ============================================================

    @Test
    public void testRecursiveDuplicateIsIndependent() {
        JsonNode original = object()
            .put("a", intArray(1, 2))
            .put("b", string("s"));

        JsonNode copy = original.duplicate(true);
        assertTrue(copy.equivalentTo(original));
        assertNotSame(original.get("a"), copy.get("a"));
        assertSame(copy, copy.get("a").parent());

        copy.get("a").append(number(3));
        copy.delete("b");
        assertEquals("{\"a\":[1,2],\"b\":\"s\"}", original.toString());
        assertEquals("{\"a\":[1,2,3]}", copy.toString());
    }

    @Test
    public void testShallowDuplicateHasNoChildren() {
        JsonNode copy = intArray(1, 2).duplicate(false);
        assertEquals(JsonType.ARRAY, copy.type());
        assertEquals(0, copy.size());
    }

    @Test
    public void testDuplicateClearsReferenceFlag() {
        JsonNode shared = intArray(1, 2);
        JsonNode ref = array().appendReference(shared).get(0);

        JsonNode copy = ref.duplicate(true);
        assertFalse(copy.isReference());
        assertNull(copy.parent());
        copy.append(number(3));
        assertEquals("[1,2]", shared.toString());
    }

    @Test
    public void testDuplicateOfMemberHasNoKey() {
        JsonNode member = object().put("k", string("v")).get("k");
        JsonNode copy = member.duplicate(true);
        assertNull(copy.key());
        assertEquals("v", copy.stringValue());
    }

    @Test
    public void testEquivalence() {
        assertTrue(intArray(1, 2).equivalentTo(doubleArray(1.0, 2.0)));
        assertFalse(intArray(1, 2).equivalentTo(intArray(2, 1)));
        assertFalse(object().put("a", number(1)).equivalentTo(object().put("b", number(1))));
        assertFalse(nullNode().equivalentTo(falseNode()));
        assertFalse(nullNode().equivalentTo(null));
    }
}
