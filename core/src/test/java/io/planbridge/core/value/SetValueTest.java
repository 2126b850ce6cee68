// file: core/src/test/java/io/planbridge/core/value/SetValueTest.java
package io.planbridge.core.value;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.planbridge.core.value.ValueTree.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Content hashing and the canonical form of sets.
 */
class SetValueTest {

    @Test
    void hash_is_stable_and_independent_of_field_insertion_order() {
        var a = object("x", of(1), "y", of("s"));
        var b = object("y", of("s"), "x", of(1));

        assertEquals(ValueHasher.hashHex(a), ValueHasher.hashHex(b));
        assertEquals(64, ValueHasher.hashHex(a).length());
    }

    @Test
    void hash_distinguishes_types_and_ignores_absent_fields() {
        assertNotEquals(ValueHasher.hashHex(of("1")), ValueHasher.hashHex(of(1)));
        assertNotEquals(ValueHasher.hashHex(list(of("a"))), ValueHasher.hashHex(set(of("a"))));
        assertEquals(ValueHasher.hashHex(object("x", of(1))), ValueHasher.hashHex(object("x", of(1), "y", nil())));
    }

    @Test
    void hash_ignores_secret_bit() {
        assertEquals(ValueHasher.hashHex(of("p")), ValueHasher.hashHex(ValueTree.secret(of("p"))));
    }

    @Test
    void unknown_has_no_hash() {
        assertThrows(ValueHasher.UnhashableValueException.class, () -> ValueHasher.hash(unknown()));
    }

    @Test
    void permutations_and_duplicates_give_the_same_set() {
        var s1 = set(of("a"), of("b"), of("c"));
        var s2 = set(of("c"), of("a"), of("b"), of("a"));

        assertEquals(s1, s2);
        assertEquals(3, s2.size());
        assertTrue(Values.deepEquals(s1, s2));
    }

    @Test
    void secret_duplicate_wins_over_plain_one() {
        var s = SetValue.of(List.of(of("p"), ValueTree.secret(of("p"))));

        assertEquals(1, s.size());
        assertTrue(s.elements().get(0).secret());
    }

    @Test
    void elements_with_unknowns_are_kept_apart() {
        var s = set(of("a"), object("id", unknown()));

        assertTrue(s.hasUnknownElements());
        assertEquals(1, s.hashedElements().size());
        assertEquals(1, s.unhashedElements().size());
        assertTrue(Values.containsUnknowns(s));
    }

    @Test
    void deep_equals_ignores_secrets_and_missing_keys() {
        var plain = object("m", map(Map.of("k", of("v"))));
        var secret = object("m", map(Map.of("k", ValueTree.secret(of("v")))), "gone", nil());

        assertTrue(Values.deepEquals(plain, secret));
        assertTrue(Values.containsSecrets(secret));
        assertFalse(Values.containsSecrets(Values.stripSecrets(secret)));
    }
}
