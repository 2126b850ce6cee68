package io.planbridge.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrnTest {

    @Test
    void parses_four_parts() {
        Urn urn = Urn.parse("urn:dev::demo::prov:index/test:Test::res");

        assertEquals("dev", urn.stack());
        assertEquals("demo", urn.project());
        assertEquals("prov:index/test:Test", urn.type());
        assertEquals("res", urn.name());
        assertEquals("urn:dev::demo::prov:index/test:Test::res", urn.toString());
    }

    @Test
    void name_may_contain_separator() {
        Urn urn = Urn.parse("urn:dev::demo::prov:index/test:Test::a::b");

        assertEquals("a::b", urn.name());
    }

    @Test
    void rejects_malformed_text() {
        assertThrows(IllegalArgumentException.class, () -> Urn.parse("dev::demo::t::n"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse("urn:dev::demo::t"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse("urn:dev::demo::::n"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse(null));
    }
}
