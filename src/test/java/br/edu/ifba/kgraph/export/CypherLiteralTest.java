package br.edu.ifba.kgraph.export;

import br.edu.ifba.kgraph.classify.ConceptKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CypherLiteralTest {

    @Test
    @DisplayName("Should render scalars")
    void testScalars() {
        assertEquals("null", CypherLiteral.render(null));
        assertEquals("42", CypherLiteral.render(42));
        assertEquals("1723862400123", CypherLiteral.render(1723862400123L));
        assertEquals("0.5", CypherLiteral.render(0.5));
        assertEquals("true", CypherLiteral.render(true));
        assertEquals("'temporal'", CypherLiteral.render(ConceptKey.TEMPORAL));
    }

    @Test
    @DisplayName("Should escape quotes, backslashes and control characters in strings")
    void testStringEscaping() {
        assertEquals("'it\\'s'", CypherLiteral.render("it's"));
        assertEquals("'a\\\\b'", CypherLiteral.render("a\\b"));
        assertEquals("'line\\nbreak\\ttab'", CypherLiteral.render("line\nbreak\ttab"));
        assertEquals("'猫'", CypherLiteral.render("猫"));
    }

    @Test
    @DisplayName("Should render nested lists and maps, quoting odd keys")
    void testCollections() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("baseId", "x");
        map.put("weird key", List.of(1, "two"));

        assertEquals("{baseId: 'x', `weird key`: [1, 'two']}", CypherLiteral.render(map));
        assertEquals("[]", CypherLiteral.render(List.of()));
    }

    @Test
    @DisplayName("Should reject values Cypher cannot express")
    void testUnsupported() {
        assertThrows(IllegalArgumentException.class, () -> CypherLiteral.render(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> CypherLiteral.render(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> CypherLiteral.render(new Object()));
    }
}
