package com.aasx.ingest.graph;

import com.aasx.ingest.core.model.QualityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FalkorDBConnection parameter rendering")
class FalkorDBConnectionTest {

    @Nested
    @DisplayName("formatValue")
    class FormatValue {

        @Test
        void scalars() {
            assertEquals("null", FalkorDBConnection.formatValue(null));
            assertEquals("42", FalkorDBConnection.formatValue(42));
            assertEquals("2.5", FalkorDBConnection.formatValue(2.5));
            assertEquals("true", FalkorDBConnection.formatValue(true));
            assertEquals("'HIGH'", FalkorDBConnection.formatValue(QualityLevel.HIGH));
        }

        @Test
        @DisplayName("Strings are quoted with quotes and backslashes escaped")
        void escapesStrings() {
            assertEquals("'it\\'s'", FalkorDBConnection.formatValue("it's"));
            assertEquals("'a\\\\b'", FalkorDBConnection.formatValue("a\\b"));
        }

        @Test
        @DisplayName("Maps render as Cypher map literals")
        void maps() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", "urn:x");
            map.put("count", 3);
            assertEquals("{id: 'urn:x', count: 3}", FalkorDBConnection.formatValue(map));
        }

        @Test
        @DisplayName("Map keys must be identifiers")
        void mapKeysValidated() {
            Map<String, Object> map = Map.of("bad key", 1);
            assertThrows(IllegalArgumentException.class, () -> FalkorDBConnection.formatValue(map));
        }

        @Test
        void lists() {
            assertEquals("['a', 'b']", FalkorDBConnection.formatValue(List.of("a", "b")));
            assertEquals("[1, null]", FalkorDBConnection.formatValue(Arrays.asList(1, null)));
        }
    }

    @Nested
    @DisplayName("processParams")
    class ProcessParams {

        @Test
        @DisplayName("Replaces known parameters only")
        void replacesKnown() {
            String query = "MATCH (n {id: $id}) WHERE n.kind = $kind RETURN n";
            assertEquals("MATCH (n {id: 'urn:x'}) WHERE n.kind = $kind RETURN n",
                    FalkorDBConnection.processParams(query, Map.of("id", "urn:x")));
        }

        @Test
        @DisplayName("Parameter names that prefix each other do not collide")
        void prefixNames() {
            Map<String, Object> params = Map.of("id", "a", "ids", List.of("b"));
            assertEquals("'a' ['b']", FalkorDBConnection.processParams("$id $ids", params));
        }

        @Test
        @DisplayName("Values containing $ are not substituted again")
        void singlePass() {
            Map<String, Object> params = Map.of("a", "$b", "b", "x");
            assertEquals("'$b' 'x'", FalkorDBConnection.processParams("$a $b", params));
        }

        @Test
        void emptyParamsLeaveQueryUnchanged() {
            assertEquals("RETURN $x", FalkorDBConnection.processParams("RETURN $x", Map.of()));
        }
    }
}
