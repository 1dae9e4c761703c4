package com.aasx.ingest.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelEnumsTest {

    @Test
    @DisplayName("Quality level follows the number of populated fields")
    void qualityLevels() {
        assertEquals(QualityLevel.LOW, QualityLevel.forPresentFields(0));
        assertEquals(QualityLevel.LOW, QualityLevel.forPresentFields(1));
        assertEquals(QualityLevel.MEDIUM, QualityLevel.forPresentFields(2));
        assertEquals(QualityLevel.MEDIUM, QualityLevel.forPresentFields(3));
        assertEquals(QualityLevel.HIGH, QualityLevel.forPresentFields(4));
    }

    @Test
    @DisplayName("Element labels round-trip and group shells with assets")
    void elementTypes() {
        assertEquals(ElementType.SHELL, ElementType.fromLabel("shell"));
        assertEquals("Submodel", ElementType.SUBMODEL.getLabel());
        assertTrue(ElementType.SHELL.isAssetGroup());
        assertTrue(ElementType.ASSET.isAssetGroup());
        assertFalse(ElementType.SUBMODEL.isAssetGroup());
        assertThrows(IllegalArgumentException.class, () -> ElementType.fromLabel("Property"));
    }

    @Test
    @DisplayName("Relationship types parse case-insensitively")
    void relationshipTypes() {
        assertEquals(RelationshipType.HAS_SUBMODEL, RelationshipType.parse(" has_submodel "));
        assertThrows(IllegalArgumentException.class, () -> RelationshipType.parse(""));
        assertThrows(IllegalArgumentException.class, () -> RelationshipType.parse("OWNS"));
    }

    @Test
    @DisplayName("Document reference derives file name and type tag")
    void documentRef() {
        DocumentRef ref = DocumentRef.fromEntryName("aasx/docs/Manual.PDF", 1024);
        assertEquals("Manual.PDF", ref.filename());
        assertEquals("pdf", ref.typeTag());
        assertEquals(1024, ref.sizeBytes());
    }
}
