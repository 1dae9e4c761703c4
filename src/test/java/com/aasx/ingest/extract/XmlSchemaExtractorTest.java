package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;
import com.aasx.ingest.testutil.ContainerFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XmlSchemaExtractor")
class XmlSchemaExtractorTest {

    private final XmlSchemaExtractor extractor = new XmlSchemaExtractor();

    private EntryExtraction extract(String xml) {
        return extractor.extract(xml.getBytes(StandardCharsets.UTF_8), "aasx/pump.aas.xml");
    }

    private static List<RawRecord> ofType(EntryExtraction extraction, ElementType type) {
        return extraction.records().stream().filter(r -> r.elementType() == type).toList();
    }

    @Nested
    @DisplayName("Namespaced documents")
    class Namespaced {

        @Test
        @DisplayName("Reads shells, assets and submodels")
        void readsAllTypes() {
            EntryExtraction extraction = extract(ContainerFixtures.SIMPLE_XML);

            assertTrue(extraction.isSuccess());
            assertEquals(OriginFormat.XML_V1, extraction.format());
            assertEquals(1, ofType(extraction, ElementType.SHELL).size());
            assertEquals(1, ofType(extraction, ElementType.ASSET).size());
            assertEquals(1, ofType(extraction, ElementType.SUBMODEL).size());
        }

        @Test
        @DisplayName("Shell carries category, description and references")
        void shellFields() {
            XmlRawRecord shell = (XmlRawRecord) ofType(extract(ContainerFixtures.SIMPLE_XML), ElementType.SHELL).get(0);

            assertEquals(Optional.of("urn:x:shell"), shell.identity());
            assertEquals(Optional.of("Pump"), shell.shortName());
            assertEquals(Optional.of("CONSTANT"), shell.kind());
            assertEquals("Water pump", DescriptionResolver.resolve(shell.description()));
            assertEquals(List.of("urn:x:sm"), shell.submodelRefs());
            assertEquals(Optional.of("urn:x:asset"), shell.assetRef());
        }

        @Test
        @DisplayName("Duplicate identities within a type are skipped with a warning")
        void duplicateIdentity() {
            EntryExtraction extraction = extract("""
                    <aas:aasenv xmlns:aas="http://www.admin-shell.io/aas/1/0">
                      <aas:submodels>
                        <aas:submodel><aas:idShort>A</aas:idShort><aas:identification>sm</aas:identification></aas:submodel>
                        <aas:submodel><aas:idShort>B</aas:idShort><aas:identification>sm</aas:identification></aas:submodel>
                      </aas:submodels>
                    </aas:aasenv>
                    """);

            List<RawRecord> submodels = ofType(extraction, ElementType.SUBMODEL);
            assertEquals(1, submodels.size());
            assertEquals(Optional.of("A"), submodels.get(0).shortName());
            assertTrue(extraction.warnings().stream().anyMatch(w -> w.message().contains("duplicate")));
        }

        @Test
        @DisplayName("Schema-instance attributes do not disturb extraction")
        void schemaInstanceAttributes() {
            EntryExtraction extraction = extract("""
                    <aas:aasenv xmlns:aas="http://www.admin-shell.io/aas/1/0"
                                xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                                xsi:schemaLocation="http://www.admin-shell.io/aas/1/0 AAS.xsd">
                      <aas:submodels>
                        <aas:submodel xsi:type="aas:submodel_t">
                          <aas:idShort>Nameplate</aas:idShort>
                          <aas:identification idType="URI">urn:x:sm</aas:identification>
                          <aas:kind>Instance</aas:kind>
                        </aas:submodel>
                      </aas:submodels>
                    </aas:aasenv>
                    """);

            List<RawRecord> submodels = ofType(extraction, ElementType.SUBMODEL);
            assertEquals(1, submodels.size());
            assertEquals(Optional.of("urn:x:sm"), submodels.get(0).identity());
            assertEquals(Optional.of("Instance"), submodels.get(0).kind());
            assertTrue(extraction.warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("Namespace fallback")
    class Fallback {

        @Test
        @DisplayName("Unqualified elements are found when the namespace is absent")
        void unqualified() {
            EntryExtraction extraction = extract("""
                    <aasenv>
                      <assetAdministrationShells>
                        <assetAdministrationShell>
                          <idShort>Plain</idShort>
                          <identification>urn:plain</identification>
                        </assetAdministrationShell>
                      </assetAdministrationShells>
                    </aasenv>
                    """);

            List<RawRecord> shells = ofType(extraction, ElementType.SHELL);
            assertEquals(1, shells.size());
            assertEquals(Optional.of("urn:plain"), shells.get(0).identity());
        }

        @Test
        @DisplayName("Elements in an unexpected namespace are matched by local name")
        void foreignNamespace() {
            EntryExtraction extraction = extract("""
                    <x:aasenv xmlns:x="http://example.com/aas/2/0">
                      <x:submodels>
                        <x:submodel>
                          <x:idShort>Foreign</x:idShort>
                          <x:identification>urn:foreign</x:identification>
                          <x:description><x:langString lang="de">Fremd</x:langString></x:description>
                        </x:submodel>
                      </x:submodels>
                    </x:aasenv>
                    """);

            RawRecord submodel = ofType(extraction, ElementType.SUBMODEL).get(0);
            assertEquals(Optional.of("urn:foreign"), submodel.identity());
            assertEquals("Fremd", DescriptionResolver.resolve(submodel.description()));
        }

        @Test
        @DisplayName("Description without langString children is plain text")
        void plainDescription() {
            EntryExtraction extraction = extract("""
                    <aasenv><submodels><submodel>
                      <identification>sm</identification><idShort>S</idShort>
                      <description>  just text  </description>
                    </submodel></submodels></aasenv>
                    """);

            RawRecord submodel = ofType(extraction, ElementType.SUBMODEL).get(0);
            assertEquals("just text", DescriptionResolver.resolve(submodel.description()));
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("Malformed XML is an entry failure")
        void malformed() {
            EntryExtraction extraction = extract("<aasenv><submodels></aasenv>");
            assertFalse(extraction.isSuccess());
            assertTrue(extraction.failureMessage().startsWith("Malformed XML"));
        }

        @Test
        @DisplayName("DOCTYPE declarations are rejected")
        void doctypeRejected() {
            EntryExtraction extraction = extract("""
                    <?xml version="1.0"?>
                    <!DOCTYPE aasenv [<!ENTITY x "boom">]>
                    <aasenv>&x;</aasenv>
                    """);
            assertFalse(extraction.isSuccess());
        }

        @Test
        @DisplayName("Missing identification is warned about")
        void missingIdentification() {
            EntryExtraction extraction = extract("""
                    <aasenv><assets><asset><idShort>NoId</idShort></asset></assets></aasenv>
                    """);

            RawRecord asset = ofType(extraction, ElementType.ASSET).get(0);
            assertTrue(asset.identity().isEmpty());
            assertTrue(extraction.warnings().stream().anyMatch(w -> "identification".equals(w.field())));
        }
    }
}
