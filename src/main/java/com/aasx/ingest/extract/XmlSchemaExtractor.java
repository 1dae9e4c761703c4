package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extractor for the legacy namespaced XML metadata generation.
 *
 * <p>Shells ({@code assetAdministrationShell}), assets ({@code asset}) and submodels
 * ({@code submodel}) are discovered independently. Every element and field lookup goes
 * through an {@link XmlLookupChain}: qualified in the AAS namespace first, then unqualified,
 * then by local name in any namespace. Language strings also accept the IEC 61360 namespace.</p>
 *
 * <p>Shell kind is read from {@code category}; asset and submodel kind from {@code kind}.</p>
 */
public class XmlSchemaExtractor implements SchemaExtractor {
    private static final Logger log = LoggerFactory.getLogger(XmlSchemaExtractor.class);

    private static final Map<ElementType, String> ELEMENT_NAMES = Map.of(
            ElementType.SHELL, "assetAdministrationShell",
            ElementType.ASSET, "asset",
            ElementType.SUBMODEL, "submodel"
    );

    private final XmlLookupChain elementChain;
    private final XmlLookupChain langStringChain;

    public XmlSchemaExtractor() {
        this(XmlLookupChain.withFallback(AasNamespaces.AAS_V1),
                XmlLookupChain.withFallback(AasNamespaces.AAS_V1, AasNamespaces.IEC61360_V1));
    }

    public XmlSchemaExtractor(XmlLookupChain elementChain, XmlLookupChain langStringChain) {
        this.elementChain = elementChain;
        this.langStringChain = langStringChain;
    }

    @Override
    public OriginFormat format() {
        return OriginFormat.XML_V1;
    }

    @Override
    public EntryExtraction extract(byte[] content, String sourceFile) {
        Document document;
        try {
            document = parse(content);
        } catch (SAXException | IOException e) {
            log.warn("extract.xml.parseFailed entry={} error={}", sourceFile, e.getMessage());
            return EntryExtraction.failure(sourceFile, format(), "Malformed XML: " + e.getMessage());
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration rejected", e);
        }

        Element root = document.getDocumentElement();
        if (root == null) {
            return EntryExtraction.failure(sourceFile, format(), "XML document has no root element");
        }
        if (!AasNamespaces.AAS_V1.equals(root.getNamespaceURI())) {
            log.debug("extract.xml.unexpectedNamespace entry={} namespace={}", sourceFile, root.getNamespaceURI());
        }

        List<RawRecord> records = new ArrayList<>();
        List<ExtractionWarning> warnings = new ArrayList<>();
        for (ElementType type : ElementType.values()) {
            readElements(root, type, sourceFile, records, warnings);
        }

        log.debug("extract.xml.completed entry={} records={} warnings={}",
                sourceFile, records.size(), warnings.size());
        return EntryExtraction.success(sourceFile, format(), records, warnings);
    }

    private void readElements(Element root, ElementType type, String sourceFile,
                              List<RawRecord> records, List<ExtractionWarning> warnings) {
        Set<String> seenIdentities = new HashSet<>();
        int position = 0;
        for (Element element : elementChain.descendants(root, ELEMENT_NAMES.get(type))) {
            int current = position++;
            Optional<String> identity = elementChain.childText(element, "identification");
            Optional<String> shortName = elementChain.childText(element, "idShort");
            if (identity.isEmpty()) {
                warnings.add(new ExtractionWarning(sourceFile, type, current, "identification", "not found"));
            }
            if (shortName.isEmpty()) {
                warnings.add(new ExtractionWarning(sourceFile, type, current, "idShort", "not found"));
            }
            if (identity.isPresent() && !seenIdentities.add(identity.get())) {
                warnings.add(new ExtractionWarning(sourceFile, type, current, "identification",
                        "duplicate identity " + identity.get() + ", skipped"));
                continue;
            }

            String kindField = type == ElementType.SHELL ? "category" : "kind";
            records.add(new XmlRawRecord(
                    type,
                    sourceFile,
                    current,
                    identity,
                    shortName,
                    description(element),
                    elementChain.childText(element, kindField),
                    type == ElementType.SHELL ? submodelRefs(element) : List.of(),
                    type == ElementType.SHELL ? assetRef(element) : Optional.empty()
            ));
        }
    }

    private LocalizedText description(Element element) {
        Optional<Element> description = elementChain.firstChild(element, "description");
        if (description.isEmpty()) {
            return LocalizedText.absent();
        }
        Map<String, String> byLanguage = new LinkedHashMap<>();
        for (Element langString : langStringChain.children(description.get(), "langString")) {
            String lang = langString.getAttribute("lang");
            if (lang.isEmpty()) {
                lang = langString.getAttributeNS(XMLConstants.XML_NS_URI, "lang");
            }
            byLanguage.putIfAbsent(lang, langString.getTextContent().trim());
        }
        if (byLanguage.isEmpty()) {
            String text = description.get().getTextContent();
            return text == null || text.isBlank() ? LocalizedText.absent() : LocalizedText.plain(text.trim());
        }
        return LocalizedText.of(byLanguage);
    }

    private List<String> submodelRefs(Element shell) {
        Optional<Element> refs = elementChain.firstChild(shell, "submodelRefs");
        if (refs.isEmpty()) {
            return List.of();
        }
        List<String> targets = new ArrayList<>();
        for (Element ref : elementChain.children(refs.get(), "submodelRef")) {
            referenceTarget(ref, "Submodel").ifPresent(targets::add);
        }
        return targets;
    }

    private Optional<String> assetRef(Element shell) {
        return elementChain.firstChild(shell, "assetRef")
                .flatMap(ref -> referenceTarget(ref, "Asset"));
    }

    /**
     * Value of the key typed {@code preferredType}, else of the last key.
     */
    private Optional<String> referenceTarget(Element reference, String preferredType) {
        Optional<Element> keys = elementChain.firstChild(reference, "keys");
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        List<Element> keyElements = elementChain.children(keys.get(), "key");
        if (keyElements.isEmpty()) {
            return Optional.empty();
        }
        Element chosen = keyElements.get(keyElements.size() - 1);
        for (Element key : keyElements) {
            if (preferredType.equalsIgnoreCase(key.getAttribute("type"))) {
                chosen = key;
                break;
            }
        }
        String value = chosen.getTextContent().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Document parse(byte[] content) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                log.debug("extract.xml.parserWarning line={} message={}",
                        exception.getLineNumber(), exception.getMessage());
            }

            @Override
            public void error(SAXParseException exception) throws SAXException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXException {
                throw exception;
            }
        });
        return builder.parse(new ByteArrayInputStream(content));
    }
}
