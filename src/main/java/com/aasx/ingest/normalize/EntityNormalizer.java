package com.aasx.ingest.normalize;

import com.aasx.ingest.core.model.Entity;
import com.aasx.ingest.extract.DescriptionResolver;
import com.aasx.ingest.extract.RawRecord;
import com.aasx.ingest.extract.XmlRawRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns extractor output into canonical {@link Entity} records. Never fails:
 * absent fields become empty strings and a missing identity gets a synthetic key.
 */
public class EntityNormalizer {

    /**
     * @param record    raw record from one metadata entry
     * @param container file name of the container the entry belongs to
     */
    public Entity normalize(RawRecord record, String container) {
        String identity = record.identity().map(String::trim).orElse("");
        String shortName = record.shortName().map(String::trim).orElse("");

        Entity.Builder builder = Entity.builder()
                .identity(identity)
                .shortName(shortName)
                .description(DescriptionResolver.resolve(record.description()))
                .kind(record.kind().orElse(""))
                .elementType(record.elementType())
                .sourceFile(record.sourceFile())
                .container(container)
                .originFormat(record.originFormat())
                .submodelRefs(trimmed(record.submodelRefs()));

        if (identity.isEmpty()) {
            builder.key(SyntheticKeyGenerator.generate(container, record.sourceFile(),
                    record.elementType(), shortName, record.position()));
        }
        if (record instanceof XmlRawRecord xml) {
            builder.assetRef(xml.assetRef().map(String::trim).orElse(""));
        }
        return builder.build();
    }

    public List<Entity> normalizeAll(List<RawRecord> records, String container) {
        List<Entity> entities = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            entities.add(normalize(record, container));
        }
        return entities;
    }

    private static List<String> trimmed(List<String> refs) {
        List<String> result = new ArrayList<>(refs.size());
        for (String ref : refs) {
            String value = ref.trim();
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }
}
