package com.aasx.ingest.transform;

import com.aasx.ingest.api.ExtractionResult;
import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.Entity;
import com.aasx.ingest.core.model.RelationshipType;
import com.aasx.ingest.metrics.MetricsService;
import com.aasx.ingest.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps normalized entities to graph nodes and containment edges.
 *
 * <p>Node id is the entity key, so the same input always yields the same ids. When two
 * entities share a key the first one wins. A shell's submodel references become
 * {@code HAS_SUBMODEL} edges and its asset reference a {@code DESCRIBES} edge, but only
 * when the target is a node of the expected type in the same batch. Other references are
 * counted as dangling.</p>
 */
public class GraphTransformer {
    private static final Logger log = LoggerFactory.getLogger(GraphTransformer.class);

    public static final String PROP_IDENTITY = "identity";
    public static final String PROP_SHORT_NAME = "shortName";
    public static final String PROP_DESCRIPTION = "description";
    public static final String PROP_KIND = "kind";
    public static final String PROP_ELEMENT_TYPE = "elementType";
    public static final String PROP_SOURCE_FILE = "sourceFile";
    public static final String PROP_CONTAINER = "container";
    public static final String PROP_ORIGIN_FORMAT = "originFormat";
    public static final String PROP_QUALITY_LEVEL = "qualityLevel";
    public static final String PROP_COMPLIANCE_STATUS = "complianceStatus";

    private final MetricsService metricsService;

    public GraphTransformer() {
        this(new NoOpMetricsService());
    }

    public GraphTransformer(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    public ImportBatch transform(ExtractionResult result) {
        return transform(batchName(result.sourceFile()), result.entities(), result.documents());
    }

    public ImportBatch transform(String batchName, List<ExtractionResult> results) {
        List<Entity> entities = new ArrayList<>();
        List<DocumentRef> documents = new ArrayList<>();
        for (ExtractionResult result : results) {
            entities.addAll(result.entities());
            documents.addAll(result.documents());
        }
        return transform(batchName, entities, documents);
    }

    public ImportBatch transform(String batchName, Collection<Entity> entities, Collection<DocumentRef> documents) {
        Map<String, Entity> byKey = new LinkedHashMap<>();
        int duplicates = 0;
        for (Entity entity : entities) {
            if (byKey.putIfAbsent(entity.getKey(), entity) != null) {
                duplicates++;
                log.debug("transform.duplicateEntity key={} sourceFile={}", entity.getKey(), entity.getSourceFile());
            }
        }

        List<GraphNode> nodes = new ArrayList<>(byKey.size());
        for (Entity entity : byKey.values()) {
            nodes.add(toNode(entity));
        }

        Map<String, GraphEdge> edges = new LinkedHashMap<>();
        List<String> dangling = new ArrayList<>();
        for (Entity entity : byKey.values()) {
            if (entity.getElementType() != ElementType.SHELL) {
                continue;
            }
            for (String submodelRef : entity.getSubmodelRefs()) {
                link(entity, submodelRef, ElementType.SUBMODEL, RelationshipType.HAS_SUBMODEL, byKey, edges, dangling);
            }
            if (!entity.getAssetRef().isEmpty()) {
                link(entity, entity.getAssetRef(), ElementType.ASSET, RelationshipType.DESCRIBES, byKey, edges, dangling);
            }
        }

        TransformDiagnostics diagnostics = new TransformDiagnostics(dangling.size(), dangling, duplicates);
        metricsService.recordDanglingReferences(dangling.size());
        log.info("transform.completed batch={} nodes={} edges={} dangling={} duplicates={}",
                batchName, nodes.size(), edges.size(), dangling.size(), duplicates);
        return new ImportBatch(batchName, nodes, new ArrayList<>(edges.values()),
                new ArrayList<>(documents), diagnostics);
    }

    static GraphNode toNode(Entity entity) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PROP_IDENTITY, entity.getIdentity());
        properties.put(PROP_SHORT_NAME, entity.getShortName());
        properties.put(PROP_DESCRIPTION, entity.getDescription());
        properties.put(PROP_KIND, entity.getKind());
        properties.put(PROP_ELEMENT_TYPE, entity.getElementType().getLabel());
        properties.put(PROP_SOURCE_FILE, entity.getSourceFile());
        properties.put(PROP_CONTAINER, entity.getContainer());
        properties.put(PROP_ORIGIN_FORMAT, entity.getOriginFormat().name());
        properties.put(PROP_QUALITY_LEVEL, QualityAssessor.qualityLevel(entity).name());
        properties.put(PROP_COMPLIANCE_STATUS, QualityAssessor.complianceStatus(entity).name());
        return new GraphNode(entity.getKey(),
                List.of(GraphNode.BASE_LABEL, entity.getElementType().getLabel()),
                properties);
    }

    private static void link(Entity from, String targetId, ElementType targetType, RelationshipType type,
                             Map<String, Entity> byKey, Map<String, GraphEdge> edges, List<String> dangling) {
        Entity target = byKey.get(targetId);
        if (target == null || target.getElementType() != targetType) {
            dangling.add(from.getKey() + " -" + type.name() + "-> " + targetId);
            return;
        }
        GraphEdge edge = new GraphEdge(from.getKey(), target.getKey(), type,
                Map.of(PROP_SOURCE_FILE, from.getSourceFile()));
        edges.putIfAbsent(edge.key(), edge);
    }

    /**
     * Container file name without directory and extension.
     */
    public static String batchName(String containerPath) {
        String name = containerPath.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
