package com.aasx.ingest.transform;

import com.aasx.ingest.core.model.ComplianceStatus;
import com.aasx.ingest.core.model.Entity;
import com.aasx.ingest.core.model.QualityLevel;

/**
 * Derived quality and compliance properties of an entity.
 * Only a natural identity counts as present; synthetic keys do not.
 */
public final class QualityAssessor {

    private QualityAssessor() {
    }

    public static int presentFields(Entity entity) {
        int present = 0;
        if (entity.hasNaturalIdentity()) present++;
        if (!entity.getShortName().isEmpty()) present++;
        if (!entity.getDescription().isEmpty()) present++;
        if (!entity.getKind().isEmpty()) present++;
        return present;
    }

    public static QualityLevel qualityLevel(Entity entity) {
        return QualityLevel.forPresentFields(presentFields(entity));
    }

    public static ComplianceStatus complianceStatus(Entity entity) {
        return entity.hasNaturalIdentity() && !entity.getShortName().isEmpty()
                ? ComplianceStatus.COMPLIANT
                : ComplianceStatus.NON_COMPLIANT;
    }
}
