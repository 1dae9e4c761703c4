package com.aasx.ingest.extract;

/**
 * Namespace URIs of the legacy XML metadata generation.
 */
public final class AasNamespaces {

    /** Shells, assets and submodels. */
    public static final String AAS_V1 = "http://www.admin-shell.io/aas/1/0";

    /** Concept descriptions and measurement units. */
    public static final String IEC61360_V1 = "http://www.admin-shell.io/IEC61360/1/0";

    private AasNamespaces() {
    }
}
