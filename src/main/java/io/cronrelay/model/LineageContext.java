package io.cronrelay.model;

/**
 * Provenance handed to a downstream service so it can continue the lineage chain.
 */
public record LineageContext(long parentServiceId, long rootId) {
    public static final String PARENT_SERVICE_ID = "parent_service_id";
    public static final String ROOT_ID = "root_id";
}
