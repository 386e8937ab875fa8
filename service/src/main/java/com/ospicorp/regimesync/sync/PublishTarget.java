package com.ospicorp.regimesync.sync;

import com.ospicorp.regimesync.series.model.SourceColumn;

/**
 * Derived column to publish and the classification of the resource it is published to.
 */
public record PublishTarget(
    String label,
    int observationTypeId,
    String code,
    SourceColumn sourceColumn
) {}
