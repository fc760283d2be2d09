package likelion._th.safepath.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Normalised safety-relevant event merged from the crime and 311 feeds.
 *
 * Category and severity are assigned once when the source record is mapped
 * and never recomputed.
 */
@Value
@Builder(toBuilder = true)
public class Incident {

    /** Source record id, stable across refetches */
    String id;

    /** Feed this record came from, e.g. "311-feed" */
    String sourceId;

    IncidentCategory category;

    Severity severity;

    LatLng location;

    /** Only used for staleness filtering */
    Instant occurredAt;

    // 표시용
    String description;
    String status;
}
