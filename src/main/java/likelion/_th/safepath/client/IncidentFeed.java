package likelion._th.safepath.client;

import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.exception.IncidentFetchException;

import java.util.List;

/**
 * One external incident source. Implementations own all source-specific
 * parsing and return only records with resolvable coordinates.
 */
public interface IncidentFeed {

    /** Cache key of this source, e.g. "311-feed" */
    String sourceId();

    /**
     * @throws IncidentFetchException on transport failure, timeout or a malformed payload
     */
    List<Incident> fetch();
}
