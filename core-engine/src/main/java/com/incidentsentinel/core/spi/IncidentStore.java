package com.incidentsentinel.core.spi;

import com.incidentsentinel.core.model.Incident;

import java.util.List;

/**
 * Durable, append-only home for detected incidents.
 *
 * <p>
 * Implementations must be safe for concurrent use: several detection cycles
 * may append at the same time. Appends are at-least-once; callers tolerate
 * the occasional duplicate row.
 * </p>
 */
public interface IncidentStore {

    /**
     * Persist one incident.
     *
     * @param incident the incident to append; must not be {@code null}
     * @throws IncidentStoreException if the incident could not be stored
     */
    void append(Incident incident) throws IncidentStoreException;

    /**
     * @return every stored incident, newest timestamp first
     * @throws IncidentStoreException if the store could not be read
     */
    List<Incident> listAll() throws IncidentStoreException;
}
