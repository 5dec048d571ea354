package com.incidentsentinel.core.store;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.spi.IncidentStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * {@link IncidentStore} kept in process memory.
 *
 * <p>
 * Thread-safe. Contents are lost on restart, so this store suits embedded
 * use and tests; the monitor service persists to a file instead.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryIncidentStore implements IncidentStore {

    private final ConcurrentLinkedQueue<Incident> incidents = new ConcurrentLinkedQueue<>();

    @Override
    public void append(Incident incident) {
        incidents.add(Objects.requireNonNull(incident, "Incident must not be null"));
    }

    @Override
    public List<Incident> listAll() {
        List<Incident> all = new ArrayList<>(incidents);
        all.sort(Comparator.comparing(Incident::getTimestamp).reversed());
        return all;
    }

    public int size() {
        return incidents.size();
    }
}
