package com.flow.notify.service.escalation;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Interface for incident storage.
 *
 * Keeps every incident by id, an index of the open (non-terminal) incident per
 * fingerprint and policy, and the most recently closed incident per fingerprint
 * and policy for cooldown checks.
 */
public interface IncidentStore {

    /**
     * Retrieves an incident by id.
     *
     * @param incidentId the incident identifier
     * @return the incident if found
     */
    Optional<Incident> findById(String incidentId);

    /**
     * Retrieves the open incident for a fingerprint under a policy.
     *
     * @param fingerprint the fingerprint
     * @param policyId the escalation policy id
     * @return the open incident if any
     */
    Optional<Incident> findOpen(String fingerprint, String policyId);

    /**
     * Returns the open incident for the key, creating it atomically when absent.
     *
     * At most one open incident exists per fingerprint and policy; concurrent
     * callers receive the same instance.
     *
     * @param fingerprint the fingerprint
     * @param policyId the escalation policy id
     * @param factory creates the incident when none is open
     * @return the open incident
     */
    Incident openIfAbsent(String fingerprint, String policyId, Supplier<Incident> factory);

    /**
     * Removes an incident from the open index and records it as the last closed one for its key.
     *
     * @param incident the incident that reached a terminal state
     */
    void markClosed(Incident incident);

    /**
     * Retrieves the most recently closed incident for a fingerprint under a policy.
     *
     * @param fingerprint the fingerprint
     * @param policyId the escalation policy id
     * @return the last closed incident if still retained
     */
    Optional<Incident> findLastClosed(String fingerprint, String policyId);

    /**
     * Retrieves all open incidents for a fingerprint, across policies.
     *
     * @param fingerprint the fingerprint
     * @return open incidents
     */
    List<Incident> findOpenByFingerprint(String fingerprint);

    /**
     * Retrieves all retained incidents.
     *
     * @return collection of incidents
     */
    Collection<Incident> findAll();

    /**
     * Removes retained incidents matching the predicate.
     *
     * @param filter selects incidents to archive
     * @return number removed
     */
    int archiveIf(Predicate<Incident> filter);

    /**
     * Drops cooldown entries matching the predicate.
     *
     * @param filter selects last closed incidents to forget
     * @return number removed
     */
    int forgetClosedIf(Predicate<Incident> filter);

    int count();

    int openCount();
}
