package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.domain.model.Specialization;

/**
 * Maps the free text of a repair request to the trade required to fix it.
 */
public interface SpecializationClassifier {

    /**
     * Classify a request from its title and description.
     *
     * @param title request title, may be null
     * @param description request description, may be null
     * @return the required specialization, {@link Specialization#GENERAL_MAINTENANCE} when nothing matches
     */
    Specialization classify(String title, String description);
}
