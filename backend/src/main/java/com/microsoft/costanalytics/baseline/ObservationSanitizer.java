package com.microsoft.costanalytics.baseline;

import com.microsoft.costanalytics.domain.model.CostObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drops malformed cost observations and orders the rest by timestamp.
 *
 * A malformed record (missing timestamp, negative or non-numeric cost) is
 * logged and skipped; it never fails the batch.
 */
@Component
@Slf4j
public class ObservationSanitizer {

    public SanitizedObservations sanitize(List<CostObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return new SanitizedObservations(List.of(), 0);
        }

        List<CostObservation> accepted = new ArrayList<>(observations.size());
        int skipped = 0;
        for (CostObservation observation : observations) {
            if (observation == null) {
                log.warn("Skipping null cost observation");
                skipped++;
                continue;
            }
            Optional<String> error = observation.validationError();
            if (error.isPresent()) {
                log.warn("Skipping malformed cost observation for service={} region={}: {}",
                        observation.service(), observation.region(), error.get());
                skipped++;
                continue;
            }
            accepted.add(observation);
        }

        // List.sort is stable, so equal timestamps keep their input order
        accepted.sort(null);

        if (skipped > 0) {
            log.info("Accepted {} of {} cost observations ({} skipped)",
                    accepted.size(), observations.size(), skipped);
        }
        return new SanitizedObservations(List.copyOf(accepted), skipped);
    }

    /**
     * Well-formed observations in timestamp order, plus the number dropped.
     */
    public record SanitizedObservations(List<CostObservation> observations, int skipped) {

        public double[] costs() {
            return observations.stream().mapToDouble(CostObservation::cost).toArray();
        }

        public int size() {
            return observations.size();
        }

        public boolean isEmpty() {
            return observations.isEmpty();
        }
    }
}
