package com.postcraft.infrastructure.scheduling;

import com.postcraft.domain.credit.service.CreditMeteringService;
import com.postcraft.infrastructure.config.GenerationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refunds reservations left behind by requests that never reached settlement (e.g. a crash mid-request).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleReservationReaper {

    private final CreditMeteringService creditMeteringService;
    private final GenerationProperties generationProperties;

    @Scheduled(fixedDelayString = "${generation.reaper.interval-ms:300000}",
            initialDelayString = "${generation.reaper.interval-ms:300000}")
    public void releaseStaleReservations() {
        int released = creditMeteringService.releaseStaleReservations(
                generationProperties.reaper().reservationTtl());
        if (released > 0) {
            log.warn("Released {} stale credit reservations", released);
        } else {
            log.debug("No stale credit reservations");
        }
    }
}
