package com.example.alerthistory.inhibition;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps inhibition inputs in step with alert transitions reported by ingestion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertLifecycleService {

    private final FiringAlertStore firingAlerts;
    private final InhibitionStateTracker stateTracker;

    /**
     * A firing alert joins the source population. A resolved alert leaves it, and every
     * inhibition it was the source or the target of is removed.
     */
    public void observe(Alert alert) {
        if (alert == null) {
            throw new ValidationException("alert", "required", "alert is required");
        }
        if (alert.isFiring()) {
            firingAlerts.addFiringAlert(alert);
            return;
        }
        firingAlerts.removeAlert(alert.fingerprint());
        int released = stateTracker.removeInhibitionsBySource(alert.fingerprint());
        stateTracker.removeInhibition(alert.fingerprint());
        log.debug("Alert {} resolved, released {} inhibited alerts", alert.fingerprint(), released);
    }
}
