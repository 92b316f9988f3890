package com.example.alerthistory.inhibition;

import com.example.alerthistory.domain.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Population of currently firing alerts that may act as inhibition sources.
 * Implementations backed by a remote store raise {@link com.example.alerthistory.error.StateStoreException}.
 */
public interface FiringAlertStore {

    List<Alert> getFiringAlerts();

    void addFiringAlert(Alert alert);

    Optional<Alert> removeAlert(String fingerprint);

    int size();
}
