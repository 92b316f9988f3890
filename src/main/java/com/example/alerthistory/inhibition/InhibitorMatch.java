package com.example.alerthistory.inhibition;

import com.example.alerthistory.domain.Alert;

/**
 * One firing alert that inhibits a target under a given rule.
 */
public record InhibitorMatch(Alert sourceAlert, String ruleName) {
}
