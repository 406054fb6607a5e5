package com.silentrisk.worker.passport;

/**
 * Proof/commitment collaborator of the risk pipeline. A failure here never
 * fails the task.
 */
public interface PassportIssuer {

    Passport issue(String commitment, int riskScore);
}
