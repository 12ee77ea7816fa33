package com.company.decommissioning.service;

import com.company.decommissioning.domain.IssuePayload;
import com.company.decommissioning.exception.DeliveryException;

/**
 * Submits manual-review tickets to the external issue tracker.
 */
public interface IssueTrackerClient {

    /**
     * @return a reference to the created issue (URL or key)
     * @throws DeliveryException when the tracker rejects or cannot be reached
     */
    String createIssue(IssuePayload issue);
}
