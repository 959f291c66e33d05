package com.continuum.relayer.exception;

import java.util.Map;

/**
 * Raised when a submission with the same (user, pool, nonce) fingerprint was already
 * accepted inside the dedup window. The client is retrying a request the relayer has
 * already taken; the original order id is returned in the details.
 */
public class DuplicateSubmissionException extends BaseException {

    public DuplicateSubmissionException(String fingerprint, String existingOrderId) {
        super(
                ErrorCode.DUPLICATE_SUBMISSION,
                "Duplicate submission for fingerprint " + fingerprint,
                Map.of("existingOrderId", existingOrderId));
    }
}
