package com.eyelevel.batchorchestrator.exception.apiclient;

import java.io.Serial;

/**
 * The account has run out of quota or its subscription has lapsed (HTTP 402).
 *
 * <p>Unlike every other status this is not an ordinary failure: it disables retries and routes the
 * user towards a plan upgrade. A running batch stops dispatching new items once it sees one.
 */
public class PaymentRequiredException extends ApiException {

    @Serial
    private static final long serialVersionUID = 4410921637455092318L;

    public PaymentRequiredException(String message) {
        super(message, 402);
    }
}
