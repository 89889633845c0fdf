package com.eyelevel.batchorchestrator.service.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("reconciliationRetryListener")
@Slf4j
public class ReconciliationRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        Object name = context.getAttribute(RetryContext.NAME);
        if (throwable instanceof ReconciliationService.NotYetConfirmedException) {
            log.debug("'{}' not confirmed after attempt {}", name, context.getRetryCount());
        } else {
            log.warn("Fetch for '{}' failed on attempt {}: {}", name, context.getRetryCount(),
                     throwable.getMessage());
        }
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null) {
            log.info("Gave up waiting for '{}' after {} attempts", context.getAttribute(RetryContext.NAME),
                     context.getRetryCount());
        }
    }
}
