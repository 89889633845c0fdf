package com.eyelevel.batchorchestrator.service.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("profileRetryListener")
@Slf4j
public class ProfileRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Fetching the user profile failed on attempt {}: {}", context.getRetryCount(),
                 throwable.getMessage());
    }
}
