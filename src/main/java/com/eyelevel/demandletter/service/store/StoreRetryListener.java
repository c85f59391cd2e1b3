package com.eyelevel.demandletter.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("storeRetryListener")
@Slf4j
public class StoreRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("Job store write hit a transient failure on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }
}
