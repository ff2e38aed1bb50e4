package com.eyelevel.sheetextractor.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("aiCallRetryListener")
@Slf4j
public class AiCallRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("AI inference failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("AI inference gave up after {} attempts.", context.getRetryCount(), throwable);
        }
    }
}
