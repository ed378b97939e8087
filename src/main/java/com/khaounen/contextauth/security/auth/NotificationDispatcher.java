package com.khaounen.contextauth.security.auth;

import com.khaounen.contextauth.security.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Hands notifications to an executor so that slow or failing deliveries never
 * hold up, or fail, the caller. An executor that is itself a
 * {@link DisposableBean} is owned by the dispatcher and shut down with it.
 */
@Slf4j
public class NotificationDispatcher implements DisposableBean {

    private final Notifier notifier;
    private final Executor executor;

    public NotificationDispatcher(Notifier notifier, Executor executor) {
        this.notifier = notifier;
        this.executor = executor;
    }

    public void dispatch(String description, Consumer<Notifier> delivery) {
        try {
            executor.execute(() -> deliver(description, delivery));
        } catch (RejectedExecutionException ex) {
            log.warn("{} notification dropped: {}", description, ex.getMessage());
        }
    }

    private void deliver(String description, Consumer<Notifier> delivery) {
        try {
            delivery.accept(notifier);
        } catch (RuntimeException ex) {
            log.warn("{} notification failed: {}", description, ex.getMessage());
        }
    }

    @Override
    public void destroy() throws Exception {
        if (executor instanceof DisposableBean) {
            ((DisposableBean) executor).destroy();
        }
    }
}
