package com.quotaguard.backend.audit;

import java.util.Optional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Binds a {@link ChangeAttribution} to the current transaction. The change-capture listener
 * runs during flush, possibly at commit after the calling method has returned, so the
 * attribution lives until the transaction completes rather than for a method scope.
 */
public final class ChangeAttributionHolder {

    private static final Object RESOURCE_KEY = ChangeAttributionHolder.class;

    private ChangeAttributionHolder() {
    }

    public static void bind(ChangeAttribution attribution) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Change attribution requires an active transaction");
        }
        if (TransactionSynchronizationManager.hasResource(RESOURCE_KEY)) {
            TransactionSynchronizationManager.unbindResource(RESOURCE_KEY);
            TransactionSynchronizationManager.bindResource(RESOURCE_KEY, attribution);
            return;
        }
        TransactionSynchronizationManager.bindResource(RESOURCE_KEY, attribution);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                TransactionSynchronizationManager.unbindResourceIfPossible(RESOURCE_KEY);
            }
        });
    }

    public static Optional<ChangeAttribution> current() {
        return Optional.ofNullable((ChangeAttribution) TransactionSynchronizationManager.getResource(RESOURCE_KEY));
    }
}
