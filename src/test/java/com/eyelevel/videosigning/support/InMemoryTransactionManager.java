package com.eyelevel.videosigning.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * A transaction manager without a resource. It drives the real synchronization lifecycle, records
 * whether upload staging happened inside a transaction, and can be told to fail the next commit.
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    private boolean failNextCommit;
    private int commits;
    private int rollbacks;

    public void failNextCommit() {
        this.failNextCommit = true;
    }

    public int commits() {
        return commits;
    }

    public int rollbacks() {
        return rollbacks;
    }

    public static boolean inTransaction() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    protected Object doGetTransaction() {
        return new Object();
    }

    @Override
    protected void doBegin(final Object transaction, final TransactionDefinition definition) {
    }

    @Override
    protected void doCommit(final DefaultTransactionStatus status) {
        if (failNextCommit) {
            failNextCommit = false;
            throw new TransactionSystemException("commit failed");
        }
        commits++;
    }

    @Override
    protected void doRollback(final DefaultTransactionStatus status) {
        rollbacks++;
    }
}
