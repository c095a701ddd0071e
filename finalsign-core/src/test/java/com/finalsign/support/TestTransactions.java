package com.finalsign.support;

import com.finalsign.service.TransactionRunner;
import org.mockito.Mockito;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction plumbing for unit tests: work runs inline against a mock transaction
 * manager, so exception mapping behaves as in production.
 */
public final class TestTransactions {

    private TestTransactions() {
    }

    public static TransactionRunner directRunner() {
        return new TransactionRunner(new TransactionTemplate(Mockito.mock(PlatformTransactionManager.class)));
    }
}
