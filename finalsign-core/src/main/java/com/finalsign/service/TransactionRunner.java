package com.finalsign.service;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.FinalSignException;
import com.finalsign.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in one database transaction and maps infrastructure failures,
 * including those raised at commit, onto the core's error kinds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionRunner {

    private final TransactionTemplate transactionTemplate;

    public <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (FinalSignException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            log.warn("{} rejected by a database constraint: {}", operation, e.getMostSpecificCause().getMessage());
            throw new ConflictException("CONSTRAINT_VIOLATION", operation + " conflicts with existing data");
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed in the database: {}", operation, e.getMessage(), e);
            throw new PersistenceException(operation + " failed", e);
        }
    }

    public void runInTransaction(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }
}
