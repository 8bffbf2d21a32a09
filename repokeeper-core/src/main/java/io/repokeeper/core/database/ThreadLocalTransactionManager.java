package io.repokeeper.core.database;

import com.google.inject.Inject;
import io.repokeeper.commons.guava.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;

import java.sql.SQLException;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Locale.ENGLISH;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private final ThreadLocal<Transaction> threadLocalTransaction = new ThreadLocal<>();
    private final ThreadLocal<Transaction> threadLocalAutoCommitTransaction = new ThreadLocal<>();
    private final Jdbi jdbi;

    private static class LazyTransaction
            implements Transaction
    {
        private enum State
        {
            ACTIVE,
            ABORTED,
            COMMITTED;
        }

        private final Jdbi jdbi;
        private final boolean autoAutoCommit;
        private Handle handle;
        private State state = State.ACTIVE;

        LazyTransaction(Jdbi jdbi, boolean autoAutoCommit)
        {
            this.jdbi = checkNotNull(jdbi);
            this.autoAutoCommit = autoAutoCommit;
        }

        @Override
        public Handle getHandle()
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Transaction is already " + state.name().toLowerCase(ENGLISH));
            }

            if (handle == null) {
                handle = jdbi.open();
                try {
                    handle.getConnection().setAutoCommit(autoAutoCommit);
                }
                catch (SQLException ex) {
                    throw new TransactionException("Failed to set auto commit: " + autoAutoCommit, ex);
                }
                if (!autoAutoCommit) {
                    handle.begin();
                }
            }
            return handle;
        }

        @Override
        public void commit()
        {
            if (handle == null) {
                return;
            }
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Committing " + state.name().toLowerCase(ENGLISH) + " is not allowed");
            }

            // PostgreSQL silently turns COMMIT into ROLLBACK once a statement
            // of the transaction failed. isValid reports that state.
            boolean isValid;
            try {
                isValid = handle.getConnection().isValid(30);
            }
            catch (SQLException ex) {
                throw new TransactionException(
                        "Can't validate a transaction before commit", ex);
            }
            if (!isValid) {
                throw new TransactionException(
                        "Trying to commit a transaction that is already aborted");
            }
            handle.commit();
            restoreAutoCommit();

            state = State.COMMITTED;
        }

        @Override
        public void abort()
        {
            if (handle == null) {
                return;
            }
            if (state == State.COMMITTED) {
                throw new IllegalStateException("Aborting committed transaction is not allowed");
            }
            if (!autoAutoCommit) {
                handle.rollback();
                restoreAutoCommit();
            }
            state = State.ABORTED;
        }

        // a handle is closed only after its transaction ended
        private void restoreAutoCommit()
        {
            try {
                handle.getConnection().setAutoCommit(true);
            }
            catch (SQLException ex) {
                throw new TransactionException("Failed to restore auto commit", ex);
            }
        }

        void close()
        {
            if (handle != null) {
                handle.close();
            }
        }
    }

    @Inject
    public ThreadLocalTransactionManager(Jdbi jdbi)
    {
        this.jdbi = checkNotNull(jdbi);
    }

    @Override
    public Handle getHandle()
    {
        Transaction transaction = threadLocalTransaction.get();
        if (transaction == null) {
            transaction = threadLocalAutoCommitTransaction.get();
            if (transaction == null) {
                throw new IllegalStateException("Not in transaction");
            }
        }
        return transaction.getHandle();
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return begin(func, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T begin(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return begin(func, e1, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2, RuntimeException> func, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        if (threadLocalTransaction.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed");
        }

        boolean committed = false;
        LazyTransaction transaction = new LazyTransaction(jdbi, false);
        try {
            threadLocalTransaction.set(transaction);
            T result = func.get();
            transaction.commit();
            committed = true;
            return result;
        }
        catch (Exception e) {
            ThrowablesUtil.propagateIfInstanceOf(e, e1);
            ThrowablesUtil.propagateIfInstanceOf(e, e2);
            throw ThrowablesUtil.propagate(e);
        }
        finally {
            threadLocalTransaction.set(null);
            try {
                if (!committed) {
                    transaction.abort();
                }
            }
            finally {
                transaction.close();
            }
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return autoCommit(func, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T autoCommit(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        try {
            if (threadLocalTransaction.get() != null) {
                return func.get();
            }
            else {
                LazyTransaction transaction = new LazyTransaction(jdbi, true);
                threadLocalAutoCommitTransaction.set(transaction);
                try {
                    return func.get();
                }
                finally {
                    threadLocalAutoCommitTransaction.set(null);
                    transaction.close();
                }
            }
        }
        catch (Exception e) {
            ThrowablesUtil.propagateIfInstanceOf(e, e1);
            throw ThrowablesUtil.propagate(e);
        }
    }
}
