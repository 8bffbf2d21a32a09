package io.repokeeper.core.database;

import org.jdbi.v3.core.Handle;

public interface TransactionManager
{
    /**
     * Return the current transaction object.
     */
    Handle getHandle();

    /**
     * Create a new transaction and set it as the current transaction object.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    /**
     * Create a new transaction and set it as the current transaction object.
     */
    <T, E1 extends Exception> T begin(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    /**
     * Create a new transaction and set it as the current transaction object.
     */
    <T, E1 extends Exception, E2 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2, RuntimeException> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    /**
     * Get the current transaction object if exists, otherwise uses a temporary transaction object with auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    /**
     * Get the current transaction object if exists, otherwise uses a temporary transaction object with auto-commit mode.
     */
    <T, E1 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    {
        T get()
                throws E1, E2, E3;
    }
}
