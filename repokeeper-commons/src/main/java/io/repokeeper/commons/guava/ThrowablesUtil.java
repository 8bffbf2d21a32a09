package io.repokeeper.commons.guava;

import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is, or wraps a checked one in a RuntimeException.
     * Replacement of deprecated com.google.common.base.Throwables.propagate.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }

    /**
     * Returns a one-line description of a failure, suitable for a task result.
     * Falls back to the class name when the exception carries no message.
     */
    public static String messageOf(Throwable throwable)
    {
        String message = throwable.getMessage();
        if (message == null || message.isEmpty()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Returns the message of the innermost cause, which is usually the one that
     * carries the detail of an I/O or database failure.
     */
    public static String rootCauseMessage(Throwable throwable)
    {
        return messageOf(Throwables.getRootCause(throwable));
    }
}
