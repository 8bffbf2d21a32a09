package io.repokeeper.spi;

/**
 * Sink for human-readable status lines produced while a task runs.
 */
public interface Progress
{
    void print(String message);

    default void printf(String format, Object... args)
    {
        print(String.format(java.util.Locale.ENGLISH, format, args));
    }

    static Progress discard()
    {
        return message -> { };
    }
}
