package io.repokeeper.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface RemoteDatabaseConfig
{
    String getUser();

    @Value.Redacted
    String getPassword();

    String getHost();

    Optional<Integer> getPort();

    int getLoginTimeout();

    int getSocketTimeout();

    boolean getSsl();

    Optional<String> getSslmode();

    String getDatabase();

    static ImmutableRemoteDatabaseConfig.Builder builder()
    {
        return ImmutableRemoteDatabaseConfig.builder();
    }
}
