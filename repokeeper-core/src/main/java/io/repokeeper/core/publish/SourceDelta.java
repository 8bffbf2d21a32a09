package io.repokeeper.core.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.immutables.value.Value;

/**
 * Result of a binding change: the repository after the change and how each
 * component was affected.
 */
@Value.Immutable
public interface SourceDelta
{
    PublishedRepo getRepo();

    // bound before, unbound now
    List<String> getRemoved();

    // bound to another source, or marked for refresh
    List<String> getUpdated();

    List<String> getAdded();

    List<String> getUnchanged();

    /**
     * Components whose published files may have changed.
     */
    default List<String> getTouched()
    {
        return ImmutableList.<String>builder()
            .addAll(getRemoved())
            .addAll(getUpdated())
            .addAll(getAdded())
            .build();
    }

    static ImmutableSourceDelta.Builder builder()
    {
        return ImmutableSourceDelta.builder();
    }
}
