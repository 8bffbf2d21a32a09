package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.repokeeper.client.api.RestPublishUpdateRequest;
import io.repokeeper.client.api.RestSourceBinding;
import io.repokeeper.spi.Progress;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Component bindings of an update request, normalized from either the
 * Sources list or the older Snapshots list.
 */
public class SourceBindings
{
    private static final Logger logger = LoggerFactory.getLogger(SourceBindings.class);

    private static final AtomicBoolean legacyWarningLogged = new AtomicBoolean(false);

    private final Optional<List<RestSourceBinding>> bindings;
    private final boolean legacyInput;

    private SourceBindings(Optional<List<RestSourceBinding>> bindings, boolean legacyInput)
    {
        this.bindings = bindings;
        this.legacyInput = legacyInput;
    }

    @SuppressWarnings("deprecation")
    public static SourceBindings fromUpdate(RestPublishUpdateRequest request)
    {
        if (request.getSources().isPresent()) {
            return new SourceBindings(Optional.of(ImmutableList.copyOf(request.getSources().get())), false);
        }
        else if (request.getSnapshots().isPresent()) {
            return new SourceBindings(Optional.of(ImmutableList.copyOf(request.getSnapshots().get())), true);
        }
        else {
            return new SourceBindings(Optional.absent(), false);
        }
    }

    public static SourceBindings of(List<RestSourceBinding> bindings)
    {
        return new SourceBindings(Optional.of(ImmutableList.copyOf(bindings)), false);
    }

    public static SourceBindings refresh()
    {
        return new SourceBindings(Optional.absent(), false);
    }

    // no bindings given: re-publish every component from its current source
    public boolean isRefresh()
    {
        return !bindings.isPresent();
    }

    public List<RestSourceBinding> getBindings()
    {
        return bindings.or(ImmutableList.of());
    }

    // true if the bindings came from the deprecated Snapshots list
    public boolean isLegacyInput()
    {
        return legacyInput;
    }

    public void warnIfLegacy(Progress progress)
    {
        if (!legacyInput) {
            return;
        }
        if (legacyWarningLogged.compareAndSet(false, true)) {
            logger.warn("Snapshots in publish update requests is deprecated. Use Sources instead.");
        }
        progress.print("Warning: Snapshots is deprecated, use Sources instead");
    }
}
