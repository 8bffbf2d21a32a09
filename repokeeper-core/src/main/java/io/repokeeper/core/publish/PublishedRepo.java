package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import io.repokeeper.core.repository.ModelValidator;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceKeys;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.UUID;
import org.immutables.value.Value;

/**
 * A publish point: the distribution published at (storage, prefix,
 * distribution) with the source bound to each of its components.
 *
 * Instances are immutable. The transition methods return the repository as
 * it looks after the change together with what changed, so a task can work
 * on its own copy and store it only when publishing succeeded.
 */
@Value.Immutable
public abstract class PublishedRepo
{
    public abstract UUID getUuid();

    // "" for the default filesystem storage, "<type>:<name>" otherwise
    public abstract String getStorage();

    public abstract String getPrefix();

    public abstract String getDistribution();

    public abstract SourceKind getSourceKind();

    // component -> uuid of the bound source
    @Value.NaturalOrder
    public abstract SortedMap<String, UUID> getSources();

    public abstract List<String> getArchitectures();

    public abstract Optional<String> getLabel();

    public abstract Optional<String> getOrigin();

    public abstract Optional<String> getNotAutomatic();

    public abstract Optional<String> getButAutomaticUpgrades();

    @Value.Default
    public boolean getSkipContents()
    {
        return false;
    }

    @Value.Default
    public boolean getSkipBz2()
    {
        return false;
    }

    @Value.Default
    public boolean getAcquireByHash()
    {
        return false;
    }

    @Value.Default
    public boolean getMultiDist()
    {
        return false;
    }

    public List<String> getComponents()
    {
        return ImmutableList.copyOf(getSources().keySet());
    }

    public String getStoragePrefix()
    {
        return ResourceKeys.storagePrefix(getStorage(), getPrefix());
    }

    public String resourceKey()
    {
        return ResourceKeys.publishedRepo(getStorage(), getPrefix(), getDistribution());
    }

    /**
     * Rebinds components. Components missing from bindings are unbound.
     */
    public SourceDelta updateSources(Map<String, ? extends PublishSource> bindings)
    {
        ModelValidator validator = ModelValidator.builder();
        for (Map.Entry<String, ? extends PublishSource> pair : bindings.entrySet()) {
            validator.checkComponentName("component", pair.getKey());
            validator.check("sources", pair.getValue().getName(),
                    pair.getValue().getKind() == getSourceKind(),
                    "must be a %s source", getSourceKind().getName());
        }
        validator.validate("source bindings", bindings);

        ImmutableSortedMap.Builder<String, UUID> sources = ImmutableSortedMap.naturalOrder();
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        for (Map.Entry<String, ? extends PublishSource> pair : bindings.entrySet()) {
            String component = pair.getKey();
            UUID uuid = pair.getValue().getUuid();
            sources.put(component, uuid);
            UUID before = getSources().get(component);
            if (before == null) {
                added.add(component);
            }
            else if (!before.equals(uuid)) {
                updated.add(component);
            }
            else {
                unchanged.add(component);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String component : getSources().keySet()) {
            if (!bindings.containsKey(component)) {
                removed.add(component);
            }
        }

        PublishedRepo after = ImmutablePublishedRepo.builder()
            .from(this)
            .sources(sources.build())
            .build();
        return SourceDelta.builder()
            .repo(after)
            .addAllRemoved(removed)
            .addAllUpdated(updated)
            .addAllAdded(added)
            .addAllUnchanged(unchanged)
            .build();
    }

    /**
     * Marks every bound component for re-publishing from its current source.
     */
    public SourceDelta refreshAll()
    {
        return SourceDelta.builder()
            .repo(ImmutablePublishedRepo.builder().from(this).build())
            .addAllUpdated(getComponents())
            .build();
    }

    /**
     * Unbinds components. Nothing changes unless every name is bound.
     */
    public SourceDelta removeComponents(Collection<String> components)
        throws ResourceNotFoundException
    {
        Set<String> names = new LinkedHashSet<>(components);
        for (String name : names) {
            if (!getSources().containsKey(name)) {
                throw new ResourceNotFoundException(String.format(
                            "component %s does not exist in published repository %s/%s",
                            name, getStoragePrefix(), getDistribution()));
            }
        }
        ModelValidator.builder()
            .check("components", null, names.size() < getSources().size(),
                    "must not remove every component of a published repository")
            .validate("component removal", components);

        ImmutableSortedMap.Builder<String, UUID> sources = ImmutableSortedMap.naturalOrder();
        List<String> unchanged = new ArrayList<>();
        for (Map.Entry<String, UUID> pair : getSources().entrySet()) {
            if (!names.contains(pair.getKey())) {
                sources.put(pair);
                unchanged.add(pair.getKey());
            }
        }
        PublishedRepo after = ImmutablePublishedRepo.builder()
            .from(this)
            .sources(sources.build())
            .build();
        return SourceDelta.builder()
            .repo(after)
            .addAllRemoved(names)
            .addAllUnchanged(unchanged)
            .build();
    }

    @Value.Check
    protected void check()
    {
        ModelValidator validator = ModelValidator.builder()
            .checkPrefix("prefix", getPrefix())
            .checkDistributionName("distribution", getDistribution())
            .checkNotEmpty("sources", getSources().keySet());
        for (String component : getSources().keySet()) {
            validator.checkComponentName("component", component);
        }
        validator.validate("published repository", this);
    }
}
