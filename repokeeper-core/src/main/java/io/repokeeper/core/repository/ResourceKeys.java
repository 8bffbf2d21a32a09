package io.repokeeper.core.repository;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.UUID;

/**
 * Builds the keys that tasks lock.
 *
 * A key set may name more than an operation touches; it must never name less.
 */
public final class ResourceKeys
{
    private ResourceKeys()
    { }

    public static String publishedRepo(String storage, String prefix, String distribution)
    {
        return "U" + storagePrefix(storage, prefix) + ">>" + distribution;
    }

    public static String snapshot(UUID uuid)
    {
        return "S" + uuid;
    }

    public static String localRepo(UUID uuid)
    {
        return "L" + uuid;
    }

    /**
     * "prefix" for the default storage, "storage:prefix" otherwise.
     */
    public static String storagePrefix(String storage, String prefix)
    {
        if (storage.isEmpty()) {
            return prefix;
        }
        return storage + ":" + prefix;
    }

    /**
     * Keys of a create: the target publish point, reserved before it exists, and every bound source.
     */
    public static ImmutableSortedSet<String> forCreate(String storage, String prefix, String distribution,
            Collection<? extends PublishSource> sources)
    {
        ImmutableSortedSet.Builder<String> builder = ImmutableSortedSet.naturalOrder();
        builder.add(publishedRepo(storage, prefix, distribution));
        for (PublishSource source : sources) {
            builder.add(source.resourceKey());
        }
        return builder.build();
    }

    /**
     * Keys of an update: the publish point and every newly bound source.
     */
    public static ImmutableSortedSet<String> forUpdate(String storage, String prefix, String distribution,
            Collection<? extends PublishSource> newlyBound)
    {
        return forCreate(storage, prefix, distribution, newlyBound);
    }

    /**
     * Keys of a component removal or a drop: the publish point alone.
     */
    public static ImmutableSortedSet<String> forPublishPoint(String storage, String prefix, String distribution)
    {
        return ImmutableSortedSet.of(publishedRepo(storage, prefix, distribution));
    }
}
