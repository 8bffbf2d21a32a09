package io.repokeeper.core.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Optional;

public enum SourceKind
{
    SNAPSHOT("snapshot"),
    LOCAL("local"),
    ;

    private final String name;

    private SourceKind(String name)
    {
        this.name = name;
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    public static Optional<SourceKind> fromName(String name)
    {
        for (SourceKind kind : values()) {
            if (kind.name.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.absent();
    }

    @JsonCreator
    public static SourceKind of(String name)
    {
        Optional<SourceKind> kind = fromName(name);
        if (!kind.isPresent()) {
            throw new IllegalArgumentException("Unknown source kind: " + name);
        }
        return kind.get();
    }

    @Override
    public String toString()
    {
        return name;
    }
}
