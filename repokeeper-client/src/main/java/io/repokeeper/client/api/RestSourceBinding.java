package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestSourceBinding.class)
public interface RestSourceBinding
{
    // empty means the default component
    @Value.Default
    @JsonProperty("Component")
    default String getComponent()
    {
        return "";
    }

    @JsonProperty("Name")
    String getName();

    static RestSourceBinding of(String component, String name)
    {
        return builder().component(component).name(name).build();
    }

    static ImmutableRestSourceBinding.Builder builder()
    {
        return ImmutableRestSourceBinding.builder();
    }
}
