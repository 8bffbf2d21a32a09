package io.repokeeper.client.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Immutable snapshot of a Config. Used to hold the system configuration so
 * that each consumer gets its own mutable copy.
 */
public class ConfigElement
{
    public static ConfigElement copyOf(Config mutableConfig)
    {
        return new ConfigElement(mutableConfig.object);
    }

    @JsonCreator
    public static ConfigElement of(ObjectNode node)
    {
        return new ConfigElement(node);
    }

    public static ConfigElement empty()
    {
        return new ConfigElement(JsonNodeFactory.instance.objectNode());
    }

    private final ObjectNode object;  // never modified

    private ConfigElement(ObjectNode node)
    {
        this.object = node.deepCopy();
    }

    public Config toConfig(ConfigFactory factory)
    {
        return new Config(factory.objectMapper, object.deepCopy());
    }

    @JsonValue
    @Deprecated  // only for ObjectMapper
    public ObjectNode getObjectNode()
    {
        return object;
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof ConfigElement)) {
            return false;
        }
        return object.equals(((ConfigElement) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
