package io.repokeeper.client.config;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.repokeeper.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * Mutable JSON object with typed accessors.
 *
 * System configuration is stored flat, so a key such as "publish.root_dir" is
 * a single field rather than a nested object.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    protected Config(Config config)
    {
        this.mapper = config.mapper;
        this.object = config.object.deepCopy();
    }

    // JsonNode instead of ObjectNode: https://github.com/FasterXML/jackson-databind/issues/941
    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, object);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config setOptional(String key, Optional<?> v)
    {
        if (v.isPresent()) {
            set(key, v.get());
        }
        return this;
    }

    public Config setNested(String key, Config v)
    {
        object.set(key, v.object);
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(this);
    }

    /**
     * Overwrites fields of this config with fields of other. Nested objects are merged recursively.
     */
    public Config merge(Config other)
    {
        mergeJsonObject(object, other.deepCopy().object);
        return this;
    }

    private static void mergeJsonObject(ObjectNode src, ObjectNode other)
    {
        Iterator<Map.Entry<String, JsonNode>> ite = other.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            JsonNode s = src.get(pair.getKey());
            JsonNode v = pair.getValue();
            if (v.isObject() && s != null && s.isObject()) {
                mergeJsonObject((ObjectNode) s, (ObjectNode) v);
            }
            else {
                src.set(pair.getKey(), v);  // keeps order if key exists
            }
        }
    }

    /**
     * Returns the fields whose key starts with prefix, with the prefix stripped.
     * "publish.storage." applied to "publish.storage.prod.type" yields "prod.type".
     */
    public Config extractPrefixed(String prefix)
    {
        Config extracted = new Config(mapper);
        Iterator<Map.Entry<String, JsonNode>> ite = object.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            if (pair.getKey().startsWith(prefix) && pair.getKey().length() > prefix.length()) {
                extracted.object.set(pair.getKey().substring(prefix.length()), pair.getValue().deepCopy());
            }
        }
        return extracted;
    }

    private JsonNode writeObject(Object obj)
    {
        try {
            return mapper.readTree(mapper.writeValueAsString(obj));
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public ConfigFactory getFactory()
    {
        return new ConfigFactory(mapper);
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return object.size() == 0;
    }

    @SuppressWarnings("unchecked")
    public <E> E get(String key, Class<E> type)
    {
        return (E) get(key, mapper.getTypeFactory().constructType(type));
    }

    private Object get(String key, JavaType type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return readObject(type, value, key);
    }

    @SuppressWarnings("unchecked")
    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        return (E) get(key, mapper.getTypeFactory().constructType(type), defaultValue);
    }

    private Object get(String key, JavaType type, Object defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(type, value, key);
    }

    @SuppressWarnings("unchecked")
    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return (Optional<E>) get(key,
                mapper.getTypeFactory().constructReferenceType(Optional.class, mapper.getTypeFactory().constructType(type)),
                Optional.<E>absent());
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getListOrEmpty(String key, Class<E> elementType)
    {
        return (List<E>) get(key, mapper.getTypeFactory().constructCollectionType(List.class, elementType), ImmutableList.<E>of());
    }

    public Config getNested(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    private Object readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        else if (Map.class.isAssignableFrom(raw)) {
            return "object type";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        return json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
