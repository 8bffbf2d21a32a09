package io.repokeeper.client.config;

import java.io.IOException;
import java.util.Map;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config create(Object other)
    {
        return create().set("_", other).getNested("_");
    }

    public Config fromJsonString(String json)
    {
        try {
            return new Config(objectMapper, objectMapper.readTree(json));
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
    }

    /**
     * Builds a flat config from string properties such as "publish.root_dir=/srv/repo".
     * Keys are kept as they are; dots are not interpreted as nesting.
     */
    public Config fromProperties(Map<String, String> properties)
    {
        Config config = create();
        for (Map.Entry<String, String> pair : properties.entrySet()) {
            config.set(pair.getKey(), pair.getValue());
        }
        return config;
    }
}
