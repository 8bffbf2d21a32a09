package io.repokeeper.client.config;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import static io.repokeeper.client.config.ConfigUtils.configFactory;
import static io.repokeeper.client.config.ConfigUtils.newConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigTest
{
    private Config config;

    @Before
    public void setUp()
    {
        config = newConfig();
    }

    @Test
    public void testSetGetPrimitives()
    {
        config.set("int", 1);
        config.set("str", "s");
        config.set("bool", true);

        assertThat(config.get("int", int.class), is(1));
        assertThat(config.get("int", Long.class), is(1L));
        assertThat(config.get("str", String.class), is("s"));
        assertThat(config.get("bool", boolean.class), is(true));
    }

    @Test
    public void defaultsAndOptionals()
    {
        assertThat(config.get("missing", int.class, 5), is(5));
        assertThat(config.getOptional("missing", String.class), is(Optional.absent()));
        config.set("present", "v");
        assertThat(config.getOptional("present", String.class), is(Optional.of("v")));
        assertThat(config.getListOrEmpty("missing", String.class), is(ImmutableList.of()));
    }

    @Test
    public void propertiesAreConvertedOnRead()
    {
        Config props = configFactory.fromProperties(ImmutableMap.of(
                    "publish.skip_contents", "true",
                    "task.max_concurrency", "4"));
        assertThat(props.get("publish.skip_contents", boolean.class), is(true));
        assertThat(props.get("task.max_concurrency", int.class), is(4));
    }

    @Test
    public void missingRequiredParameter()
    {
        try {
            config.get("database.type", String.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("'database.type' is required"));
        }
    }

    @Test
    public void conversionErrorNamesTheKey()
    {
        config.set("task.max_concurrency", "many");
        try {
            config.get("task.max_concurrency", int.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("task.max_concurrency"));
            assertThat(ex.getMessage(), containsString("integer (int) type"));
        }
    }

    @Test
    public void extractPrefixed()
    {
        config.set("publish.storage.s3prod.type", "s3");
        config.set("publish.storage.s3prod.bucket", "b");
        config.set("publish.root_dir", "/srv");

        Config storages = config.extractPrefixed("publish.storage.");
        assertThat(storages.getKeys(), contains("s3prod.type", "s3prod.bucket"));
        assertThat(storages.get("s3prod.type", String.class), is("s3"));
    }

    @Test
    public void mergeOverwritesAndKeepsNested()
    {
        config.set("a", 1).setNested("n", newConfig().set("x", 1).set("y", 2));
        Config other = newConfig().set("a", 2).setNested("n", newConfig().set("y", 3));
        config.merge(other);

        assertThat(config.get("a", int.class), is(2));
        assertThat(config.getNested("n").get("x", int.class), is(1));
        assertThat(config.getNested("n").get("y", int.class), is(3));
    }

    @Test
    public void configElementIsImmutable()
    {
        config.set("k", "v");
        ConfigElement element = ConfigElement.copyOf(config);
        config.set("k", "changed");

        Config copy = element.toConfig(configFactory);
        assertThat(copy.get("k", String.class), is("v"));
        copy.set("k", "again");
        assertThat(element.toConfig(configFactory).get("k", String.class), is("v"));
    }
}
