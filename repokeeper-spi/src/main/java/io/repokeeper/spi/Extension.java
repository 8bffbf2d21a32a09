package io.repokeeper.spi;

import java.util.List;
import com.google.inject.Module;

/**
 * Plugs Guice modules into the embedded runtime.
 *
 * Implementations are found with java.util.ServiceLoader, so a jar providing
 * one lists its class name in META-INF/services/io.repokeeper.spi.Extension.
 */
public interface Extension
{
    List<Module> getModules();
}
