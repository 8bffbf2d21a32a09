package io.repokeeper.core;

import com.google.inject.Binder;
import com.google.inject.Module;
import io.repokeeper.spi.Extension;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the modules of every {@link Extension} registered in
 * META-INF/services.
 */
public class ExtensionServiceLoaderModule
        implements Module
{
    private static final Logger logger = LoggerFactory.getLogger(ExtensionServiceLoaderModule.class);

    private final ClassLoader classLoader;

    public ExtensionServiceLoaderModule()
    {
        this(ExtensionServiceLoaderModule.class.getClassLoader());
    }

    public ExtensionServiceLoaderModule(ClassLoader classLoader)
    {
        this.classLoader = classLoader;
    }

    @Override
    public void configure(Binder binder)
    {
        ServiceLoader<Extension> serviceLoader = ServiceLoader.load(Extension.class, classLoader);
        for (Extension extension : serviceLoader) {
            logger.debug("Loading extension {}", extension.getClass().getName());
            for (Module module : extension.getModules()) {
                module.configure(binder);
            }
        }
    }
}
