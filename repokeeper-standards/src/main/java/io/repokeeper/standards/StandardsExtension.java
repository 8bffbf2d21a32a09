package io.repokeeper.standards;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Module;
import io.repokeeper.spi.Extension;

public class StandardsExtension
        implements Extension
{
    @Override
    public List<Module> getModules()
    {
        return ImmutableList.of(
                new PublishStandardsModule()
                );
    }
}
