package io.repokeeper.core.publish;

import com.google.common.collect.ImmutableList;
import io.repokeeper.client.api.RestPublishUpdateRequest;
import io.repokeeper.client.api.RestSourceBinding;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class SourceBindingsTest
{
    @Test
    public void absentListsMeanRefresh()
    {
        SourceBindings bindings = SourceBindings.fromUpdate(RestPublishUpdateRequest.builder().build());
        assertThat(bindings.isRefresh(), is(true));
        assertThat(bindings.isLegacyInput(), is(false));
        assertThat(bindings.getBindings(), is(empty()));
    }

    @Test
    @SuppressWarnings("deprecation")
    public void sourcesWinOverSnapshots()
    {
        SourceBindings bindings = SourceBindings.fromUpdate(RestPublishUpdateRequest.builder()
                .sources(ImmutableList.of(RestSourceBinding.of("main", "snap2")))
                .snapshots(ImmutableList.of(RestSourceBinding.of("main", "snap1")))
                .build());
        assertThat(bindings.isLegacyInput(), is(false));
        assertThat(bindings.getBindings(), contains(RestSourceBinding.of("main", "snap2")));
    }

    @Test
    @SuppressWarnings("deprecation")
    public void snapshotsAreLegacyInput()
    {
        SourceBindings bindings = SourceBindings.fromUpdate(RestPublishUpdateRequest.builder()
                .snapshots(ImmutableList.of(RestSourceBinding.of("main", "snap1")))
                .build());
        assertThat(bindings.isRefresh(), is(false));
        assertThat(bindings.isLegacyInput(), is(true));

        List<String> lines = new ArrayList<>();
        bindings.warnIfLegacy(lines::add);
        assertThat(lines, contains("Warning: Snapshots is deprecated, use Sources instead"));
    }

    @Test
    public void emptySourcesListIsNotRefresh()
    {
        SourceBindings bindings = SourceBindings.fromUpdate(RestPublishUpdateRequest.builder()
                .sources(ImmutableList.of())
                .build());
        assertThat(bindings.isRefresh(), is(false));
        List<String> lines = new ArrayList<>();
        bindings.warnIfLegacy(lines::add);
        assertThat(lines, is(empty()));
    }
}
