package io.repokeeper.core.publish;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class PublishPrefixTest
{
    @Test
    public void parsesStorageAtLastColon()
    {
        assertThat(PublishPrefix.parse("debian"), is(PublishPrefix.of("", "debian")));
        assertThat(PublishPrefix.parse("filesystem:www:debian"), is(PublishPrefix.of("filesystem:www", "debian")));
        assertThat(PublishPrefix.parse("s3:bucket:"), is(PublishPrefix.of("s3:bucket", ".")));
    }

    @Test
    public void trimsSlashes()
    {
        assertThat(PublishPrefix.parse("/debian/").getPrefix(), is("debian"));
        assertThat(PublishPrefix.parse("ppa/team").getPrefix(), is("ppa/team"));
        assertThat(PublishPrefix.parse("/").getPrefix(), is("."));
        assertThat(PublishPrefix.parse("").getPrefix(), is("."));
    }

    @Test
    public void unescapesUrlForm()
    {
        assertThat(PublishPrefix.unescape("ppa_team"), is("ppa/team"));
        assertThat(PublishPrefix.unescape("my__repo_x"), is("my_repo/x"));
        assertThat(PublishPrefix.unescape(""), is("."));
        assertThat(PublishPrefix.parseEscaped("s3:bucket:ppa_my__team"), is(PublishPrefix.of("s3:bucket", "ppa/my_team")));
    }

    @Test
    public void printsStoragePrefix()
    {
        assertThat(PublishPrefix.of("", "debian").toString(), is("debian"));
        assertThat(PublishPrefix.of("s3:bucket", ".").toString(), is("s3:bucket:."));
    }
}
