package io.repokeeper.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Map;
import org.immutables.value.Value;

/**
 * A binary package as stored in the package pool.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutablePackageFile.class)
public interface PackageFile
{
    // unique reference, "P<arch> <name> <version> <md5>"
    @Value.Derived
    default String getKey()
    {
        return "P" + getArchitecture() + " " + getName() + " " + getVersion() + " " + getMd5();
    }

    String getName();

    String getVersion();

    String getArchitecture();

    // source package name, the directory of the file in the published pool
    @Value.Default
    default String getSource()
    {
        return getName();
    }

    String getFilename();

    // location of the file inside the package pool
    String getPoolPath();

    long getSize();

    String getMd5();

    String getSha1();

    String getSha256();

    // remaining control file fields, in control file order
    Map<String, String> getControlFields();

    static ImmutablePackageFile.Builder builder()
    {
        return ImmutablePackageFile.builder();
    }
}
