package io.repokeeper.core.publish;

import io.repokeeper.core.repository.ResourceKeys;
import org.immutables.value.Value;

/**
 * Storage and prefix parsed from a "[storage:]prefix" parameter.
 *
 * The storage part ends at the last ':', so "s3:bucket:debian" names the
 * storage "s3:bucket" and the prefix "debian".
 */
@Value.Immutable
public abstract class PublishPrefix
{
    @Value.Parameter
    public abstract String getStorage();

    @Value.Parameter
    public abstract String getPrefix();

    public static PublishPrefix of(String storage, String prefix)
    {
        return ImmutablePublishPrefix.of(storage, prefix);
    }

    public static PublishPrefix parse(String param)
    {
        String storage;
        String prefix;
        int i = param.lastIndexOf(':');
        if (i >= 0) {
            storage = param.substring(0, i);
            prefix = param.substring(i + 1);
        }
        else {
            storage = "";
            prefix = param;
        }
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        if (prefix.startsWith("/")) {
            prefix = prefix.substring(1);
        }
        if (prefix.isEmpty()) {
            prefix = ".";
        }
        return of(storage, prefix);
    }

    /**
     * Parses the form used in URL paths where '/' is written as '_' and '_'
     * as '__'.
     */
    public static PublishPrefix parseEscaped(String escaped)
    {
        return parse(unescape(escaped));
    }

    public static String unescape(String escaped)
    {
        StringBuilder sb = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '_') {
                if (i + 1 < escaped.length() && escaped.charAt(i + 1) == '_') {
                    sb.append('_');
                    i++;
                }
                else {
                    sb.append('/');
                }
            }
            else {
                sb.append(c);
            }
        }
        if (sb.length() == 0) {
            return ".";
        }
        return sb.toString();
    }

    @Override
    public String toString()
    {
        return ResourceKeys.storagePrefix(getStorage(), getPrefix());
    }
}
