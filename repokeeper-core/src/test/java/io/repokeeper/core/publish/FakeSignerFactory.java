package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import io.repokeeper.spi.SignerFactory;
import io.repokeeper.spi.SigningOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Signer writing marker text instead of OpenPGP signatures.
 */
public class FakeSignerFactory
        implements SignerFactory
{
    public static final String SIGNATURE = "-----BEGIN PGP SIGNATURE-----\n";
    public static final String CLEARSIGN_HEADER = "-----BEGIN PGP SIGNED MESSAGE-----\n";

    private volatile boolean failInit;
    private volatile SigningOptions lastOptions;

    public void setFailInit(boolean failInit)
    {
        this.failInit = failInit;
    }

    public Optional<SigningOptions> getLastOptions()
    {
        return Optional.fromNullable(lastOptions);
    }

    @Override
    public Signer newSigner(SigningOptions options)
    {
        lastOptions = options;
        return new Signer()
        {
            @Override
            public void init()
                throws SignerException
            {
                if (failInit) {
                    throw new SignerException("gpg: no default secret key: No secret key");
                }
            }

            @Override
            public void detachedSign(Path source, Path signature)
                throws SignerException
            {
                write(signature, SIGNATURE);
            }

            @Override
            public void clearSign(Path source, Path destination)
                throws SignerException
            {
                try {
                    write(destination, CLEARSIGN_HEADER + new String(Files.readAllBytes(source), UTF_8) + SIGNATURE);
                }
                catch (IOException ex) {
                    throw new SignerException("unable to read " + source, ex);
                }
            }
        };
    }

    private static void write(Path path, String content)
        throws SignerException
    {
        try {
            Files.write(path, content.getBytes(UTF_8));
        }
        catch (IOException ex) {
            throw new SignerException("unable to write " + path, ex);
        }
    }
}
