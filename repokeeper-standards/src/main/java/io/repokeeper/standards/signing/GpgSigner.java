package io.repokeeper.standards.signing;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import io.repokeeper.spi.SigningOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Signs Release files by running the gpg command line tool.
 */
public class GpgSigner
        implements Signer
{
    private static final Logger logger = LoggerFactory.getLogger(GpgSigner.class);

    private final String gpgCommand;
    private final SigningOptions options;

    public GpgSigner(String gpgCommand, SigningOptions options)
    {
        this.gpgCommand = gpgCommand;
        this.options = options;
    }

    @Override
    public void init()
        throws SignerException
    {
        ImmutableList.Builder<String> args = ImmutableList.<String>builder()
            .addAll(baseArguments())
            .add("--list-secret-keys");
        if (options.getGpgKey().isPresent()) {
            args.add(options.getGpgKey().get());
        }
        run(args.build(), "unable to find secret key");
    }

    @Override
    public void detachedSign(Path source, Path signature)
        throws SignerException
    {
        List<String> args = ImmutableList.<String>builder()
            .addAll(signingArguments())
            .add("-o", signature.toString())
            .add("--armor", "--yes", "--detach-sign")
            .add(source.toString())
            .build();
        run(args, "unable to sign " + source.getFileName());
    }

    @Override
    public void clearSign(Path source, Path destination)
        throws SignerException
    {
        List<String> args = ImmutableList.<String>builder()
            .addAll(signingArguments())
            .add("-o", destination.toString())
            .add("--yes", "--clearsign")
            .add(source.toString())
            .build();
        run(args, "unable to clearsign " + source.getFileName());
    }

    @SuppressWarnings("deprecation")
    List<String> baseArguments()
    {
        ImmutableList.Builder<String> args = ImmutableList.builder();
        args.add(gpgCommand, "--no-auto-check-trustdb");
        if (options.getBatch()) {
            args.add("--batch", "--no-tty");
        }
        if (options.getKeyring().isPresent()) {
            args.add("--no-default-keyring", "--keyring", options.getKeyring().get());
        }
        if (options.getSecretKeyring().isPresent()) {
            args.add("--secret-keyring", options.getSecretKeyring().get());
        }
        return args.build();
    }

    List<String> signingArguments()
    {
        ImmutableList.Builder<String> args = ImmutableList.<String>builder()
            .addAll(baseArguments())
            .add("--digest-algo", "SHA256");
        if (options.getGpgKey().isPresent()) {
            args.add("-u", options.getGpgKey().get());
        }
        if (options.getPassphrase().isPresent() || options.getPassphraseFile().isPresent()) {
            args.add("--pinentry-mode", "loopback");
        }
        if (options.getPassphrase().isPresent()) {
            args.add("--passphrase", options.getPassphrase().get());
        }
        if (options.getPassphraseFile().isPresent()) {
            args.add("--passphrase-file", options.getPassphraseFile().get());
        }
        return args.build();
    }

    private void run(List<String> args, String errorMessage)
        throws SignerException
    {
        logger.debug("Running {} {}", gpgCommand, args.size() > 1 ? args.get(args.size() - 1) : "");

        ProcessBuilder pb = new ProcessBuilder(args);
        pb.redirectErrorStream(true);

        String output;
        int exitCode;
        try {
            Process p = pb.start();
            p.getOutputStream().close();
            try (InputStream in = p.getInputStream()) {
                output = new String(ByteStreams.toByteArray(in), UTF_8).trim();
            }
            exitCode = p.waitFor();
        }
        catch (IOException ex) {
            throw new SignerException(errorMessage + ": failed to run " + gpgCommand, ex);
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SignerException(errorMessage + ": interrupted", ex);
        }

        if (exitCode != 0) {
            throw new SignerException(errorMessage + ": " + gpgCommand + " exited with code " + exitCode
                    + (output.isEmpty() ? "" : ": " + output));
        }
    }
}
