package ch.so.agi.lspbridge.client;

import ch.so.agi.lspbridge.config.LanguageServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Starts language servers as child processes. The command line is passed to
 * {@link ProcessBuilder} as a list, so no shell ever interprets it.
 */
public final class SubprocessLauncher implements ServerProcessLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(SubprocessLauncher.class);

    @Override
    public ServerProcess launch(LanguageServerConfig config, Path workingDirectory) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDirectory.toFile());
        builder.redirectErrorStream(false);

        LOG.info("Starting {} in {}", String.join(" ", command), workingDirectory);
        return new ChildProcess(builder.start());
    }

    private static final class ChildProcess implements ServerProcess {
        private final Process process;

        ChildProcess(Process process) {
            this.process = process;
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
