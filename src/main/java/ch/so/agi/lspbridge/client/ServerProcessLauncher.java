package ch.so.agi.lspbridge.client;

import ch.so.agi.lspbridge.config.LanguageServerConfig;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface ServerProcessLauncher {

    ServerProcess launch(LanguageServerConfig config, Path workingDirectory) throws IOException;
}
