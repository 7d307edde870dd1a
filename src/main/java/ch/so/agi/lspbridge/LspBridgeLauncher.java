package ch.so.agi.lspbridge;

import ch.so.agi.lspbridge.config.BridgeSettings;
import ch.so.agi.lspbridge.router.LanguageIntelligence;
import ch.so.agi.lspbridge.tools.LanguageToolHandlers;
import ch.so.agi.lspbridge.tools.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

public class LspBridgeLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(LspBridgeLauncher.class);

    public static void main(String[] args) throws IOException {
        BridgeSettings settings = BridgeSettings.load(System.getenv());
        LOG.info("Starting with {}", settings);

        LanguageIntelligence context = LanguageIntelligence.create(settings);
        AtomicBoolean closed = new AtomicBoolean();
        Runnable closeOnce = () -> {
            if (closed.compareAndSet(false, true)) {
                context.close();
            }
        };
        // SIGINT/SIGTERM run the hook; EOF on stdin closes directly
        Runtime.getRuntime().addShutdownHook(new Thread(closeOnce, "lsp-bridge-shutdown"));

        ToolDispatcher dispatcher = new ToolDispatcher(new LanguageToolHandlers(context.getRouter(), context.getSettings()));
        try {
            dispatcher.serve(System.in, System.out);
        } finally {
            closeOnce.run();
        }
    }
}
