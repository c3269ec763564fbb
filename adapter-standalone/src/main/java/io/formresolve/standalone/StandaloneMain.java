package io.formresolve.standalone;

import io.formresolve.standalone.server.FormServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone form service. Delegates to {@link FormServerApp#start(String[])};
 * on failure it logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /** @param args command-line arguments (e.g. {@code --config path/to/form-resolve.yaml}) */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            FormServerApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
