package cli;

import app.AutoConsolidatorCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Kept tiny so that the manifest main class stays stable; the work happens in
 * {@link AutoConsolidatorCliApp}.</p>
 */
public class AutoConsolidatorCli {

    public static void main(String[] args) {
        System.exit(AutoConsolidatorCliApp.run(args, System.out));
    }
}
