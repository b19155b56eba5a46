package io.domesday.landholders;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import tech.tablesaw.api.Table;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI that creates the landholder schema and loads one CSV extract into it.
 */
@CommandLine.Command(name = "domesday-load", mixinStandardHelpOptions = true,
        description = "Load the PASE Domesday landholder CSV into a SQLite database")
public final class DomesdayLoadMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DomesdayLoadMain.class);

    static final String STDIN = "-";

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = STDIN,
            description = "CSV file without header; '-' reads standard input (default)")
    String csv;

    @CommandLine.Parameters(index = "1", arity = "0..1",
            description = "SQLite database file (default: domesday.db property, DOMESDAY_DB or " + LoaderConfig.DEFAULT_DATABASE + ")")
    Path database;

    @CommandLine.Option(names = "--strict", description = "Reject rows whose hides are not decimals instead of storing them verbatim")
    boolean strict;

    @CommandLine.Option(names = "--export", description = "Read the loaded table back as a Tablesaw frame and log its shape")
    boolean export;

    private final InputStream stdin;

    public DomesdayLoadMain() {
        this(System.in);
    }

    DomesdayLoadMain(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DomesdayLoadMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        LoaderConfig cfg = LoaderConfig.fromEnv()
                .withDatabase(database)
                .withCoercion(strict ? CoercionMode.STRICT : null);
        try {
            Injector injector = Guice.createInjector(new LandholderModule(cfg));
            try (LandholderStore store = injector.getInstance(LandholderStore.class);
                 Reader reader = open()) {
                LoadResult result = store.bulkLoad(reader);
                log.info("{} now holds {} landholders ({} written this run)",
                        cfg.database(), store.count(), result.recordsWritten());
                if (export) {
                    Table frame = Exporters.tablesaw(store).export();
                    log.info("exported {}", frame.shape());
                }
            }
            return 0;
        } catch (ProvisionException e) {
            log.error("cannot open store {}: {}", cfg.database(), rootMessage(e));
            return 1;
        } catch (DomesdayException e) {
            log.error("load failed: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("cannot read {}: {}", csv, e.getMessage());
            return 1;
        }
    }

    private Reader open() throws IOException {
        if (STDIN.equals(csv)) {
            return new InputStreamReader(stdin, StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(Path.of(csv), StandardCharsets.UTF_8);
    }

    private static String rootMessage(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null) c = c.getCause();
        return c.getMessage();
    }
}
