package io.domesday.landholders;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.domesday.core.BatchSink;
import io.domesday.core.Record;
import io.domesday.core.Source;
import io.domesday.runtime.PipelineBuilder;
import io.domesday.runtime.RunSummary;
import io.domesday.source.CsvRowSource;
import io.domesday.source.IterableSource;
import io.domesday.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite store of landholders keyed by PASE name, with an FTS4 index over name, PASE name and
 * description.
 * <p>
 * The schema is created when the store is opened. Each bulk load is one transaction: rows are
 * repaired and parsed first, then every record is upserted and the search index rebuilt. Any failure
 * rolls the whole load back. Not safe for concurrent use.
 */
public class LandholderStore implements BatchSink<Landholder>, AutoCloseable {
    public static final String RECORDS_WRITTEN = "landholders.records.written";

    private static final Logger log = LoggerFactory.getLogger(LandholderStore.class);

    private final Path database;
    private final Connection connection;
    private final CoercionMode mode;
    private final MetricRegistry registry;
    private final Counter written;

    public LandholderStore(Path database) {
        this(database, CoercionMode.LENIENT, new MetricRegistry());
    }

    public LandholderStore(Path database, CoercionMode mode, MetricRegistry registry) {
        this.database = database;
        this.mode = mode;
        this.registry = registry;
        this.written = registry.counter(RECORDS_WRITTEN);
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + database);
        } catch (SQLException e) {
            throw new StorageException("cannot open " + database, e);
        }
        try {
            createSchema();
        } catch (StorageException e) {
            closeQuietly(e);
            throw e;
        }
    }

    public Path database() {
        return database;
    }

    /** Create the table, search index and gender index if they are missing. Safe to repeat. */
    public void createSchema() {
        try (Statement s = connection.createStatement()) {
            for (String ddl : LandholderSchema.DDL) {
                s.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new StorageException("cannot create schema in " + database, e);
        }
    }

    /** Load headerless CSV text. The reader is closed once it has been read. */
    public LoadResult bulkLoad(Reader csv) throws IOException {
        return load(new CsvRowSource(csv));
    }

    /** Load rows that have already been split into fields. */
    public LoadResult bulkLoad(Iterable<List<String>> rows) {
        try {
            return load(new IterableSource<>(rows));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private LoadResult load(Source<List<String>> rows) throws IOException {
        long repairedBefore = registry.counter(RowRepair.ROWS_REPAIRED).getCount();
        long lenientBefore = registry.counter(LandholderParser.LENIENT_DECIMALS).getCount();
        log.info("loading landholders into {}", database);
        RunSummary summary;
        try {
            summary = new PipelineBuilder<List<String>, Landholder>()
                    .source(rows)
                    .transform(TransformChain.of(new RowRepair(registry), new LandholderParser(mode, registry)))
                    .sink(this)
                    .metrics(registry)
                    .build()
                    .run();
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageException("load into " + database + " failed", e);
        }
        LoadResult result = new LoadResult(
                summary.recordsIn(),
                summary.recordsOut(),
                registry.counter(RowRepair.ROWS_REPAIRED).getCount() - repairedBefore,
                registry.counter(LandholderParser.LENIENT_DECIMALS).getCount() - lenientBefore,
                summary.elapsed());
        log.info("loaded {} rows ({} repaired, {} with raw hides) in {} ms", result.rowsRead(),
                result.rowsRepaired(), result.lenientDecimals(), result.elapsed().toMillis());
        return result;
    }

    /**
     * Upsert every record and rebuild the search index in a single transaction. A key already
     * stored, or repeated within the batch, is overwritten whole by the later record.
     */
    @Override
    public void acceptBatch(List<Record<Landholder>> records) {
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement update = connection.prepareStatement(LandholderSchema.UPDATE);
                 PreparedStatement insert = connection.prepareStatement(LandholderSchema.INSERT);
                 Statement rebuild = connection.createStatement()) {
                for (Record<Landholder> r : records) {
                    upsert(update, insert, r.payload());
                }
                rebuild.executeUpdate(LandholderSchema.REBUILD_FTS);
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("cannot write to " + database, e);
        }
        written.inc(records.size());
    }

    private static void upsert(PreparedStatement update, PreparedStatement insert, Landholder l) throws SQLException {
        int i = 1;
        for (LandholderField f : LandholderSchema.UPDATE_ORDER) {
            update.setString(i++, encode(l, f));
        }
        update.setString(i, l.paseName());
        if (update.executeUpdate() > 0) return;

        i = 1;
        for (LandholderField f : LandholderField.values()) {
            insert.setString(i++, encode(l, f));
        }
        insert.executeUpdate();
    }

    private static String encode(Landholder l, LandholderField f) {
        Object value = l.get(f);
        return value instanceof Hides h ? DecimalCodec.encode(h) : (String) value;
    }

    public Optional<Landholder> findByPaseName(String paseName) {
        try (PreparedStatement ps = connection.prepareStatement(LandholderSchema.SELECT_BY_KEY)) {
            ps.setString(1, paseName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("cannot read " + paseName + " from " + database, e);
        }
    }

    /** Every stored landholder, ordered by PASE name. */
    public List<Landholder> findAll() {
        List<Landholder> out = new ArrayList<>();
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery(LandholderSchema.SELECT_ALL)) {
            while (rs.next()) {
                out.add(map(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("cannot read " + database, e);
        }
        return out;
    }

    public long count() {
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery(LandholderSchema.COUNT)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new StorageException("cannot count rows in " + database, e);
        }
    }

    /**
     * PASE names whose name, PASE name or description match an FTS4 query, in key order.
     */
    public List<String> search(String query) {
        List<String> keys = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(LandholderSchema.SEARCH)) {
            ps.setString(1, query);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("search for '" + query + "' failed", e);
        }
        return keys;
    }

    private static Landholder map(ResultSet rs) throws SQLException {
        return new Landholder(
                rs.getString("name"),
                rs.getString("gender"),
                rs.getString("pase_name"),
                rs.getString("description"),
                DecimalCodec.decode(rs.getString("holder_1066")),
                DecimalCodec.decode(rs.getString("lord_1066")),
                DecimalCodec.decode(rs.getString("demesne_1086")),
                DecimalCodec.decode(rs.getString("subtenanted_1086")),
                DecimalCodec.decode(rs.getString("subtenant_1086")),
                rs.getString("editor"),
                rs.getString("editorial_status"));
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StorageException("cannot close " + database, e);
        }
    }

    private void closeQuietly(Exception primary) {
        try {
            connection.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
