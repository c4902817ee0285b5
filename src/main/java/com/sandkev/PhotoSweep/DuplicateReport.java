package com.sandkev.PhotoSweep;

import com.google.common.collect.ListMultimap;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.h2.tools.Csv;
import org.h2.tools.SimpleResultSet;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * CSV listing of every duplicate class member with a keep flag for the survivor.
 * Written before anything is moved so the decisions can be reviewed afterwards.
 */
@Slf4j
public class DuplicateReport {

    static final String[] COLUMNS = {"KIND", "FINGERPRINT", "PATH", "SIZE", "KEEP"};

    @Value
    public static class Row {
        FileKind kind;
        String fingerprint;
        Path path;
        long size;
        boolean keep;
    }

    public void write(Path reportFile, ListMultimap<HashKey, FileRecord> duplicateClasses, RetentionStrategy strategy) throws IOException {
        SimpleResultSet rs = new SimpleResultSet();
        rs.addColumn(COLUMNS[0], Types.VARCHAR, 16, 0);
        rs.addColumn(COLUMNS[1], Types.VARCHAR, 64, 0);
        rs.addColumn(COLUMNS[2], Types.VARCHAR, 4096, 0);
        rs.addColumn(COLUMNS[3], Types.BIGINT, 19, 0);
        rs.addColumn(COLUMNS[4], Types.INTEGER, 1, 0);

        int rows = 0;
        for (Map.Entry<HashKey, Collection<FileRecord>> entry : duplicateClasses.asMap().entrySet()) {
            HashKey key = entry.getKey();
            FileRecord keep = strategy.survivor(entry.getValue());
            for (FileRecord record : entry.getValue()) {
                rs.addRow(key.getKind().name(), key.getHashHex(), record.getPath().toString(), record.getSize(), record == keep ? 1 : 0);
                rows++;
            }
        }

        try (Writer writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8)) {
            new Csv().write(writer, rs);
        } catch (SQLException e) {
            throw new IOException("failed to write report " + reportFile, e);
        }
        log.info("wrote {} rows to duplicate report {}", rows, reportFile);
    }

    public List<Row> read(Path reportFile) throws IOException {
        List<Row> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(reportFile, StandardCharsets.UTF_8)) {
            ResultSet rs = new Csv().read(reader, null);
            while (rs.next()) {
                rows.add(new Row(
                        FileKind.valueOf(rs.getString(COLUMNS[0])),
                        rs.getString(COLUMNS[1]),
                        Paths.get(rs.getString(COLUMNS[2])),
                        Long.parseLong(rs.getString(COLUMNS[3])),
                        "1".equals(rs.getString(COLUMNS[4]))));
            }
        } catch (SQLException e) {
            throw new IOException("failed to read report " + reportFile, e);
        }
        return rows;
    }
}
