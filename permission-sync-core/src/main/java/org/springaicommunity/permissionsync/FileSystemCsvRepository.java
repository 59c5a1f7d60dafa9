package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * File system implementation of {@link PermissionCsvRepository}.
 *
 * <p>
 * Files are UTF-8 with a header row. Columns are matched by header name on read, so
 * column order and extra columns do not matter. Parent directories are created on write.
 */
public class FileSystemCsvRepository implements PermissionCsvRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCsvRepository.class);

	private final CsvMapper csvMapper;

	public FileSystemCsvRepository(CsvMapper csvMapper) {
		this.csvMapper = csvMapper;
	}

	@Override
	public List<UserPermissionRow> readUserPermissions(Path file) {
		return read(file, UserPermissionRow.class);
	}

	@Override
	public List<GroupPermissionRow> readGroupPermissions(Path file) {
		return read(file, GroupPermissionRow.class);
	}

	@Override
	public List<GroupMemberRow> readGroupMembers(Path file) {
		return read(file, GroupMemberRow.class);
	}

	@Override
	public List<EffectivePermissionRow> readEffectivePermissions(Path file) {
		return read(file, EffectivePermissionRow.class);
	}

	@Override
	public List<LoginMappingRow> readLoginMappings(Path file) {
		return read(file, LoginMappingRow.class);
	}

	@Override
	public void writeUserPermissions(Path file, List<UserPermissionRow> rows) {
		write(file, UserPermissionRow.class, rows);
	}

	@Override
	public void writeGroupPermissions(Path file, List<GroupPermissionRow> rows) {
		write(file, GroupPermissionRow.class, rows);
	}

	@Override
	public void writeGroupMembers(Path file, List<GroupMemberRow> rows) {
		write(file, GroupMemberRow.class, rows);
	}

	@Override
	public void writeEffectivePermissions(Path file, List<EffectivePermissionRow> rows) {
		write(file, EffectivePermissionRow.class, rows);
	}

	private <T> List<T> read(Path file, Class<T> rowType) {
		CsvSchema schema = CsvSchema.emptySchema().withHeader();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
				MappingIterator<T> rows = csvMapper.readerFor(rowType).with(schema).readValues(reader)) {
			List<T> result = rows.readAll();
			logger.debug("Read {} rows from {}", result.size(), file);
			return result;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read CSV file: " + file, e);
		}
	}

	private <T> void write(Path file, Class<T> rowType, List<T> rows) {
		CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			if (rows.isEmpty()) {
				// the generator only emits the header together with the first row
				Files.writeString(file, headerLine(schema), StandardCharsets.UTF_8);
			}
			else {
				try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
						SequenceWriter sequence = csvMapper.writerFor(rowType).with(schema).writeValues(writer)) {
					sequence.writeAll(rows);
				}
			}
			logger.info("Wrote {} rows to {}", rows.size(), file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write CSV file: " + file, e);
		}
	}

	private static String headerLine(CsvSchema schema) {
		List<String> names = new ArrayList<>();
		for (CsvSchema.Column column : schema) {
			names.add(column.getName());
		}
		return String.join(",", names) + "\n";
	}

}
