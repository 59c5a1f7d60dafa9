package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * The JSON mapper reads Bitbucket responses as trees. The CSV mapper reads and writes the
 * row records of the pipeline files and ignores columns it does not know.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} for Bitbucket responses.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		return new ObjectMapper();
	}

	/**
	 * Create a new {@link CsvMapper} for the pipeline CSV files.
	 * @return configured CsvMapper
	 */
	public static CsvMapper createCsvMapper() {
		CsvMapper mapper = new CsvMapper();
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

}
