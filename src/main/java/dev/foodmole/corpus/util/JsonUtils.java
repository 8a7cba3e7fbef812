package dev.foodmole.corpus.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/** Shared Jackson mappers for checkpoint, article list and corpus files */
public class JsonUtils {

	private static final ObjectMapper readMapper = JsonMapper.builder()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	// One object per line, never closes the target so JSONL writers can keep going
	private static final ObjectMapper lineMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.build();

	private static final ObjectMapper prettyMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private JsonUtils() {}

	public static ObjectMapper reader() {
		return readMapper;
	}

	public static <T> T read(Path file, Class<T> type) throws IOException {
		return readMapper.readValue(file.toFile(), type);
	}

	/** Serialize a value as a single compact line (no trailing newline) */
	public static void writeLine(Writer writer, Object value) throws IOException {
		lineMapper.writeValue(writer, value);
	}

	public static String toJson(Object value) throws IOException {
		return lineMapper.writeValueAsString(value);
	}

	public static String toPrettyJson(Object value) throws IOException {
		return prettyMapper.writeValueAsString(value);
	}
}
