package dev.foodmole.corpus.util;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpUtilsTest {

	@Test
	void testWithQuery() {
		// Given
		Map<String, String> params = new LinkedHashMap<>();
		params.put("db", "pmc");
		params.put("email", "a b@example.org");
		params.put("api_key", null);

		// When/Then
		assertThat(HttpUtils.withQuery("https://host/efetch.fcgi", params))
				.isEqualTo("https://host/efetch.fcgi?db=pmc&email=a+b%40example.org");
		assertThat(HttpUtils.withQuery("https://host/x?a=1", Map.of("b", "2"))).isEqualTo("https://host/x?a=1&b=2");
		assertThat(HttpUtils.withQuery("https://host/x", Map.of())).isEqualTo("https://host/x");
	}
}
