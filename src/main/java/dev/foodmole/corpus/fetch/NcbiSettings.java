package dev.foodmole.corpus.fetch;

import java.time.Duration;
import java.util.Set;

/**
 * Credentials and endpoint for the NCBI E-utilities.
 *
 * @param email contact address NCBI requires on every request
 * @param tool tool name reported to NCBI
 * @param apiKey optional API key, raising the allowed rate from 3 to 10 requests per second
 * @param baseUrl E-utilities base URL
 * @param requestTimeout timeout of a single efetch call
 */
public record NcbiSettings(String email, String tool, String apiKey, String baseUrl, Duration requestTimeout) {

	public static final String DEFAULT_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
	public static final String DEFAULT_TOOL = "pmc-corpus";

	/** Requests per second kept just under the NCBI limits */
	public static final double RATE_WITH_API_KEY = 9.0;

	public static final double RATE_WITHOUT_API_KEY = 3.0;

	private static final Set<String> PLACEHOLDER_EMAILS = Set.of("your_email@example.com", "your_email_here");
	private static final String PLACEHOLDER_API_KEY = "your_api_key_here";

	public NcbiSettings {
		if (apiKey != null && (apiKey.isBlank() || PLACEHOLDER_API_KEY.equalsIgnoreCase(apiKey.trim()))) {
			apiKey = null;
		}
		if (tool == null || tool.isBlank()) {
			tool = DEFAULT_TOOL;
		}
		if (baseUrl == null || baseUrl.isBlank()) {
			baseUrl = DEFAULT_BASE_URL;
		}
		if (requestTimeout == null) {
			requestTimeout = Duration.ofSeconds(60);
		}
	}

	public boolean hasApiKey() {
		return apiKey != null;
	}

	public double defaultRequestsPerSecond() {
		return hasApiKey() ? RATE_WITH_API_KEY : RATE_WITHOUT_API_KEY;
	}

	/** Check that a real contact e-mail is configured */
	public void validate() throws FetchConfigurationException {
		if (email == null || email.isBlank() || PLACEHOLDER_EMAILS.contains(email.trim().toLowerCase())) {
			throw new FetchConfigurationException(
					"An NCBI contact e-mail is required: pass --email or set NCBI_EMAIL");
		}
	}
}
