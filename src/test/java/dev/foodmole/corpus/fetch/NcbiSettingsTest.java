package dev.foodmole.corpus.fetch;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NcbiSettingsTest {

	@Test
	void testDefaults() {
		// When
		NcbiSettings settings = new NcbiSettings("curator@example.org", null, null, null, null);

		// Then
		assertThat(settings.tool()).isEqualTo(NcbiSettings.DEFAULT_TOOL);
		assertThat(settings.baseUrl()).isEqualTo(NcbiSettings.DEFAULT_BASE_URL);
		assertThat(settings.requestTimeout()).isPositive();
		assertThat(settings.hasApiKey()).isFalse();
		assertThat(settings.defaultRequestsPerSecond()).isEqualTo(NcbiSettings.RATE_WITHOUT_API_KEY);
	}

	@Test
	void testApiKeyRaisesRate() {
		// When
		NcbiSettings settings = new NcbiSettings("curator@example.org", null, "abc123", null, null);

		// Then
		assertThat(settings.hasApiKey()).isTrue();
		assertThat(settings.defaultRequestsPerSecond()).isEqualTo(NcbiSettings.RATE_WITH_API_KEY);
	}

	@Test
	void testPlaceholderApiKeyIsIgnored() {
		assertThat(new NcbiSettings("a@b.org", null, "your_api_key_here", null, null).hasApiKey())
				.isFalse();
		assertThat(new NcbiSettings("a@b.org", null, "  ", null, null).hasApiKey()).isFalse();
	}

	@Test
	void testValidEmailPasses() {
		NcbiSettings settings = new NcbiSettings("curator@example.org", null, null, null, null);

		assertThatCode(settings::validate).doesNotThrowAnyException();
	}

	@Test
	void testMissingOrPlaceholderEmailIsRejected() {
		for (String email : new String[] {null, "", "   ", "your_email@example.com", "YOUR_EMAIL@EXAMPLE.COM"}) {
			NcbiSettings settings = new NcbiSettings(email, null, null, null, null);

			assertThatThrownBy(settings::validate)
					.as("email %s", email)
					.isInstanceOf(FetchConfigurationException.class)
					.hasMessageContaining("e-mail");
		}
	}
}
