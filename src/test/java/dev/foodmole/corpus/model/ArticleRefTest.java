package dev.foodmole.corpus.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ArticleRefTest {

	@Test
	void testPmcNumberIsDerived() {
		// When
		ArticleRef ref = ArticleRef.of("PMC123456", "98765", "Food Chem. 2020", "CC BY");

		// Then
		assertThat(ref.pmcNum()).isEqualTo("123456");
	}

	@Test
	void testIdentifierWithoutPrefix() {
		assertThat(ArticleRef.of("123", "", "", "").pmcNum()).isEqualTo("123");
	}

	@Test
	void testToWorkItem() {
		// When
		WorkItem item = ArticleRef.of("PMC42", "1", "Nutrients. 2021", "CC BY").toWorkItem();

		// Then
		assertThat(item.identifier()).isEqualTo("PMC42");
		assertThat(item.remoteId()).isEqualTo("42");
		assertThat(item.artifactPath()).isNull();
	}

	@Test
	void testToWorkItemWithoutPmcNumber() {
		// When
		WorkItem item = new ArticleRef("PMC42", null, null, null, null).toWorkItem();

		// Then
		assertThat(item.remoteId()).isEqualTo("42");
	}
}
