package dev.foodmole.corpus.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.foodmole.corpus.model.ArticleRecord;
import java.util.List;

/** Size statistics of an extracted corpus; tokens are estimated at four characters each */
@JsonPropertyOrder({
	"total_articles",
	"skipped_articles",
	"total_characters",
	"avg_characters",
	"estimated_tokens"
})
public record CorpusStats(
		@JsonProperty("total_articles") int totalArticles,
		@JsonProperty("skipped_articles") int skippedArticles,
		@JsonProperty("total_characters") long totalCharacters,
		@JsonProperty("avg_characters") long avgCharacters,
		@JsonProperty("estimated_tokens") long estimatedTokens) {

	public static final int CHARS_PER_TOKEN = 4;

	public static CorpusStats of(List<ArticleRecord> records, int skipped) {
		long total = records.stream().mapToLong(ArticleRecord::textLength).sum();
		long average = records.isEmpty() ? 0 : total / records.size();
		return new CorpusStats(records.size(), skipped, total, average, total / CHARS_PER_TOKEN);
	}
}
