package dev.foodmole.corpus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable snapshot of which identifiers were fetched and which failed. The two sets are always
 * disjoint: an identifier present in both is kept as downloaded.
 */
@JsonPropertyOrder({"downloaded", "failed", "last_updated"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressRecord(
		@JsonProperty("downloaded") Set<String> downloaded,
		@JsonProperty("failed") Set<String> failed,
		@JsonProperty("last_updated") String lastUpdated) {

	@JsonCreator
	public ProgressRecord {
		TreeSet<String> done = copy(downloaded);
		TreeSet<String> failures = copy(failed);
		failures.removeAll(done);
		downloaded = Collections.unmodifiableSortedSet(done);
		failed = Collections.unmodifiableSortedSet(failures);
	}

	public static ProgressRecord empty() {
		return new ProgressRecord(Set.of(), Set.of(), null);
	}

	public static ProgressRecord of(Collection<String> downloaded, Collection<String> failed, String lastUpdated) {
		return new ProgressRecord(new TreeSet<>(downloaded), new TreeSet<>(failed), lastUpdated);
	}

	public ProgressRecord withLastUpdated(String timestamp) {
		return new ProgressRecord(downloaded, failed, timestamp);
	}

	@JsonIgnore
	public boolean isEmpty() {
		return downloaded.isEmpty() && failed.isEmpty();
	}

	private static TreeSet<String> copy(Collection<String> values) {
		TreeSet<String> result = new TreeSet<>();
		if (values != null) {
			for (String value : values) {
				if (value != null) {
					result.add(value);
				}
			}
		}
		return result;
	}
}
