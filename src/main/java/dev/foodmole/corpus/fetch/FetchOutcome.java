package dev.foodmole.corpus.fetch;

/** Result of fetching one work item */
public record FetchOutcome(String identifier, Status status, String detail) {

	public enum Status {
		SUCCESS,
		SKIPPED_EXISTING,
		FAILED
	}

	public static FetchOutcome success(String identifier) {
		return new FetchOutcome(identifier, Status.SUCCESS, null);
	}

	public static FetchOutcome skippedExisting(String identifier) {
		return new FetchOutcome(identifier, Status.SKIPPED_EXISTING, "already exists");
	}

	public static FetchOutcome failed(String identifier, String detail) {
		return new FetchOutcome(identifier, Status.FAILED, detail);
	}

	/** Whether the artifact is on disk after this outcome */
	public boolean isDownloaded() {
		return status != Status.FAILED;
	}

	@Override
	public String toString() {
		return detail != null ? "%s: %s (%s)".formatted(identifier, status, detail) : "%s: %s".formatted(identifier, status);
	}
}
