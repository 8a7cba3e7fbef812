package dev.foodmole.corpus.fetch;

/** Result of a fetch run */
public record FetchSummary(
		int requested,
		int dispatched,
		int succeeded,
		int skippedExisting,
		int failed,
		int cancelled,
		int reconciled,
		int totalDownloaded,
		int totalFailed,
		boolean interrupted) {

	/** Summary of a run that found nothing left to fetch */
	public static FetchSummary nothingToDo(int requested, int reconciled, int totalDownloaded, int totalFailed) {
		return new FetchSummary(requested, 0, 0, 0, 0, 0, reconciled, totalDownloaded, totalFailed, false);
	}

	public int processed() {
		return succeeded + skippedExisting + failed;
	}

	@Override
	public String toString() {
		return "%s (%d dispatched: %d fetched, %d already on disk, %d failed%s; %d downloaded and %d failed in total)"
				.formatted(
						interrupted ? "INTERRUPTED" : "COMPLETED",
						dispatched,
						succeeded,
						skippedExisting,
						failed,
						cancelled > 0 ? ", %d not finished".formatted(cancelled) : "",
						totalDownloaded,
						totalFailed);
	}
}
