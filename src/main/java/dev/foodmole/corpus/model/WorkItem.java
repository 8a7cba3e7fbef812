package dev.foodmole.corpus.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of fetch work.
 *
 * @param identifier opaque external identifier, e.g. {@code PMC123456}
 * @param remoteId normalized form used to address the remote API, e.g. {@code 123456}
 * @param artifactPath explicit output path inside the artifact directory, or {@code null} to let
 *     the artifact store derive it
 */
public record WorkItem(String identifier, String remoteId, Path artifactPath) {

	public static final String PMC_PREFIX = "PMC";

	public WorkItem {
		Objects.requireNonNull(identifier, "identifier");
		Objects.requireNonNull(remoteId, "remoteId");
	}

	/** Create a work item, deriving the remote id by stripping a leading {@code PMC} prefix */
	public static WorkItem of(String identifier) {
		return new WorkItem(identifier, normalize(identifier), null);
	}

	public static String normalize(String identifier) {
		return identifier.startsWith(PMC_PREFIX) ? identifier.substring(PMC_PREFIX.length()) : identifier;
	}
}
