package dev.foodmole.corpus.fetch;

import java.io.IOException;

/**
 * A throttled remote service that returns one raw document per identifier. Calls may be slow, may
 * fail transiently and may return a well-formed but empty response.
 */
@FunctionalInterface
public interface RemoteSource {
	/**
	 * Fetch the raw document for an identifier.
	 *
	 * @param remoteId the normalized identifier understood by the remote service
	 * @return the response body, possibly empty
	 * @throws IOException on transport failures
	 * @throws InterruptedException if the calling worker is interrupted
	 */
	byte[] fetchRaw(String remoteId) throws IOException, InterruptedException;
}
