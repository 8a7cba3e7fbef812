package dev.foodmole.corpus.fetch;

/** Thrown before any work is dispatched when a run cannot start at all */
public class FetchConfigurationException extends Exception {

	public FetchConfigurationException(String message) {
		super(message);
	}

	public FetchConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
