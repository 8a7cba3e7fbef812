package dev.foodmole.corpus.fetch;

import dev.foodmole.corpus.util.HttpUtils;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Fetches full-text JATS XML for one PMC article via the E-utilities efetch endpoint */
public class EntrezSource implements RemoteSource {
	private final NcbiSettings settings;
	private final HttpUtils httpUtils;

	public EntrezSource(NcbiSettings settings) {
		this(settings, new HttpUtils(settings.requestTimeout()));
	}

	EntrezSource(NcbiSettings settings, HttpUtils httpUtils) {
		this.settings = settings;
		this.httpUtils = httpUtils;
	}

	@Override
	public byte[] fetchRaw(String remoteId) throws IOException, InterruptedException {
		return httpUtils.downloadBytes(efetchUrl(remoteId));
	}

	String efetchUrl(String remoteId) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("db", "pmc");
		params.put("id", remoteId);
		params.put("rettype", "xml");
		params.put("retmode", "xml");
		params.put("tool", settings.tool());
		params.put("email", settings.email());
		params.put("api_key", settings.apiKey());
		String base = settings.baseUrl().endsWith("/") ? settings.baseUrl() : settings.baseUrl() + "/";
		return HttpUtils.withQuery(base + "efetch.fcgi", params);
	}
}
