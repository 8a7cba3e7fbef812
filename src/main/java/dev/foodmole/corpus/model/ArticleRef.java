package dev.foodmole.corpus.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** An open-access article selected from the catalog */
@JsonPropertyOrder({"pmcid", "pmc_num", "pmid", "citation", "license"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArticleRef(
		@JsonProperty("pmcid") String pmcid,
		@JsonProperty("pmc_num") String pmcNum,
		@JsonProperty("pmid") String pmid,
		@JsonProperty("citation") String citation,
		@JsonProperty("license") String license) {

	public static ArticleRef of(String pmcid, String pmid, String citation, String license) {
		return new ArticleRef(pmcid, WorkItem.normalize(pmcid), pmid, citation, license);
	}

	public WorkItem toWorkItem() {
		return new WorkItem(pmcid, pmcNum != null && !pmcNum.isEmpty() ? pmcNum : WorkItem.normalize(pmcid), null);
	}
}
