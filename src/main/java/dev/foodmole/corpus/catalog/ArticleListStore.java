package dev.foodmole.corpus.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.foodmole.corpus.model.ArticleRef;
import dev.foodmole.corpus.util.FileUtils;
import dev.foodmole.corpus.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** The filtered article list, kept next to the downloads so a resumed run can skip filtering */
public class ArticleListStore {
	public static final String DEFAULT_FILENAME = "food_articles_xml.json";

	private static final TypeReference<List<ArticleRef>> ARTICLE_LIST = new TypeReference<>() {};

	private final Path file;

	public ArticleListStore(Path file) {
		this.file = file;
	}

	public Path file() {
		return file;
	}

	public boolean exists() {
		return Files.isRegularFile(file);
	}

	public List<ArticleRef> load() throws IOException {
		List<ArticleRef> articles = JsonUtils.reader().readValue(file.toFile(), ARTICLE_LIST);
		return articles != null ? articles : List.of();
	}

	public void save(List<ArticleRef> articles) throws IOException {
		FileUtils.ensureDirectory(file.toAbsolutePath().getParent());
		FileUtils.writeAtomically(file, JsonUtils.toJson(articles));
	}
}
