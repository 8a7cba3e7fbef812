package dev.foodmole.corpus.fetch;

import dev.foodmole.corpus.model.WorkItem;
import dev.foodmole.corpus.util.FileUtils;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Local storage of fetched documents, one file per identifier at {@code <dir>/<identifier>.xml}.
 * A work item may name its own path instead, as long as it is {@code <identifier>.xml} somewhere
 * below the directory, so that directory scans still find it.
 *
 * <p>An artifact counts as valid when it is larger than the minimum size and its last
 * non-whitespace byte is {@code '>'}. A document cut off mid-write fails the second check even
 * when it is large.
 */
public class ArtifactStore {
	public static final String EXTENSION = ".xml";
	public static final long DEFAULT_MIN_BYTES = 100;

	private static final int TAIL_BYTES = 256;

	private final Path directory;
	private final long minBytes;

	public ArtifactStore(Path directory) {
		this(directory, DEFAULT_MIN_BYTES);
	}

	public ArtifactStore(Path directory, long minBytes) {
		this.directory = directory;
		this.minBytes = minBytes;
	}

	public Path directory() {
		return directory;
	}

	public Path pathFor(String identifier) {
		return directory.resolve(identifier + EXTENSION);
	}

	/**
	 * The artifact path of a work item: its explicit path if it has one, otherwise the derived one.
	 *
	 * @throws IllegalArgumentException if the explicit path lies outside the directory or is not
	 *     named after the identifier
	 */
	public Path pathFor(WorkItem item) {
		Path explicit = item.artifactPath();
		if (explicit == null) {
			return pathFor(item.identifier());
		}
		Path root = directory.toAbsolutePath().normalize();
		Path target = explicit.toAbsolutePath().normalize();
		if (!target.startsWith(root)
				|| target.equals(root)
				|| !target.getFileName().toString().equals(item.identifier() + EXTENSION)) {
			throw new IllegalArgumentException("Artifact path " + explicit + " of " + item.identifier()
					+ " must be " + item.identifier() + EXTENSION + " inside " + directory);
		}
		return explicit;
	}

	public boolean isValid(Path artifact) {
		try {
			if (!Files.isRegularFile(artifact) || Files.size(artifact) <= minBytes) {
				return false;
			}
			return endsWithClosingTag(artifact);
		} catch (IOException e) {
			return false;
		}
	}

	/** Apply the artifact validity rule to content before it is written */
	public boolean isValidContent(byte[] content) {
		return content != null && content.length > minBytes && lastNonWhitespaceIsClosing(content);
	}

	/** Atomically write a fetched document, replacing nothing until the content is complete */
	public void write(Path artifact, byte[] content) throws IOException {
		FileUtils.ensureDirectory(artifact.toAbsolutePath().getParent());
		FileUtils.writeAtomically(artifact, content);
	}

	/** Identifiers of all valid artifacts currently in the directory or below it */
	public Set<String> scanValidIdentifiers() throws IOException {
		Set<String> identifiers = new LinkedHashSet<>();
		if (!Files.isDirectory(directory)) {
			return identifiers;
		}
		try (Stream<Path> files = Files.walk(directory)) {
			for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
				String name = file.getFileName().toString();
				if (name.endsWith(EXTENSION) && !name.startsWith(".") && isValid(file)) {
					identifiers.add(name.substring(0, name.length() - EXTENSION.length()));
				}
			}
		}
		return identifiers;
	}

	/** Artifact files that fail validation, plus leftover temporary files */
	public List<Path> scanInvalid() throws IOException {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.walk(directory)) {
			return files.filter(Files::isRegularFile)
					.filter(f -> FileUtils.isPartialFile(f)
							|| (f.getFileName().toString().endsWith(EXTENSION) && !isValid(f)))
					.sorted()
					.toList();
		}
	}

	private static boolean endsWithClosingTag(Path artifact) throws IOException {
		try (RandomAccessFile file = new RandomAccessFile(artifact.toFile(), "r")) {
			long length = file.length();
			int tailLength = (int) Math.min(TAIL_BYTES, length);
			byte[] tail = new byte[tailLength];
			file.seek(length - tailLength);
			file.readFully(tail);
			return lastNonWhitespaceIsClosing(tail);
		}
	}

	private static boolean lastNonWhitespaceIsClosing(byte[] bytes) {
		for (int i = bytes.length - 1; i >= 0; i--) {
			if (!Character.isWhitespace(bytes[i])) {
				return bytes[i] == '>';
			}
		}
		return false;
	}
}
