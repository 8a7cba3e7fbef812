package dev.foodmole.corpus.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/** Utility class for file operations */
public class FileUtils {

	/** Suffix of in-flight temporary files, never a valid artifact or checkpoint */
	public static final String PARTIAL_SUFFIX = ".part";

	private FileUtils() {}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Write the content to a temporary sibling file, force it to disk and move it over the target.
	 * Readers of {@code target} see either the previous content or the new content, never a mix.
	 */
	public static void writeAtomically(Path target, byte[] content) throws IOException {
		Path dir = target.toAbsolutePath().getParent();
		Path tempFile = Files.createTempFile(dir, "." + target.getFileName(), PARTIAL_SUFFIX);
		try {
			try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE)) {
				ByteBuffer buffer = ByteBuffer.wrap(content);
				while (buffer.hasRemaining()) {
					channel.write(buffer);
				}
				channel.force(true);
			}
			try {
				Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(tempFile);
		}
	}

	public static void writeAtomically(Path target, String content) throws IOException {
		writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
	}

	/** Check whether a file name belongs to an abandoned temporary file */
	public static boolean isPartialFile(Path file) {
		return file.getFileName().toString().endsWith(PARTIAL_SUFFIX);
	}
}
