package org.pytch.compiler.util;

import org.pytch.compiler.diagnostics.CompilerLogger;
import org.pytch.compiler.frontend.lexer.Token;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Utility class for dumping token streams during tokenization.
 */
public final class DebugDump {

	private DebugDump() {}

	/**
	 * Writes a rendered token stream to {@code <root>/<file>/<phase>.tokens}.
	 * A failed write is logged and does not affect tokenization.
	 * @param root The dump directory.
	 * @param fileName The logical name of the source, used for the dump subdirectory.
	 * @param phase The phase that produced the tokens, used for the file name.
	 * @param tokens The tokens to dump.
	 * @return The path of the written file, or {@code null} if it could not be written.
	 */
	public static Path dumpTokens(Path root, String fileName, String phase, List<Token> tokens) {
		Path dir = root.resolve(sanitize(fileName));
		Path out = dir.resolve(phase + ".tokens");
		try {
			Files.createDirectories(dir);
			Files.writeString(out, TokenStreamRenderer.render(tokens));
			CompilerLogger.debug("Dumped {} {} tokens to {}", tokens.size(), phase, out);
			return out;
		} catch (IOException e) {
			CompilerLogger.warn("Could not write token dump {}: {}", out, e.getMessage());
			return null;
		}
	}

	private static String sanitize(String s) {
		return s.replaceAll("[^a-zA-Z0-9._-]", "_");
	}
}
