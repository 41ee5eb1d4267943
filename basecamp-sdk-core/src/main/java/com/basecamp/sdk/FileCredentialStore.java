package com.basecamp.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * File system implementation of {@link CredentialStore}.
 *
 * <p>
 * Each key is stored as one JSON file in a directory (by default
 * {@code ~/.config/basecamp/credentials}). Writes go to a temporary file that is then
 * moved into place, so a crash never leaves a half-written credential file. On POSIX
 * file systems the file is readable by the owner only.
 */
public class FileCredentialStore implements CredentialStore {

	private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);

	private final Path directory;

	private final ObjectMapper objectMapper;

	public FileCredentialStore(Path directory, ObjectMapper objectMapper) {
		this.directory = directory;
		this.objectMapper = objectMapper;
	}

	/**
	 * Store under {@code credentials} in the user's Basecamp config directory.
	 */
	public static FileCredentialStore inConfigDirectory(ObjectMapper objectMapper) {
		return new FileCredentialStore(BasecampConfigLoader.globalConfigDirectory().resolve("credentials"),
				objectMapper);
	}

	@Override
	public Optional<OAuthCredentials> load(String key) {
		Path file = fileFor(key);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(file.toFile(), OAuthCredentials.class));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read credentials: " + file, e);
		}
	}

	@Override
	public void save(String key, OAuthCredentials credentials) {
		Path file = fileFor(key);
		try {
			Files.createDirectories(directory);
			Path temp = Files.createTempFile(directory, ".credentials", ".tmp");
			try {
				restrictToOwner(temp);
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), credentials);
				moveIntoPlace(temp, file);
			}
			finally {
				Files.deleteIfExists(temp);
			}
			logger.debug("Saved credentials to {}", file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save credentials: " + file, e);
		}
	}

	@Override
	public void delete(String key) {
		Path file = fileFor(key);
		try {
			if (Files.deleteIfExists(file)) {
				logger.info("Deleted credentials: {}", file);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to delete credentials: " + file, e);
		}
	}

	Path fileFor(String key) {
		String safe = key.replaceAll("^[a-zA-Z]+://", "").replaceAll("[^a-zA-Z0-9._-]", "_");
		return directory.resolve(Paths.get(safe + ".json").getFileName());
	}

	private static void moveIntoPlace(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void restrictToOwner(Path file) throws IOException {
		if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
			Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
		}
	}

}
