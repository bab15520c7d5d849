package org.springaicommunity.review.discussion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File system implementation of {@link NoteStore}.
 *
 * <p>
 * Each noteable lives in one JSON document at {@code <baseDir>/<type>/<id>.json} (see
 * {@link StoredNoteable}). The same document lists the line codes of the current diff,
 * which makes this store the {@link DiffPositionLiveness} source as well.
 */
public class FileSystemNoteStore implements NoteStore, DiffPositionLiveness {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemNoteStore.class);

	private final Path baseDir;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public FileSystemNoteStore(Path baseDir, ObjectMapper objectMapper, Clock clock) {
		this.baseDir = baseDir;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public Path getBaseDir() {
		return baseDir;
	}

	@Override
	public Optional<Noteable> findNoteable(String reference) {
		Path documentPath = resolveReference(reference);
		if (!Files.exists(documentPath)) {
			logger.debug("No document for {} at {}", reference, documentPath);
			return Optional.empty();
		}
		return Optional.of(read(documentPath).noteable());
	}

	@Override
	public List<Note> findNotes(Noteable noteable) {
		Path documentPath = documentPath(noteable);
		if (!Files.exists(documentPath)) {
			return List.of();
		}
		List<Note> notes = new ArrayList<>();
		for (StoredNoteable.StoredNote stored : read(documentPath).notes()) {
			notes.add(stored.toNote(clock));
		}
		logger.debug("Loaded {} notes for {}", notes.size(), noteable.reference());
		return notes;
	}

	@Override
	public void saveNotes(Noteable noteable, Collection<Note> notes) {
		Path documentPath = documentPath(noteable);
		StoredNoteable document = Files.exists(documentPath) ? read(documentPath)
				: new StoredNoteable(noteable, List.of(), List.of());

		Map<Long, StoredNoteable.StoredNote> byId = new LinkedHashMap<>();
		for (StoredNoteable.StoredNote stored : document.notes()) {
			byId.put(stored.id(), stored);
		}
		for (Note note : notes) {
			byId.put(note.getId(), StoredNoteable.StoredNote.from(note));
		}

		write(documentPath, new StoredNoteable(document.noteable(), document.activeLineCodes(),
				new ArrayList<>(byId.values())));
		logger.info("Saved {} notes for {} to {}", notes.size(), noteable.reference(), documentPath);
	}

	/**
	 * Write a complete document, replacing any existing one for the same noteable.
	 * @param document the document to store
	 */
	public void saveDocument(StoredNoteable document) {
		write(documentPath(document.noteable()), document);
	}

	@Override
	public boolean isActive(Noteable noteable, Note firstNote) {
		String lineCode = firstNote.getLineCode();
		if (lineCode == null) {
			return false;
		}
		Path documentPath = documentPath(noteable);
		if (!Files.exists(documentPath)) {
			return false;
		}
		return read(documentPath).activeLineCodes().contains(lineCode);
	}

	private Path documentPath(Noteable noteable) {
		return baseDir.resolve(noteable.type().pathSegment()).resolve(noteable.id() + ".json");
	}

	private Path resolveReference(String reference) {
		String[] parts = reference.split("/");
		if (parts.length != 2) {
			throw new IllegalArgumentException("Invalid noteable reference '" + reference + "': must be 'type/id'");
		}
		NoteableType type = NoteableType.fromPathSegment(parts[0]);
		long id;
		try {
			id = Long.parseLong(parts[1]);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					"Invalid noteable id '" + parts[1] + "' in reference '" + reference + "': must be a number");
		}
		return baseDir.resolve(type.pathSegment()).resolve(id + ".json");
	}

	private StoredNoteable read(Path documentPath) {
		try {
			return objectMapper.readValue(documentPath.toFile(), StoredNoteable.class);
		}
		catch (IOException e) {
			throw new NoteStoreException("Failed to read note document: " + documentPath, e);
		}
	}

	private void write(Path documentPath, StoredNoteable document) {
		try {
			Files.createDirectories(documentPath.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(documentPath.toFile(), document);
		}
		catch (IOException e) {
			throw new NoteStoreException("Failed to write note document: " + documentPath, e);
		}
	}

}
