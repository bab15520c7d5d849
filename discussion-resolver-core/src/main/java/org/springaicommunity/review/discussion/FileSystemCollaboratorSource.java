package org.springaicommunity.review.discussion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads project collaborators from {@code <baseDir>/collaborators/<owner>/<repo>.json},
 * a JSON array of {@link Collaborator} entries. A missing file means the project has no
 * collaborators.
 */
public class FileSystemCollaboratorSource implements CollaboratorSource {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCollaboratorSource.class);

	private static final TypeReference<List<Collaborator>> COLLABORATOR_LIST = new TypeReference<>() {
	};

	private final Path baseDir;

	private final ObjectMapper objectMapper;

	public FileSystemCollaboratorSource(Path baseDir, ObjectMapper objectMapper) {
		this.baseDir = baseDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<Collaborator> collaborators(Project project) {
		Path file = collaboratorsFile(project);
		if (!Files.exists(file)) {
			logger.debug("No collaborators file for {} at {}", project.fullPath(), file);
			return List.of();
		}
		try {
			return objectMapper.readValue(file.toFile(), COLLABORATOR_LIST);
		}
		catch (IOException e) {
			throw new NoteStoreException("Failed to read collaborators: " + file, e);
		}
	}

	/**
	 * Write the collaborators of a project, replacing any existing list.
	 * @param project the project
	 * @param collaborators the collaborators to store
	 */
	public void saveCollaborators(Project project, List<Collaborator> collaborators) {
		Path file = collaboratorsFile(project);
		try {
			Files.createDirectories(file.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), collaborators);
			logger.info("Saved {} collaborators for {}", collaborators.size(), project.fullPath());
		}
		catch (IOException e) {
			throw new NoteStoreException("Failed to write collaborators: " + file, e);
		}
	}

	private Path collaboratorsFile(Project project) {
		return baseDir.resolve("collaborators").resolve(project.owner()).resolve(project.name() + ".json");
	}

}
