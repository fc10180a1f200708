package io.codefmt.git;

import io.codefmt.config.Language;
import io.codefmt.format.FormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the source files a git working tree reports as added or modified.
 */
public class ChangedSourceLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangedSourceLocator.class);

    public List<Path> changedSources(Path workingDirectory) {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .findGitDir(workingDirectory.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            throw new FormatException("Not inside a git repository: " + workingDirectory);
        }
        try (Repository repository = builder.build(); Git git = Git.wrap(repository)) {
            Status status = git.status().call();
            Set<String> candidates = new TreeSet<>();
            candidates.addAll(status.getAdded());
            candidates.addAll(status.getChanged());
            candidates.addAll(status.getModified());
            candidates.addAll(status.getUntracked());

            Path workTree = repository.getWorkTree().toPath();
            List<Path> sources = candidates.stream()
                    .filter(path -> Language.forFileName(path).isPresent())
                    .map(workTree::resolve)
                    .filter(Files::isRegularFile)
                    .toList();
            LOGGER.info("Found {} changed source files in {}", sources.size(), workTree);
            return sources;
        } catch (IOException | GitAPIException ex) {
            throw new FormatException("Failed to read git status of " + workingDirectory, ex);
        }
    }
}
