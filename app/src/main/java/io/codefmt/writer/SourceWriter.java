package io.codefmt.writer;

import io.codefmt.format.FormatException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes formatted sources back to disk and optionally stages them in the enclosing repository.
 */
public class SourceWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceWriter.class);

    public void write(Path target, String text) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(text, "text");
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new FormatException("Failed to write formatted source: " + target, ex);
        }
    }

    /**
     * Adds {@code target} to the index of the repository containing it.
     *
     * @return {@code false} when the file is not inside a git working tree
     */
    public boolean stage(Path target) {
        Objects.requireNonNull(target, "target");
        Path absolute = target.toAbsolutePath().normalize();
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .findGitDir(absolute.getParent().toFile());
        if (builder.getGitDir() == null) {
            LOGGER.warn("Not staging {}: no git repository found", target);
            return false;
        }
        try (Repository repository = builder.build(); Git git = Git.wrap(repository)) {
            Path workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
            String pattern = workTree.relativize(absolute).toString().replace('\\', '/');
            git.add().addFilepattern(pattern).call();
            LOGGER.debug("Staged {}", pattern);
            return true;
        } catch (IOException | GitAPIException ex) {
            throw new FormatException("Failed to stage formatted source: " + target, ex);
        }
    }
}
