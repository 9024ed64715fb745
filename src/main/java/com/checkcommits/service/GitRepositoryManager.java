package com.checkcommits.service;

import com.checkcommits.util.GitUtils;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.List;

@Service
public class GitRepositoryManager {

    /**
     * Finds the work tree containing {@code repoPath}, searching parent directories like
     * {@code git rev-parse --show-toplevel} does.
     */
    public File findWorkTree(String repoPath) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .readEnvironment()
                .findGitDir(new File(repoPath).getAbsoluteFile());
        if (builder.getGitDir() == null) {
            throw new IllegalStateException("Not a git repository (or any of the parent directories): " + repoPath);
        }
        try (Repository repository = builder.build()) {
            if (repository.isBare()) {
                return repository.getDirectory();
            }
            return repository.getWorkTree();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load Git repository from " + repoPath, e);
        }
    }

    /** Leaf name of the repository's top level directory; used to name all output files. */
    public String resolveRepositoryName(String repoPath) {
        String name = findWorkTree(repoPath).getName();
        return name.endsWith(".git") ? name.substring(0, name.length() - ".git".length()) : name;
    }

    /** The full {@code git log --numstat} output of the repository, one entry per line. */
    public List<String> readHistory(String repoPath) {
        return GitUtils.readNumstatLog(repoPath);
    }
}
