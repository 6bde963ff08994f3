package com.purchasingpower.appcommit.config;

import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.exception.PreconditionException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;

@Slf4j
@Configuration
public class GitRepositoryConfig {

    /**
     * Opens the repository containing {@code app.git.repo-path}, searching parent directories like git does.
     */
    @Bean(destroyMethod = "close")
    public Repository gitRepository(AppProperties appProperties) {
        File start = new File(appProperties.getGit().getRepoPath()).getAbsoluteFile();
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .readEnvironment()
                .findGitDir(start)
                .setMustExist(true);
        if (builder.getGitDir() == null) {
            throw new PreconditionException("Not a git repository (or any parent): " + start);
        }
        try {
            Repository repository = builder.build();
            log.info("Opened git repository at {}", repository.getDirectory());
            return repository;
        } catch (IOException e) {
            throw new PreconditionException("Unable to open git repository at " + start + ": " + e.getMessage(), e);
        }
    }
}
