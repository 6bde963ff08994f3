package com.purchasingpower.appcommit.runner;

import com.purchasingpower.appcommit.exception.CommitPipelineException;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.service.CommitOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * app-commit --message="Fix typo" [--force] [--owner=octo-org --repo=octo-repo]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String MESSAGE_OPTION = "message";
    static final String FORCE_OPTION = "force";
    static final String OWNER_OPTION = "owner";
    static final String REPO_OPTION = "repo";

    private final CommitTargetResolver commitTargetResolver;
    private final CommitOrchestrator commitOrchestrator;

    private PrintStream out = System.out;
    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        try {
            String message = singleValue(args, MESSAGE_OPTION);
            if (message == null || message.isBlank()) {
                throw new PreconditionException("--message=<text> is required");
            }
            CommitRequest request = commitTargetResolver.resolve(message, forceFlag(args),
                    singleValue(args, OWNER_OPTION), singleValue(args, REPO_OPTION));

            String url = commitOrchestrator.commit(request);
            out.println("Commit created: " + url);
            exitCode = 0;
        } catch (CommitPipelineException e) {
            log.error("❌ {}", e.getMessage());
            log.debug("Failure details", e);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private static String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new PreconditionException("--" + name + " given more than once");
        }
        return values.get(0);
    }

    private static boolean forceFlag(ApplicationArguments args) {
        if (!args.containsOption(FORCE_OPTION)) {
            return false;
        }
        List<String> values = args.getOptionValues(FORCE_OPTION);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String value = values.get(values.size() - 1);
        if ("true".equalsIgnoreCase(value) || value.isEmpty()) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new PreconditionException("--force accepts true or false, got: " + value);
    }
}
