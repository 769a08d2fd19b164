package com.typewarden.core.monitor;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.replacer.CompilerDiagnostic;
import com.typewarden.core.replacer.CompilerOutputParser;
import com.typewarden.core.replacer.SafeTypeReplacer;
import com.typewarden.core.replacer.TypeCheckResult;
import com.typewarden.core.replacer.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Runs the type checker against the working tree and turns the result into a
 * {@link BuildStabilityRecord}. A timed-out check counts as unstable, and so
 * does a zero exit code that still reports error diagnostics.
 */
@Component
public class BuildStabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(BuildStabilityProbe.class);

    private final TypeChecker typeChecker;
    private final CompilerOutputParser parser;
    private final Clock clock;
    private final int maxMessageLength;

    public BuildStabilityProbe(CampaignProperties properties, TypeChecker typeChecker,
                               CompilerOutputParser parser, Clock clock) {
        this.typeChecker = typeChecker;
        this.parser = parser;
        this.clock = clock;
        this.maxMessageLength = properties.getMonitor().getErrorMessageMaxLength();
    }

    public BuildStabilityRecord probe() {
        TypeCheckResult check = typeChecker.check();
        long elapsedMs = check.elapsed().toMillis();
        List<CompilerDiagnostic> diagnostics = check.timedOut() ? List.of() : parser.parse(check.output());
        if (check.passed() && diagnostics.isEmpty()) {
            log.debug("Build probe passed in {}ms", elapsedMs);
            return new BuildStabilityRecord(clock.instant(), true, elapsedMs, 0, null);
        }
        List<String> errors = SafeTypeReplacer.compilationErrors(check, diagnostics);
        String message = truncate(String.join("\n", errors), maxMessageLength);
        log.warn("Build probe failed with {} error(s) in {}ms", Math.max(1, diagnostics.size()), elapsedMs);
        return new BuildStabilityRecord(clock.instant(), false, elapsedMs, Math.max(1, diagnostics.size()), message);
    }

    static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
