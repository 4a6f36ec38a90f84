package com.webfront.core.routing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.webfront.core.exceptions.ConfigException;
import com.webfront.core.handler.RequestHandler;
import com.webfront.entity.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the rule file and builds a fully resolved {@link RuleTable}.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    private final Path rulesFile;
    private final RuleFileParser parser;
    private final HandlerResolver resolver;

    /**
     * @param rulesFile Path of the rule file.
     * @param parser    Decoder for the file content.
     * @param resolver  Builds handlers for the decoded rules.
     */
    public RuleLoader(Path rulesFile, RuleFileParser parser, HandlerResolver resolver) {
        this.rulesFile = rulesFile;
        this.parser = parser;
        this.resolver = resolver;
    }

    public Path getRulesFile() {
        return rulesFile;
    }

    /**
     * Loads the rule file unless it has not changed since {@code previous} was
     * built. A file whose modification time is equal to or earlier than the
     * previous table's is not re-read.
     *
     * @param previous The table currently in use, or null on the first load.
     * @return A new table, or empty if the file is unchanged.
     * @throws ConfigException if the file is missing, unreadable or malformed.
     */
    public Optional<RuleTable> load(RuleTable previous) {
        Instant modified = lastModified();
        if (previous != null && !modified.isAfter(previous.getLastModified())) {
            log.trace("Rule file {} unchanged since {}", rulesFile, previous.getLastModified());
            return Optional.empty();
        }

        List<Rule> rules = parser.parse(read(), rulesFile.toString());

        List<ResolvedRule> resolved = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            RequestHandler handler = resolver.resolve(rule).orElse(null);
            if (handler == null || rule.getHost().isEmpty()) {
                log.warn("Malformed rule in {} will never match: {}", rulesFile, rule);
            }
            resolved.add(new ResolvedRule(rule, handler));
        }
        return Optional.of(new RuleTable(resolved, modified));
    }

    private Instant lastModified() {
        try {
            return Files.getLastModifiedTime(rulesFile).toInstant();
        } catch (NoSuchFileException e) {
            throw new ConfigException("Rule file not found: " + rulesFile, e);
        } catch (IOException e) {
            throw new ConfigException("Cannot stat rule file " + rulesFile + ": " + e.getMessage(), e);
        }
    }

    private String read() {
        try {
            return Files.readString(rulesFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigException("Rule file not found: " + rulesFile, e);
        } catch (IOException e) {
            throw new ConfigException("Error reading rule file " + rulesFile + ": " + e.getMessage(), e);
        }
    }
}
