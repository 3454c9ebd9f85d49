package com.vcsight.ingestor.classify;

import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.model.EnvironmentTag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Infers the {environment, client, datacenter} tag of a file from its path.
 *
 * Two passes:
 * <ol>
 *   <li>The configured pattern table, in declaration order. The first
 *       pattern found anywhere in the path wins and classification stops.</li>
 *   <li>Otherwise, directory-segment heuristics: a {@code client-} segment
 *       names the client, a segment mentioning prod/dev/test/staging names
 *       the environment. Both checks run on every segment.</li>
 * </ol>
 *
 * Pure and total: never touches the filesystem and always returns a tag,
 * with "unknown" for anything it could not infer.
 *
 * Files under the watch directory are classified by their path relative to
 * it, so directories above the watch root never contribute a tag.
 */
@Component
public class EnvironmentClassifier {

    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]+");

    private static final List<String> CLIENT_PREFIXES = List.of("client-", "Client-");
    private static final List<String> ENVIRONMENT_KEYWORDS = List.of("prod", "dev", "test", "staging");

    private final Map<String, EnvironmentTag> patterns;
    private final Path watchRoot;

    @Autowired
    public EnvironmentClassifier(IngestProperties properties) {
        this(properties.getEnvironmentMapping(), properties.getWatchDirectory());
    }

    public EnvironmentClassifier(Map<String, EnvironmentTag> patterns) {
        this(patterns, null);
    }

    public EnvironmentClassifier(Map<String, EnvironmentTag> patterns, Path watchRoot) {
        this.patterns  = new LinkedHashMap<>(patterns);
        this.watchRoot = watchRoot != null ? watchRoot.toAbsolutePath().normalize() : null;
    }

    /** Classify a file by its path inside the watch directory, or by its full path when outside it. */
    public EnvironmentTag classifyFile(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (watchRoot != null && absolute.startsWith(watchRoot)) {
            return classify(watchRoot.relativize(absolute).toString());
        }
        return classify(absolute.toString());
    }

    public EnvironmentTag classify(String path) {
        EnvironmentTag tag = EnvironmentTag.UNKNOWN;
        if (path == null || path.isEmpty()) return tag;

        for (Map.Entry<String, EnvironmentTag> entry : patterns.entrySet()) {
            if (path.contains(entry.getKey())) {
                return tag.overriddenBy(entry.getValue());
            }
        }

        for (String segment : directorySegments(path)) {
            if (CLIENT_PREFIXES.stream().anyMatch(segment::startsWith)) {
                tag = tag.withClient(segment);
            }
            if (ENVIRONMENT_KEYWORDS.stream().anyMatch(segment::contains)) {
                tag = tag.withEnvironment(segment);
            }
        }
        return tag;
    }

    /** Path segments without the trailing file name. */
    private static List<String> directorySegments(String path) {
        String[] parts = SEPARATORS.split(path);
        if (parts.length <= 1) return List.of();
        return List.of(parts).subList(0, parts.length - 1).stream()
                .filter(p -> !p.isEmpty())
                .toList();
    }
}
