package com.typewarden.core.scanner;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.model.Occurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Walks a source tree and reports every line carrying an explicit {@code any}.
 * <p>
 * Common build-tool and VCS directories (e.g. {@code .git}, {@code node_modules},
 * {@code dist}) are excluded, as is the campaign's own backup directory.
 */
@Service
public class OccurrenceScanner {

    private static final Logger log = LoggerFactory.getLogger(OccurrenceScanner.class);

    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "dist", "out", "coverage", ".next", ".turbo", ".typewarden"
    );

    /** Matches the marker forms the rest of the pipeline knows how to classify. */
    static final Pattern ANY_MARKER = Pattern.compile(
            ":\\s*any\\b"
            + "|\\bArray<\\s*any\\s*>"
            + "|\\bRecord<[^<>]*,\\s*any\\s*>"
            + "|\\bas\\s+any\\b"
            + "|<any>");

    private final CampaignProperties properties;

    public OccurrenceScanner(CampaignProperties properties) {
        this.properties = properties;
    }

    /**
     * Scans every source file under {@code root}.
     *
     * @param root directory to walk
     * @return occurrences in walk order, lines ascending within a file
     * @throws IOException if the directory walk fails
     */
    public List<Occurrence> scan(Path root) throws IOException {
        var occurrences = new ArrayList<Occurrence>();
        Set<String> ignored = new HashSet<>(IGNORE_DIRS);
        ignored.addAll(properties.getScanner().getExcludeDirs());
        Path backupDir = Path.of(properties.getReplacer().getBackupDirectory()).toAbsolutePath().normalize();
        List<Path> files;
        try (var stream = Files.walk(root)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(root, p, ignored, backupDir))
                    .filter(this::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            occurrences.addAll(scanFile(file));
        }
        log.info("Scanned {} files under {}, found {} occurrences", files.size(), root, occurrences.size());
        return occurrences;
    }

    public List<Occurrence> scanFile(Path file) throws IOException {
        var result = new ArrayList<Occurrence>();
        List<String> lines = readLines(file);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isCommentOnly(line)) continue;
            if (ANY_MARKER.matcher(stripTrailingComment(line)).find()) {
                result.add(new Occurrence(file.toString(), i + 1, line.trim()));
            }
        }
        return result;
    }

    boolean isSourceFile(Path path) {
        String name = path.getFileName().toString();
        if (name.endsWith(".d.ts")) return false;
        for (String ext : properties.getScanner().getExtensions()) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }

    /**
     * Decodes the file as UTF-8. Malformed bytes become replacement characters
     * so one badly encoded file cannot stop the scan; the replacer's strict
     * read still refuses to rewrite it.
     */
    public static List<String> readLines(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String content;
        try {
            content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, scanning with replacement characters", file);
            content = new String(bytes, StandardCharsets.UTF_8);
        }
        return content.lines().collect(Collectors.toList());
    }

    private static boolean shouldIgnore(Path root, Path path, Set<String> ignored, Path backupDir) {
        if (path.toAbsolutePath().normalize().startsWith(backupDir)) return true;
        for (Path component : root.relativize(path)) {
            if (ignored.contains(component.toString())) return true;
        }
        return false;
    }

    static boolean isCommentOnly(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }

    static String stripTrailingComment(String line) {
        int idx = line.indexOf("//");
        return idx >= 0 ? line.substring(0, idx) : line;
    }
}
