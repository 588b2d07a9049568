package com.tessera.core.workspace;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Path resolution and read-only queries over one workspace root.
 * <p>
 * Every workspace-relative path handed to this class is resolved against the root
 * and rejected with {@link WorkspacePathException} if it escapes it, including
 * through symbolic links. Hidden entries and the configured build/IDE directories
 * are left out of the tree and of search results.
 */
public class WorkspaceFiles {

    private static final Comparator<Path> TREE_ORDER = Comparator
            .comparing((Path p) -> !Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
            .thenComparing(p -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(p -> p.getFileName().toString());

    private final Path root;
    private final Path realRoot;
    private final Set<String> ignoredNames;
    private final List<PathMatcher> writeDenied;
    private final WorkspaceProperties properties;

    public WorkspaceFiles(Path root, WorkspaceProperties properties) {
        this.root = root.toAbsolutePath().normalize();
        this.realRoot = realPathOrSelf(this.root);
        this.properties = properties;
        this.ignoredNames = Set.copyOf(properties.getIgnoredNames());
        this.writeDenied = properties.getWriteDenied().stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    public Path root() {
        return root;
    }

    public WorkspaceProperties properties() {
        return properties;
    }

    /**
     * Resolves a workspace-relative (or absolute, inside the root) path.
     *
     * @throws WorkspacePathException if the path is blank or lands outside the workspace
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new WorkspacePathException(String.valueOf(path), "Empty path");
        }
        Path candidate;
        try {
            candidate = Paths.get(path.replace('\\', '/'));
        } catch (RuntimeException e) {
            throw new WorkspacePathException(path, "Invalid path '" + path + "': " + e.getMessage());
        }
        Path resolved = root.resolve(candidate).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new WorkspacePathException(path, "Path '" + path + "' is outside the workspace");
        }
        // a path that does not exist yet is judged by its nearest existing ancestor
        Path existing = resolved;
        while (!existing.equals(root) && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            Path real;
            try {
                real = existing.toRealPath();
            } catch (IOException e) {
                throw new WorkspacePathException(path, "Path '" + path + "' cannot be resolved: " + e.getMessage());
            }
            if (!real.startsWith(realRoot)) {
                throw new WorkspacePathException(path, "Path '" + path + "' links outside the workspace");
            }
        }
        return resolved;
    }

    /** Canonical workspace-relative form with forward slashes. */
    public String relativize(Path absolute) {
        return root.relativize(absolute.toAbsolutePath().normalize()).toString().replace(File.separatorChar, '/');
    }

    public String normalize(String path) {
        return relativize(resolve(path));
    }

    public boolean isWriteDenied(String relativePath) {
        Path rel = Paths.get(relativePath);
        return writeDenied.stream().anyMatch(m -> m.matches(rel));
    }

    public String readText(String path) throws IOException {
        return new String(Files.readAllBytes(resolve(path)), StandardCharsets.UTF_8);
    }

    public FileNode getFileTree() throws IOException {
        String name = root.getFileName() == null ? root.toString() : root.getFileName().toString();
        return new FileNode(name, "", true, 0, children(root));
    }

    private List<FileNode> children(Path dir) throws IOException {
        var entries = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (!isIgnored(entry.getFileName().toString())) {
                    entries.add(entry);
                }
            }
        }
        entries.sort(TREE_ORDER);

        var nodes = new ArrayList<FileNode>(entries.size());
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                nodes.add(new FileNode(name, relativize(entry), true, 0, children(entry)));
            } else {
                nodes.add(new FileNode(name, relativize(entry), false, Files.size(entry), List.of()));
            }
        }
        return nodes;
    }

    public List<SearchMatch> searchFiles(String query) throws IOException {
        return searchFiles(query, properties.getSearchLimit());
    }

    /**
     * Case-insensitive substring search over relative paths. Matches inside the file
     * name rank first, then by how many segments separate the match from the file
     * name; ties go to the shorter path, then lexicographic order.
     */
    public List<SearchMatch> searchFiles(String query, int limit) throws IOException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.strip().replace('\\', '/').toLowerCase(Locale.ROOT);

        var matches = new ArrayList<SearchMatch>();
        for (String path : listFiles()) {
            String haystack = path.toLowerCase(Locale.ROOT);
            int index = haystack.lastIndexOf(needle);
            if (index < 0) {
                continue;
            }
            int lastSegment = countSlashes(haystack, haystack.length());
            int matchSegment = countSlashes(haystack, index + needle.length() - 1);
            matches.add(new SearchMatch(path, lastSegment - matchSegment));
        }

        return matches.stream()
                .sorted(Comparator.comparingInt(SearchMatch::proximity)
                        .thenComparingInt(m -> m.path().length())
                        .thenComparing(SearchMatch::path))
                .limit(Math.max(0, limit))
                .toList();
    }

    public FileInfo getFileInfo(String path) throws IOException {
        Path file = resolve(path);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(path);
        }
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        if (attrs.isDirectory()) {
            return new FileInfo(relativize(file), 0, 0, "directory", attrs.lastModifiedTime().toInstant());
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return new FileInfo(relativize(file), attrs.size(), countLines(content),
                Languages.detect(file.getFileName().toString()), attrs.lastModifiedTime().toInstant());
    }

    /** All visible regular files, workspace-relative, in walk order. */
    public List<String> listFiles() throws IOException {
        var files = new ArrayList<String>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isIgnored(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !isIgnored(file.getFileName().toString())) {
                    files.add(relativize(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return content.endsWith("\n") ? lines : lines + 1;
    }

    private boolean isIgnored(String name) {
        return name.startsWith(".") || ignoredNames.contains(name);
    }

    private static int countSlashes(String text, int end) {
        int count = 0;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '/') {
                count++;
            }
        }
        return count;
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path;
        }
    }
}
