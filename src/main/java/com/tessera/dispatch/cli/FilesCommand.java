package com.tessera.dispatch.cli;

import com.tessera.core.workspace.FileInfo;
import com.tessera.core.workspace.FileNode;
import com.tessera.core.workspace.SearchMatch;
import com.tessera.core.workspace.WorkspaceFiles;
import com.tessera.core.workspace.WorkspacePathException;
import com.tessera.core.workspace.WorkspaceProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera files tree | search &lt;query&gt; | info &lt;path&gt;
 * <p>
 * Read-only workspace queries.
 */
@Command(name = "files", mixinStandardHelpOptions = true, description = "Browse workspace files: tree, search, info")
@Component
public class FilesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "tree, search or info")
    private String action;

    @Parameters(index = "1", arity = "0..1", description = "Search query or file path")
    private String argument;

    @Option(names = {"--workspace", "-w"}, description = "Workspace root", defaultValue = ".")
    private Path workspace;

    @Option(names = {"--limit", "-n"}, description = "Maximum search results", defaultValue = "20")
    private int limit;

    private final WorkspaceProperties properties;

    public FilesCommand(WorkspaceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Integer call() {
        var files = new WorkspaceFiles(workspace.toAbsolutePath().normalize(), properties);
        try {
            switch (action) {
                case "tree" -> printTree(files.getFileTree(), "");
                case "search" -> {
                    if (argument == null || argument.isBlank()) {
                        ConsoleOutput.error("search needs a query");
                        return 2;
                    }
                    List<SearchMatch> matches = files.searchFiles(argument, limit);
                    if (matches.isEmpty()) {
                        ConsoleOutput.info("No files match '" + argument + "'");
                    }
                    matches.forEach(m -> System.out.println(m.path()));
                }
                case "info" -> {
                    if (argument == null || argument.isBlank()) {
                        ConsoleOutput.error("info needs a path");
                        return 2;
                    }
                    FileInfo info = files.getFileInfo(argument);
                    System.out.println("Path:          " + info.path());
                    System.out.println("Size:          " + info.size() + " bytes");
                    System.out.println("Lines:         " + info.lineCount());
                    System.out.println("Language:      " + info.language());
                    System.out.println("Last modified: " + info.lastModified());
                }
                default -> {
                    ConsoleOutput.error("Unknown action '" + action + "'. Use tree, search or info.");
                    return 2;
                }
            }
            return 0;
        } catch (NoSuchFileException e) {
            ConsoleOutput.error("No such file: " + e.getFile());
            return 1;
        } catch (WorkspacePathException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read workspace: " + e.getMessage());
            return 1;
        }
    }

    private static void printTree(FileNode node, String indent) {
        for (FileNode child : node.children()) {
            System.out.println(indent + child.name() + (child.directory() ? "/" : ""));
            if (child.directory()) {
                printTree(child, indent + "  ");
            }
        }
    }
}
