package com.juno.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Document tools for the writing team, confined to one working directory.
 * A missing file or a path outside the workspace is reported back to the
 * agent as an {@code Error:} string.
 */
public class DocumentTools {

    private static final Logger log = LoggerFactory.getLogger(DocumentTools.class);

    private final Path workspace;

    public DocumentTools(Path workspace) {
        this.workspace = workspace;
    }

    @Tool(description = "Create and save an outline as a numbered list of points.")
    public String createOutline(
            @ToolParam(description = "List of main points or sections") List<String> points,
            @ToolParam(description = "File path to save the outline") String fileName) {
        var sb = new StringBuilder();
        for (int i = 0; i < points.size(); i++) {
            sb.append(i + 1).append(". ").append(points.get(i)).append('\n');
        }
        try {
            write(fileName, sb.toString());
            return "Outline saved to " + fileName;
        } catch (IOException | IllegalArgumentException e) {
            return error(e);
        }
    }

    @Tool(description = "Read the specified document, optionally a range of lines.")
    public String readDocument(
            @ToolParam(description = "File path to read the document from") String fileName,
            @ToolParam(description = "The start line, 0 by default", required = false) Integer start,
            @ToolParam(description = "The end line (exclusive), end of file by default", required = false) Integer end) {
        try {
            Path path = WorkspacePaths.resolve(workspace, fileName);
            if (!Files.isRegularFile(path)) {
                return "Error: File " + fileName + " not found";
            }
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            int from = start == null ? 0 : Math.max(0, Math.min(start, lines.size()));
            int to = end == null ? lines.size() : Math.max(from, Math.min(end, lines.size()));
            var sb = new StringBuilder();
            for (String line : lines.subList(from, to)) {
                sb.append(line).append('\n');
            }
            return sb.toString();
        } catch (IOException | IllegalArgumentException e) {
            return error(e);
        }
    }

    @Tool(description = "Create and save a text document.")
    public String writeDocument(
            @ToolParam(description = "Text content to be written into the document") String content,
            @ToolParam(description = "File path to save the document") String fileName) {
        try {
            write(fileName, content);
            return "Document saved to " + fileName;
        } catch (IOException | IllegalArgumentException e) {
            return error(e);
        }
    }

    @Tool(description = "Edit a document by inserting text at specific 1-indexed line numbers.")
    public String editDocument(
            @ToolParam(description = "Path of the document to be edited") String fileName,
            @ToolParam(description = "Map of line number (1-indexed) to the text inserted at that line") Map<Integer, String> inserts) {
        try {
            Path path = WorkspacePaths.resolve(workspace, fileName);
            if (!Files.isRegularFile(path)) {
                return "Error: File " + fileName + " not found";
            }
            var lines = new ArrayList<>(Files.readAllLines(path, StandardCharsets.UTF_8));
            for (var entry : new TreeMap<>(inserts).entrySet()) {
                int lineNumber = entry.getKey();
                if (lineNumber < 1 || lineNumber > lines.size() + 1) {
                    return "Error: Line number " + lineNumber + " is out of range.";
                }
                lines.add(lineNumber - 1, entry.getValue());
            }
            Files.write(path, lines, StandardCharsets.UTF_8);
            return "Document edited and saved to " + fileName;
        } catch (IOException | IllegalArgumentException e) {
            return error(e);
        }
    }

    @Tool(description = "List all documents in the workspace.")
    public List<String> listDocuments() {
        if (!Files.isDirectory(workspace)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(workspace)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> workspace.relativize(p).toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list workspace {}: {}", workspace, e.getMessage());
            return List.of();
        }
    }

    private void write(String fileName, String content) throws IOException {
        Path path = WorkspacePaths.resolve(workspace, fileName);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private String error(Exception e) {
        log.debug("Document tool error in {}: {}", workspace, e.getMessage());
        return "Error: " + e.getMessage();
    }
}
