package com.sysmuse.consolidation.service;

import com.sysmuse.consolidation.ConfigurationException;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.HandlerRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the input files of a run.
 */
public final class FileDiscovery {

    private FileDiscovery() {
    }

    public static List<Path> listFiles(ProcessingConfig config) {
        return listFiles(config.getInputFolder(), config.isRecursive(), config.getFileTypeFilter());
    }

    /**
     * Regular files under the folder whose extension is in the filter, sorted by path.
     *
     * @param filter extensions to keep; null means every supported extension
     */
    public static List<Path> listFiles(Path folder, boolean recursive, List<String> filter) {
        Set<String> extensions = new HashSet<>(normalizeFilter(filter));
        if (!Files.isDirectory(folder)) {
            throw new ConfigurationException("Input folder does not exist or is not a directory: " + folder);
        }
        try (Stream<Path> paths = recursive ? Files.walk(folder) : Files.list(folder)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> extensions.contains(HandlerRegistry.extensionOf(path)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files in " + folder, e);
        }
    }

    /**
     * Lower-case extensions without dots. Any extension without a handler is rejected.
     */
    public static List<String> normalizeFilter(List<String> filter) {
        if (filter == null) {
            return HandlerRegistry.supportedExtensions();
        }
        List<String> normalized = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        for (String extension : filter) {
            String ext = HandlerRegistry.normalizeExtension(extension);
            if (!HandlerRegistry.isSupported(ext)) {
                unsupported.add(ext);
            } else if (!normalized.contains(ext)) {
                normalized.add(ext);
            }
        }
        if (!unsupported.isEmpty()) {
            throw new ConfigurationException("Unsupported file types in filter: " + unsupported +
                    ". Supported: " + HandlerRegistry.supportedExtensions());
        }
        return normalized;
    }

    /**
     * Provenance label of a file: its path relative to the input folder, '/' separated.
     */
    public static String sourceFilePath(Path inputFolder, Path file) {
        Path relative;
        try {
            relative = inputFolder.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            return file.getFileName().toString();
        }
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
