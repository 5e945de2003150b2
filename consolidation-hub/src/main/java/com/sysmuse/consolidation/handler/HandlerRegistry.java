package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.UnsupportedFormatException;

import java.nio.file.Path;
import java.util.*;
import java.util.function.Supplier;

/**
 * Closed mapping from file extension to handler. Instances are created on first
 * use and reused for every later file of the same extension.
 */
public class HandlerRegistry {

    private static final Map<String, Supplier<FileHandler>> CONSTRUCTORS;

    static {
        Map<String, Supplier<FileHandler>> constructors = new LinkedHashMap<>();
        constructors.put("csv", CsvHandler::new);
        constructors.put("xlsx", XlsxHandler::new);
        constructors.put("json", JsonHandler::new);
        CONSTRUCTORS = Collections.unmodifiableMap(constructors);
    }

    private final Map<String, FileHandler> handlers = new HashMap<>();

    /**
     * Supported extensions in registration order.
     */
    public static List<String> supportedExtensions() {
        return new ArrayList<>(CONSTRUCTORS.keySet());
    }

    public static boolean isSupported(String extension) {
        return extension != null && CONSTRUCTORS.containsKey(normalizeExtension(extension));
    }

    /**
     * Lower-case extension of a file name without the dot; empty when there is none.
     */
    public static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String normalizeExtension(String extension) {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        while (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        return ext;
    }

    /**
     * Handler for an extension such as "csv", ".CSV" or "Json".
     *
     * @throws UnsupportedFormatException when no handler exists for the extension
     */
    public FileHandler getHandler(String extension) {
        String ext = extension == null ? "" : normalizeExtension(extension);
        Supplier<FileHandler> constructor = CONSTRUCTORS.get(ext);
        if (constructor == null) {
            throw new UnsupportedFormatException(ext, "Unsupported file format: ." + ext +
                    ". Supported: " + supportedExtensions());
        }
        return handlers.computeIfAbsent(ext, key -> constructor.get());
    }

    public FileHandler getHandler(Path path) {
        return getHandler(extensionOf(path));
    }
}
