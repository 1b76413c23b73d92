package com.hwapi.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads database snapshots from the classpath or the filesystem.
 *
 * <p>A location starting with {@code classpath:} names a resource; anything else is a path.
 */
public final class DatabaseResources {

    /** Prefix marking a classpath resource location. */
    public static final String CLASSPATH_PREFIX = "classpath:";

    private DatabaseResources() {
        // Utility class
    }

    /**
     * Reads a location as raw bytes.
     *
     * @param location {@code classpath:} resource or file path
     * @return content
     * @throws NoSuchFileException if the resource or file does not exist
     * @throws IOException if reading fails
     */
    public static byte[] readBytes(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            try (InputStream in = DatabaseResources.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new NoSuchFileException(location);
                }
                return in.readAllBytes();
            }
        }
        return Files.readAllBytes(Path.of(location));
    }

    /**
     * Reads a location as UTF-8 text.
     *
     * @param location {@code classpath:} resource or file path
     * @return content
     * @throws NoSuchFileException if the resource or file does not exist
     * @throws IOException if reading fails
     */
    public static String readString(String location) throws IOException {
        return new String(readBytes(location), StandardCharsets.UTF_8);
    }
}
