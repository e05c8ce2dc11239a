package com.hartwig.minijd.session;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.hartwig.minijd.format.FormatString;
import com.hartwig.minijd.format.SymbolTable;
import com.hartwig.minijd.template.EmbeddedFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the embedded files of a script into a directory. All file paths are known before any data is resolved, so files
 * may reference each other.
 */
class EmbeddedFileWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddedFileWriter.class);

    /**
     * @param symbolName maps an embedded file name to the symbol holding its path, such as {@code Task.File.Run}
     * @return the given symbols plus one symbol per written file
     */
    SymbolTable write(List<EmbeddedFile> files, Path directory, SymbolTable symbols, Function<String, String> symbolName)
            throws IOException {
        if (files.isEmpty()) {
            return symbols;
        }
        Files.createDirectories(directory);
        var paths = new LinkedHashMap<EmbeddedFile, Path>();
        var fileSymbols = new LinkedHashMap<String, String>();
        for (EmbeddedFile file : files) {
            var path = file.filename().isPresent()
                    ? directory.resolve(file.filename().get())
                    : Files.createTempFile(directory, file.name() + "_", "");
            paths.put(file, path.toAbsolutePath());
            fileSymbols.put(symbolName.apply(file.name()), path.toAbsolutePath().toString());
        }
        var scope = symbols.withAll(fileSymbols);
        for (Map.Entry<EmbeddedFile, Path> entry : paths.entrySet()) {
            var file = entry.getKey();
            Files.writeString(entry.getValue(), FormatString.resolve(file.data(), scope), StandardCharsets.UTF_8);
            if (file.runnable()) {
                makeRunnable(entry.getValue());
            }
            LOGGER.debug("Wrote embedded file [{}] to {}", file.name(), entry.getValue());
        }
        return scope;
    }

    private static void makeRunnable(Path path) throws IOException {
        try {
            var permissions = new HashSet<>(Files.getPosixFilePermissions(path));
            permissions.add(PosixFilePermission.OWNER_EXECUTE);
            permissions.add(PosixFilePermission.GROUP_EXECUTE);
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            if (!path.toFile().setExecutable(true)) {
                throw new IOException("Could not make " + path + " executable");
            }
        }
    }
}
