package com.codeact.sandbox;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code which}-style lookup of executables on a search path.
 */
final class Executables {

    private Executables() {}

    static Optional<Path> resolve(String executable, String searchPath) {
        if (executable.contains(File.separator)) {
            Path direct = Path.of(executable);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        if (searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
