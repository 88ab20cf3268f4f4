// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.process;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Reads memory sizes of the current process from a Linux {@code /proc/<pid>/status} file.
 * Sizes in that file are given in kibibytes, e.g. {@code VmRSS:     10240 kB}.
 */
final class ProcStatusReader {

    static final Path SELF_STATUS = Path.of("/proc/self/status");

    static final String RESIDENT_MEMORY = "VmRSS";
    static final String VIRTUAL_MEMORY = "VmSize";

    private final Path statusFile;

    ProcStatusReader(@NonNull Path statusFile) {
        this.statusFile = Objects.requireNonNull(statusFile, "status file must not be null");
    }

    /**
     * @return {@code true} if the status file can be read and contains both memory fields
     */
    boolean isAvailable() {
        if (!Files.isReadable(statusFile)) {
            return false;
        }
        try {
            List<String> lines = readLines();
            return find(lines, RESIDENT_MEMORY).isPresent() && find(lines, VIRTUAL_MEMORY).isPresent();
        } catch (UncheckedIOException e) {
            return false;
        }
    }

    /**
     * Reads a size field in bytes.
     *
     * @param field the field name, e.g. {@value #RESIDENT_MEMORY}
     * @return the size in bytes
     * @throws UncheckedIOException  if the file can't be read
     * @throws IllegalStateException if the field is missing
     */
    long readBytes(@NonNull String field) {
        return find(readLines(), field)
                .orElseThrow(() -> new IllegalStateException("Field " + field + " not found in " + statusFile));
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(statusFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static OptionalLong find(List<String> lines, String field) {
        final String prefix = field + ':';
        for (String line : lines) {
            if (line.startsWith(prefix)) {
                String[] parts = line.substring(prefix.length()).trim().split("\\s+");
                try {
                    long value = Long.parseLong(parts[0]);
                    boolean kibibytes = parts.length > 1 && parts[1].equalsIgnoreCase("kB");
                    return OptionalLong.of(kibibytes ? value * 1024L : value);
                } catch (NumberFormatException e) {
                    return OptionalLong.empty();
                }
            }
        }
        return OptionalLong.empty();
    }
}
