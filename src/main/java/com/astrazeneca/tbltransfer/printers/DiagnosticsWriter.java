package com.astrazeneca.tbltransfer.printers;

import com.astrazeneca.tbltransfer.exception.InputFileException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the machine readable list of notes as a tab separated file with a header row.
 */
public class DiagnosticsWriter {

    public void write(List<Diagnostic> diagnostics, File file) {
        try (PrintWriter writer = new PrintWriter(new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)))) {
            write(diagnostics, writer);
            if (writer.checkError()) {
                throw new InputFileException(file.getPath(), "Write error.");
            }
        } catch (FileNotFoundException e) {
            throw new InputFileException(file.getPath(), e);
        }
    }

    public void write(List<Diagnostic> diagnostics, PrintWriter writer) {
        writer.print(Diagnostic.HEADER + "\n");
        for (Diagnostic diagnostic : diagnostics) {
            writer.print(diagnostic + "\n");
        }
        writer.flush();
    }
}
