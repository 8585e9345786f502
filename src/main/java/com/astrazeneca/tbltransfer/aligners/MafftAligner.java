package com.astrazeneca.tbltransfer.aligners;

import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.exception.AlignmentFailedException;
import com.astrazeneca.tbltransfer.exception.TblTransferException;
import com.astrazeneca.tbltransfer.parsers.FastaLoader;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Aligns two sequences with the external MAFFT program. Each call runs in its own temporary files, so
 * several chromosomes may be aligned at the same time.
 */
public class MafftAligner implements Aligner {
    static final String REF_ID = "ref";
    static final String ALT_ID = "alt";
    private static final int FASTA_LINE_LENGTH = 60;

    private final String executable;
    private final long timeoutSeconds;

    /**
     * @param executable path to mafft
     * @param timeoutSeconds time limit of one alignment, 0 - no limit
     */
    public MafftAligner(String executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    List<String> command(File input) {
        return new ArrayList<>(Arrays.asList(executable, "--auto", "--preservecase", "--quiet",
                "--thread", "1", input.getPath()));
    }

    @Override
    public PairwiseAlignment align(String refName, String refBases, String altName, String altBases) {
        File input = null;
        File output = null;
        Process process = null;
        try {
            input = File.createTempFile("tbltransfer", ".fasta");
            output = File.createTempFile("tbltransfer", ".aligned.fasta");
            writeFasta(input, refBases, altBases);

            process = new ProcessBuilder(command(input))
                    .redirectOutput(output)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
            if (timeoutSeconds > 0) {
                if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                    throw new AlignmentFailedException(refName, altName,
                            executable + " did not finish in " + timeoutSeconds + " seconds");
                }
            } else {
                process.waitFor();
            }
            if (process.exitValue() != 0) {
                throw new AlignmentFailedException(refName, altName,
                        executable + " exited with code " + process.exitValue());
            }
            MultipleAlignment aligned = new FastaLoader().readAlignment(output);
            return PairwiseAlignment.project(refName, aligned.row(REF_ID), altName, aligned.row(ALT_ID));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlignmentFailedException(refName, altName, "alignment was cancelled", e);
        } catch (IOException e) {
            throw new AlignmentFailedException(refName, altName, "couldn't run " + executable, e);
        } catch (TblTransferException e) {
            if (e instanceof AlignmentFailedException) {
                throw e;
            }
            throw new AlignmentFailedException(refName, altName, e.getMessage(), e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    private void writeFasta(File file, String refBases, String altBases) throws IOException {
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.US_ASCII))) {
            writeRecord(writer, REF_ID, refBases);
            writeRecord(writer, ALT_ID, altBases);
        }
    }

    private void writeRecord(Writer writer, String id, String bases) throws IOException {
        writer.write(">" + id + "\n");
        for (int i = 0; i < bases.length(); i += FASTA_LINE_LENGTH) {
            writer.write(bases, i, Math.min(FASTA_LINE_LENGTH, bases.length() - i));
            writer.write("\n");
        }
    }

    private static void deleteQuietly(File file) {
        if (file != null && file.exists() && !file.delete()) {
            file.deleteOnExit();
        }
    }
}
