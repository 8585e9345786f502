package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.FeatureTable;
import com.astrazeneca.tbltransfer.exception.UnmatchedChromosomeException;
import com.astrazeneca.tbltransfer.printers.RunSummary;
import htsjdk.samtools.reference.ReferenceSequence;

import java.io.File;
import java.util.*;
import java.util.function.Function;

import static com.astrazeneca.tbltransfer.Utils.printTime;
import static com.astrazeneca.tbltransfer.Utils.sameSequence;

/**
 * Pairs reference chromosomes (feature table + reference sequence) with target sequences.
 * Explicit pairs from the configuration take precedence, the other tables are matched by name or by order.
 */
public class ChromosomeMatcher {
    private final Configuration config;

    public ChromosomeMatcher(Configuration config) {
        this.config = config;
    }

    /**
     * @param tables reference tables in input order
     * @param refSequences reference sequences
     * @param altSequences target sequences in input order
     * @param outputs output file of a target sequence name
     * @param summary receives unmatched chromosomes when they are allowed
     * @return pairs in the order of the tables
     * @throws UnmatchedChromosomeException if a table has no target and unmatched chromosomes aren't allowed
     */
    public List<ChromosomePair> match(List<FeatureTable> tables, List<ReferenceSequence> refSequences,
                                      List<ReferenceSequence> altSequences, Function<String, File> outputs,
                                      RunSummary summary) {
        List<ChromosomePair> pairs = new ArrayList<>();
        Map<String, String> unmatched = new LinkedHashMap<>();
        Map<String, String> usedTargets = new HashMap<>();

        for (int i = 0; i < tables.size(); i++) {
            FeatureTable table = tables.get(i);
            ReferenceSequence ref = findSequence(table.seqId, refSequences);
            String chromosome = ref != null ? ref.getName() : table.seqId;
            if (isExcluded(table.seqId, chromosome)) {
                printTime(config.y, "Chromosome " + chromosome + " is excluded");
                continue;
            }
            if (ref == null) {
                unmatched.put(table.seqId, "no reference sequence matches table " + table.seqId);
                continue;
            }
            ReferenceSequence alt = findTarget(table, ref, i, altSequences, unmatched);
            if (alt == null) {
                continue;
            }
            String previous = usedTargets.putIfAbsent(alt.getName(), chromosome);
            if (previous != null) {
                unmatched.put(chromosome, "target " + alt.getName() + " is already paired with " + previous);
                continue;
            }
            pairs.add(ChromosomePair.toAlign(table, ref, alt, outputs.apply(alt.getName())));
        }

        if (!unmatched.isEmpty()) {
            if (config.strictChromosomes) {
                throw new UnmatchedChromosomeException(unmatched.keySet());
            }
            for (Map.Entry<String, String> entry : unmatched.entrySet()) {
                System.err.println("WARNING: chromosome " + entry.getKey() + " is skipped: " + entry.getValue());
                summary.addUnmatched(entry.getKey(), entry.getValue());
            }
        }
        return pairs;
    }

    private ReferenceSequence findTarget(FeatureTable table, ReferenceSequence ref, int index,
                                        List<ReferenceSequence> altSequences, Map<String, String> unmatched) {
        String explicit = config.chromosomePairs.get(ref.getName());
        if (explicit == null) {
            explicit = config.chromosomePairs.get(table.seqId);
        }
        if (explicit != null) {
            for (ReferenceSequence alt : altSequences) {
                if (alt.getName().equals(explicit)) {
                    return alt;
                }
            }
            unmatched.put(ref.getName(), "target " + explicit + " given for " + ref.getName() + " is not in the input");
            return null;
        }

        ReferenceSequence alt = null;
        if (config.chromosomeMatching == Configuration.ChromosomeMatching.ORDER) {
            if (index < altSequences.size()) {
                alt = altSequences.get(index);
            }
        } else {
            alt = findSequence(ref.getName(), altSequences);
            if (alt == null) {
                alt = findSequence(table.seqId, altSequences);
            }
        }
        if (alt == null) {
            unmatched.put(ref.getName(), config.chromosomeMatching == Configuration.ChromosomeMatching.ORDER
                    ? "there are only " + altSequences.size() + " target sequence(s)"
                    : "no target sequence is named " + ref.getName());
        }
        return alt;
    }

    private boolean isExcluded(String tableId, String chromosome) {
        return config.excludedChromosomes.contains(tableId) || config.excludedChromosomes.contains(chromosome);
    }

    static ReferenceSequence findSequence(String id, List<ReferenceSequence> sequences) {
        for (ReferenceSequence sequence : sequences) {
            if (sameSequence(id, sequence.getName())) {
                return sequence;
            }
        }
        return null;
    }
}
