package com.astrazeneca.tbltransfer.aligners;

import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;

/**
 * Capability of producing a base level alignment of two sequences. Implementations wrap external tools.
 * An interrupted call must stop the tool and fail with
 * {@link com.astrazeneca.tbltransfer.exception.AlignmentFailedException}.
 */
public interface Aligner {

    /**
     * @param refName name given to the reference row of the result
     * @param refBases ungapped reference sequence
     * @param altName name given to the target row of the result, differs from refName
     * @param altBases ungapped target sequence
     * @return alignment with rows named refName and altName
     */
    PairwiseAlignment align(String refName, String refBases, String altName, String altBases);
}
