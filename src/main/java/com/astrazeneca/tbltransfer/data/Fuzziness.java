package com.astrazeneca.tbltransfer.data;

/**
 * Boundary precision of a feature location, GenBank "&lt;" and "&gt;" notation.
 */
public enum Fuzziness {
    EXACT(""),
    /**
     * The feature extends beyond the boundary to the left ("&lt;123"), 5' partial.
     */
    LESS_THAN("<"),
    /**
     * The feature extends beyond the boundary to the right ("&gt;456"), 3' partial.
     */
    GREATER_THAN(">");

    public final String marker;

    Fuzziness(String marker) {
        this.marker = marker;
    }

    public static Fuzziness fromMarker(char c) {
        switch (c) {
            case '<': return LESS_THAN;
            case '>': return GREATER_THAN;
            default: return EXACT;
        }
    }
}
