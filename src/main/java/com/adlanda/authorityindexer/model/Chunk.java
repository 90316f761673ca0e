package com.adlanda.authorityindexer.model;

/**
 * A bounded segment of an authority document, ready to be embedded.
 *
 * @param text     The chunk text (never blank)
 * @param metadata Document metadata plus position of this chunk
 * @param stringId Deterministic id derived from source type, citation and chunk index
 */
public record Chunk(
        String text,
        ChunkMetadata metadata,
        String stringId
) {
    public Chunk {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Chunk text must not be blank");
        }
    }

    /**
     * Returns a copy of this chunk whose text is cut to at most {@code maxChars} characters,
     * one fewer when the cut would fall inside a surrogate pair.
     * Returns this chunk unchanged when it already fits.
     */
    public Chunk truncate(int maxChars) {
        if (text.length() <= maxChars) {
            return this;
        }
        int end = maxChars;
        // never split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return new Chunk(text.substring(0, end), metadata, stringId);
    }

    public int length() {
        return text.length();
    }
}
